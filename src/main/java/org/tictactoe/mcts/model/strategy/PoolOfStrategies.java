package org.tictactoe.mcts.model.strategy;

import java.util.Random;

public class PoolOfStrategies {

    private final SelectionStrategy selectionStrategy;
    private final SelectionStrategyForMatch selectionStrategyForMatch;
    private final ExpansionStrategy expansionStrategy;
    private final PlayoutStrategy playoutStrategy;
    private final BackPropagationStrategy backPropagationStrategy;
    private final CuttingStrategy cuttingStrategy;

    public PoolOfStrategies(Random random) {
        this(SelectionStrategy.DEFAULT_EXPLORATION_CONSTANT, random);
    }

    public PoolOfStrategies(double explorationConstant, Random random) {
        selectionStrategy = new SelectionStrategy(explorationConstant);
        selectionStrategyForMatch = new SelectionStrategyForMatch();
        expansionStrategy = new ExpansionStrategy(random);
        playoutStrategy = new PlayoutStrategy(random);
        backPropagationStrategy = new BackPropagationStrategy();
        cuttingStrategy = new CuttingStrategy();
    }

    public SelectionStrategy getSelectionStrategy() {
        return selectionStrategy;
    }

    public SelectionStrategyForMatch getSelectionStrategyForMatch() {
        return selectionStrategyForMatch;
    }

    public ExpansionStrategy getExpansionStrategy() {
        return expansionStrategy;
    }

    public PlayoutStrategy getPlayoutStrategy() {
        return playoutStrategy;
    }

    public BackPropagationStrategy getBackPropagationStrategy() {
        return backPropagationStrategy;
    }

    public CuttingStrategy getCuttingStrategy() {
        return cuttingStrategy;
    }
}
