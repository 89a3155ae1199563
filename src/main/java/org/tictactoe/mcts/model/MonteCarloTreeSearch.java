package org.tictactoe.mcts.model;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tictactoe.game.GameModel;
import org.tictactoe.game.GameState;
import org.tictactoe.game.Move;
import org.tictactoe.game.TicTacToeModel;
import org.tictactoe.game.Turn;
import org.tictactoe.mcts.MctsConfig;
import org.tictactoe.mcts.model.strategy.PoolOfStrategies;

import java.util.Random;

/**
 * Entry point of the engine: owns one search tree, trains it, picks moves and
 * follows the real game as it is played.
 *
 * <p>Instances are not thread-safe; every call blocks until it completes.
 */
public class MonteCarloTreeSearch {

    private static final Logger LOGGER = LogManager.getLogger();

    private final GameModel model;
    private final SearchTree tree;

    public MonteCarloTreeSearch(MctsConfig config) {
        this(new TicTacToeModel(), config.getFirstMover(), config.getExplorationConstant(), config.createRandom());
    }

    public MonteCarloTreeSearch(GameModel model, Turn firstMover, double explorationConstant, Random random) {
        this(model, model.getInitialState(firstMover), explorationConstant, random);
    }

    public MonteCarloTreeSearch(GameModel model, GameState startState, double explorationConstant, Random random) {
        this.model = model;
        tree = new SearchTree(model, startState, new PoolOfStrategies(explorationConstant, random));
    }

    /**
     * Runs a fixed number of search iterations against the current root.
     *
     * @return the number of iterations performed
     */
    public int train(int iterations) {
        if (iterations < 0) {
            throw new IllegalArgumentException("Iteration budget must not be negative: " + iterations);
        }
        long start = System.currentTimeMillis();
        for (int i = 0; i < iterations; i++) {
            tree.grow();
        }
        LOGGER.info("Processed " + iterations + " iterations in " + (System.currentTimeMillis() - start) + " ms");
        return iterations;
    }

    /**
     * Searches until the wall clock reaches {@code deadlineMillis} or the root position is over.
     *
     * @return the number of iterations performed
     */
    public int trainUntil(long deadlineMillis) {
        int iterations = 0;
        while (System.currentTimeMillis() < deadlineMillis && !tree.isComplete()) {
            iterations++;
            tree.grow();
        }
        LOGGER.info("Processed " + iterations + " iterations before deadline");
        return iterations;
    }

    public Move chooseMove() {
        return tree.getBestMove();
    }

    public void advance(Move move) {
        tree.advance(move);
    }

    public boolean isTerminal() {
        return model.isTerminal(getCurrentState());
    }

    public boolean isDraw() {
        return model.isDraw(getCurrentState());
    }

    public Turn getWinner() {
        return model.getWinner(getCurrentState());
    }

    public GameState getCurrentState() {
        return tree.getRoot().getState();
    }

    public SearchTree getTree() {
        return tree;
    }
}
