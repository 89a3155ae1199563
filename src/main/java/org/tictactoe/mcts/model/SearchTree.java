package org.tictactoe.mcts.model;

import org.tictactoe.game.GameModel;
import org.tictactoe.game.GameState;
import org.tictactoe.game.Move;
import org.tictactoe.mcts.model.strategy.PoolOfStrategies;

public class SearchTree {

    private final GameModel gameModel;
    private SearchTreeNode root;
    private final PoolOfStrategies strategies;

    public SearchTree(GameModel gameModel, GameState rootState, PoolOfStrategies strategies) {
        this.gameModel = gameModel;
        this.strategies = strategies;
        root = new SearchTreeNode(this, rootState, null);
    }

    public void advance(Move move) {
        getStrategies().getCuttingStrategy().execute(this, move);
    }

    /**
     * Runs one search iteration: selection, expansion, playout and backpropagation.
     *
     * @return the node the playout started from
     */
    public SearchTreeNode grow() {
        if (!root.isExpanded()) {
            getStrategies().getExpansionStrategy().expand(root);
        }

        // Спуститься до узла, с которого начнётся розыгрыш
        SearchTreeNode selectedNode = getStrategies().getSelectionStrategy().execute(root);

        // Раскрыть уже посещённый узел и выбрать случайное дитё
        selectedNode = getStrategies().getExpansionStrategy().execute(selectedNode);

        // Отыграть с него
        double playoutScore = getStrategies().getPlayoutStrategy().execute(selectedNode);

        // Распространить полученные очки
        getStrategies().getBackPropagationStrategy().execute(selectedNode, playoutScore);
        return selectedNode;
    }

    public Move getBestMove() {
        if (!root.isExpanded()) {
            getStrategies().getExpansionStrategy().expand(root);
        }
        return getStrategies().getSelectionStrategyForMatch().execute(root);
    }

    public boolean isComplete() {
        return root.isComplete();
    }

    public GameModel getGameModel() {
        return gameModel;
    }

    public SearchTreeNode getRoot() {
        return root;
    }

    public void setRoot(SearchTreeNode newRoot) {
        root = newRoot;
    }

    public PoolOfStrategies getStrategies() {
        return strategies;
    }
}
