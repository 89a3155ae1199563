package org.tictactoe.mcts.model.strategy;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tictactoe.game.GameState;
import org.tictactoe.game.Move;
import org.tictactoe.mcts.model.SearchTree;
import org.tictactoe.mcts.model.SearchTreeNode;

/**
 * Moves the root of the tree past a played move, keeping the matching subtree.
 */
public class CuttingStrategy {

    private static final Logger LOGGER = LogManager.getLogger();

    public void execute(SearchTree tree, Move move) {
        SearchTreeNode root = tree.getRoot();
        GameState nextState = tree.getGameModel().getNextState(root.getState(), move);

        SearchTreeNode newRoot = root.getChild(nextState);
        if (newRoot != null) {
            LOGGER.debug("Keeping subtree for " + move + " with " + newRoot.getStatistics().getNumVisits() + " visits");
            newRoot.detachFromParent();
        } else {
            LOGGER.debug("No subtree for " + move + ", starting from a fresh root");
            newRoot = new SearchTreeNode(tree, nextState, move);
        }
        tree.setRoot(newRoot);
    }
}
