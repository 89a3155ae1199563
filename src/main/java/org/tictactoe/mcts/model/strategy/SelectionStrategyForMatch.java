package org.tictactoe.mcts.model.strategy;

import org.tictactoe.game.GameState;
import org.tictactoe.game.Move;
import org.tictactoe.mcts.model.SearchTreeNode;

/**
 * Chooses the move actually played: the most visited child of the root.
 */
public class SelectionStrategyForMatch {

    public Move execute(SearchTreeNode node) {
        if (!node.hasChildren()) {
            throw new IllegalStateException("No moves available from " + node.getState());
        }
        int bestNumVisits = -1;
        SearchTreeNode bestChild = null;
        for (SearchTreeNode child : node.getChildren()) {
            int numVisits = child.getStatistics().getNumVisits();
            if (numVisits > bestNumVisits) {
                bestNumVisits = numVisits;
                bestChild = child;
            }
        }
        return findChangedCell(node.getState(), bestChild.getState());
    }

    static Move findChangedCell(GameState before, GameState after) {
        for (int row = 0; row < GameState.SIZE; row++) {
            for (int column = 0; column < GameState.SIZE; column++) {
                if (before.getCell(row, column) != after.getCell(row, column)) {
                    return new Move(row, column);
                }
            }
        }
        throw new IllegalStateException("Boards do not differ: " + before + " and " + after);
    }
}
