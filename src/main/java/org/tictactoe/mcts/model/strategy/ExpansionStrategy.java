package org.tictactoe.mcts.model.strategy;

import org.tictactoe.game.Move;
import org.tictactoe.mcts.model.SearchTreeNode;

import java.util.List;
import java.util.Random;

public class ExpansionStrategy {

    private final Random random;

    public ExpansionStrategy(Random random) {
        this.random = random;
    }

    /**
     * Grows the tree below a node that has already been played out once, and returns
     * a random new child to play out from. A node that has never been visited is
     * returned unchanged, so each node is expanded only after its own first playout.
     */
    public SearchTreeNode execute(SearchTreeNode node) {
        if (!isNodeNeedExpanded(node)) {
            return node;
        }
        if (!node.isExpanded()) {
            expand(node);
        }
        List<SearchTreeNode> children = node.getChildren();
        if (children.isEmpty()) {
            return node;
        }
        return children.get(random.nextInt(children.size()));
    }

    public void expand(SearchTreeNode node) {
        node.markExpanded();
        for (Move move : node.getGameModel().getLegalMoves(node.getState())) {
            node.createChild(move);
        }
    }

    private boolean isNodeNeedExpanded(SearchTreeNode node) {
        return node.getStatistics().getNumVisits() > 0;
    }
}
