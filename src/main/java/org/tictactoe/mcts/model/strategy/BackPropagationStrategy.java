package org.tictactoe.mcts.model.strategy;

import org.tictactoe.mcts.model.SearchTreeNode;

public class BackPropagationStrategy {

    // The same score is added at every node on the path, without flipping it per ply.
    public void execute(SearchTreeNode node, double playoutScore) {
        node.getStatistics().update(playoutScore);
        if (!node.isRoot()) {
            execute(node.getParent(), playoutScore);
        }
    }
}
