package org.tictactoe.mcts.model.strategy;

import org.tictactoe.mcts.model.NodeStatistics;
import org.tictactoe.mcts.model.SearchTreeNode;

/**
 * Descends from the root to the node that the next playout starts from.
 *
 * <p>While every child of the current node has been visited, the child with the
 * highest UCB1 score is taken. As soon as a node has an unvisited child, the first
 * such child in move order is returned; descent stops there for this iteration.
 */
public class SelectionStrategy {

    public static final double DEFAULT_EXPLORATION_CONSTANT = Math.sqrt(100);

    private final double explorationConstant;

    public SelectionStrategy() {
        this(DEFAULT_EXPLORATION_CONSTANT);
    }

    public SelectionStrategy(double explorationConstant) {
        this.explorationConstant = explorationConstant;
    }

    public SearchTreeNode execute(SearchTreeNode root) {
        SearchTreeNode node = root;
        while (node.hasChildren()) {
            SearchTreeNode unvisited = getFirstUnvisitedChild(node);
            if (unvisited != null) {
                return unvisited;
            }
            node = selectChild(node);
        }
        return node;
    }

    /**
     * Picks the child with the maximum UCB1 score; the first maximal child wins ties.
     */
    public SearchTreeNode selectChild(SearchTreeNode node) {
        double bestScore = Double.NEGATIVE_INFINITY;
        SearchTreeNode bestChild = null;
        for (SearchTreeNode child : node.getChildren()) {
            double score = getScore(node, child);
            if (bestChild == null || score > bestScore) {
                bestScore = score;
                bestChild = child;
            }
        }
        return bestChild;
    }

    public double getScore(SearchTreeNode parent, SearchTreeNode child) {
        NodeStatistics childStatistics = child.getStatistics();
        if (childStatistics.getNumVisits() == 0) {
            return Double.POSITIVE_INFINITY;
        }
        return getExploitationScore(childStatistics) + getExplorationScore(parent.getStatistics(), childStatistics);
    }

    private double getExploitationScore(NodeStatistics childStatistics) {
        return childStatistics.getWinRate();
    }

    private double getExplorationScore(NodeStatistics parentStatistics, NodeStatistics childStatistics) {
        return explorationConstant * Math.sqrt(Math.log(parentStatistics.getNumVisits()) / childStatistics.getNumVisits());
    }

    private static SearchTreeNode getFirstUnvisitedChild(SearchTreeNode node) {
        for (SearchTreeNode child : node.getChildren()) {
            if (child.getStatistics().getNumVisits() == 0) {
                return child;
            }
        }
        return null;
    }

    public double getExplorationConstant() {
        return explorationConstant;
    }
}
