package org.tictactoe.mcts.model;

import org.tictactoe.game.GameModel;
import org.tictactoe.game.GameState;
import org.tictactoe.game.Move;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class SearchTreeNode {

    private final SearchTree treeOwner;

    private final GameState state;
    private final Move precedingMove;

    private SearchTreeNode parent;
    private List<SearchTreeNode> children; // null until the node is expanded

    private final NodeStatistics statistics;

    public SearchTreeNode(SearchTree treeOwner, GameState state, Move precedingMove) {
        this.treeOwner = treeOwner;
        this.state = state;
        this.precedingMove = precedingMove;
        statistics = new NodeStatistics();
    }

    public GameModel getGameModel() {
        return treeOwner.getGameModel();
    }

    public boolean isExpanded() {
        return children != null;
    }

    public boolean hasChildren() {
        return children != null && !children.isEmpty();
    }

    public boolean isRoot() {
        return parent == null;
    }

    public boolean isComplete() {
        return getGameModel().isTerminal(getState());
    }

    public SearchTreeNode getParent() {
        return parent;
    }

    public void detachFromParent() {
        parent = null;
    }

    /**
     * Returns the children in move order, or {@code null} if the node has never been expanded.
     */
    public List<SearchTreeNode> getChildren() {
        return children == null ? null : Collections.unmodifiableList(children);
    }

    public SearchTreeNode getChild(GameState childState) {
        if (children == null) {
            return null;
        }
        return children.stream().filter(c -> c.getState().sameBoard(childState)).findFirst().orElse(null);
    }

    public void markExpanded() {
        if (children != null) {
            throw new IllegalStateException("Node is already expanded: " + state);
        }
        children = new ArrayList<>();
    }

    public SearchTreeNode createChild(Move move) {
        if (children == null) {
            throw new IllegalStateException("Children can only be created on an expanded node: " + state);
        }
        GameState nextState = getGameModel().getNextState(state, move);
        SearchTreeNode childNode = new SearchTreeNode(treeOwner, nextState, move);
        linkChildToParent(this, childNode);
        return childNode;
    }

    private static void linkChildToParent(SearchTreeNode parentNode, SearchTreeNode childNode) {
        childNode.parent = parentNode;
        parentNode.children.add(childNode);
    }

    public NodeStatistics getStatistics() {
        return statistics;
    }

    public GameState getState() {
        return state;
    }

    public Move getPrecedingMove() {
        return precedingMove;
    }

    @Override
    public String toString() {
        return state + " [" + statistics + "]";
    }
}
