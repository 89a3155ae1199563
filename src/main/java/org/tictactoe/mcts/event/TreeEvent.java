package org.tictactoe.mcts.event;

import org.tictactoe.mcts.model.SearchTree;
import org.tictactoe.util.observer.Event;

public class TreeEvent extends Event {

    private final SearchTree tree;
    private final int turnNumber;

    public TreeEvent(SearchTree tree, int turnNumber) {
        this.tree = tree;
        this.turnNumber = turnNumber;
    }

    public SearchTree getTree() {
        return tree;
    }

    public int getTurnNumber() {
        return turnNumber;
    }
}
