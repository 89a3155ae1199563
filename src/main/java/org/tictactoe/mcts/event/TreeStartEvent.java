package org.tictactoe.mcts.event;

import org.tictactoe.util.observer.Event;

public class TreeStartEvent extends Event {
}
