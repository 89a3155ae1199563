package org.tictactoe.util.observer;

public interface Observer {
    void observe(Event event);
}
