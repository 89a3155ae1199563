package org.tictactoe.util.observer;

public interface Subject {
    void addObserver(Observer observer);
    void notifyObservers(Event event);
}
