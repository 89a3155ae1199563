package org.tictactoe.util.observer;

public abstract class Event {
}
