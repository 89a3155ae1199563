package org.tictactoe.game;

public enum Cell {
    EMPTY, X, O
}
