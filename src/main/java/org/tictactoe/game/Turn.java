package org.tictactoe.game;

public enum Turn {
    X(Cell.X), O(Cell.O);

    private final Cell mark;

    Turn(Cell mark) {
        this.mark = mark;
    }

    public Cell getMark() {
        return mark;
    }

    public Turn opposite() {
        return this == X ? O : X;
    }
}
