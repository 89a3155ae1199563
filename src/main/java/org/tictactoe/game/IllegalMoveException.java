package org.tictactoe.game;

/**
 * Thrown when a move targets a cell outside the board or one that is already occupied.
 */
public class IllegalMoveException extends IllegalArgumentException {

    private final transient Move move;

    public IllegalMoveException(Move move, String reason) {
        super("Illegal move " + move + ": " + reason);
        this.move = move;
    }

    public Move getMove() {
        return move;
    }
}
