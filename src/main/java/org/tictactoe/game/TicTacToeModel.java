package org.tictactoe.game;

import java.util.ArrayList;
import java.util.List;

public class TicTacToeModel implements GameModel {

    // Rows, columns, then both diagonals; each line is three (row, column) pairs.
    private static final int[][][] LINES = {
            {{0, 0}, {0, 1}, {0, 2}},
            {{1, 0}, {1, 1}, {1, 2}},
            {{2, 0}, {2, 1}, {2, 2}},
            {{0, 0}, {1, 0}, {2, 0}},
            {{0, 1}, {1, 1}, {2, 1}},
            {{0, 2}, {1, 2}, {2, 2}},
            {{0, 0}, {1, 1}, {2, 2}},
            {{0, 2}, {1, 1}, {2, 0}}
    };

    @Override
    public GameState getInitialState(Turn firstMover) {
        return GameState.empty(firstMover);
    }

    @Override
    public List<Move> getLegalMoves(GameState state) {
        List<Move> moves = new ArrayList<>();
        for (int row = 0; row < GameState.SIZE; row++) {
            for (int column = 0; column < GameState.SIZE; column++) {
                if (state.getCell(row, column) == Cell.EMPTY) {
                    moves.add(new Move(row, column));
                }
            }
        }
        return moves;
    }

    @Override
    public GameState getNextState(GameState state, Move move) {
        if (!move.isOnBoard()) {
            throw new IllegalMoveException(move, "coordinates out of range");
        }
        if (state.getCell(move.getRow(), move.getColumn()) != Cell.EMPTY) {
            throw new IllegalMoveException(move, "cell already occupied");
        }
        Cell[][] board = state.getBoard();
        board[move.getRow()][move.getColumn()] = state.getTurn().getMark();
        return new GameState(board, state.getTurn().opposite());
    }

    /**
     * Returns the side whose mark fills a complete line, i.e. the player who
     * has just moved, or {@code null} if no line is complete.
     * <p>
     * Positions searched past a win can hold a line for both sides; the side
     * to move is reported then, since its line was completed first.
     */
    @Override
    public Turn getWinner(GameState state) {
        Turn toMove = state.getTurn();
        if (hasLine(state, toMove.getMark())) {
            return toMove;
        }
        if (hasLine(state, toMove.opposite().getMark())) {
            return toMove.opposite();
        }
        return null;
    }

    private static boolean hasLine(GameState state, Cell mark) {
        for (int[][] line : LINES) {
            if (state.getCell(line[0][0], line[0][1]) == mark
                    && state.getCell(line[1][0], line[1][1]) == mark
                    && state.getCell(line[2][0], line[2][1]) == mark) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean isTerminal(GameState state) {
        return getWinner(state) != null || getLegalMoves(state).isEmpty();
    }

    @Override
    public boolean isDraw(GameState state) {
        return getWinner(state) == null && getLegalMoves(state).isEmpty();
    }
}
