package org.tictactoe.game;

import java.util.Arrays;

/**
 * Immutable board position together with the side to move.
 * The grid is copied on the way in and on the way out, so sibling states
 * derived from a shared ancestor never alias each other.
 */
public final class GameState {

    public static final int SIZE = 3;

    private final Cell[][] board;
    private final Turn turn;

    public GameState(Cell[][] board, Turn turn) {
        if (board.length != SIZE) {
            throw new IllegalArgumentException("Board must have " + SIZE + " rows");
        }
        this.board = new Cell[SIZE][];
        for (int row = 0; row < SIZE; row++) {
            if (board[row].length != SIZE) {
                throw new IllegalArgumentException("Row " + row + " must have " + SIZE + " cells");
            }
            this.board[row] = board[row].clone();
        }
        this.turn = turn;
    }

    public static GameState empty(Turn firstMover) {
        Cell[][] board = new Cell[SIZE][SIZE];
        for (Cell[] row : board) {
            Arrays.fill(row, Cell.EMPTY);
        }
        return new GameState(board, firstMover);
    }

    /**
     * Builds a state from rows written with 'X', 'O' and '.' for empty cells.
     */
    public static GameState parse(Turn turn, String... rows) {
        Cell[][] board = new Cell[SIZE][SIZE];
        for (int row = 0; row < SIZE; row++) {
            for (int column = 0; column < SIZE; column++) {
                char ch = rows[row].charAt(column);
                if (ch == 'X') {
                    board[row][column] = Cell.X;
                } else if (ch == 'O') {
                    board[row][column] = Cell.O;
                } else {
                    board[row][column] = Cell.EMPTY;
                }
            }
        }
        return new GameState(board, turn);
    }

    public Cell getCell(int row, int column) {
        return board[row][column];
    }

    public Cell[][] getBoard() {
        Cell[][] copy = new Cell[SIZE][];
        for (int row = 0; row < SIZE; row++) {
            copy[row] = board[row].clone();
        }
        return copy;
    }

    public Turn getTurn() {
        return turn;
    }

    public boolean sameBoard(GameState other) {
        return Arrays.deepEquals(board, other.board);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GameState)) {
            return false;
        }
        GameState other = (GameState) o;
        return turn == other.turn && Arrays.deepEquals(board, other.board);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.deepHashCode(board) + turn.hashCode();
    }

    public String[] toRows() {
        String[] rows = new String[SIZE];
        for (int row = 0; row < SIZE; row++) {
            StringBuilder sb = new StringBuilder(SIZE);
            for (Cell cell : board[row]) {
                sb.append(cell == Cell.EMPTY ? '.' : cell.name().charAt(0));
            }
            rows[row] = sb.toString();
        }
        return rows;
    }

    @Override
    public String toString() {
        return String.join("/", toRows()) + " " + turn + " to move";
    }
}
