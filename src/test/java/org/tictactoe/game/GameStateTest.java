package org.tictactoe.game;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GameStateTest {

    @Test
    void shouldNotExposeInternalBoard() {
        GameState state = GameState.empty(Turn.X);

        Cell[][] board = state.getBoard();
        board[0][0] = Cell.O;

        assertEquals(Cell.EMPTY, state.getCell(0, 0));
    }

    @Test
    void shouldCopyBoardOnConstruction() {
        Cell[][] board = GameState.empty(Turn.X).getBoard();
        GameState state = new GameState(board, Turn.X);

        board[2][2] = Cell.X;

        assertEquals(Cell.EMPTY, state.getCell(2, 2));
    }

    @Test
    void shouldCompareBoardAndTurn() {
        GameState a = GameState.parse(Turn.X, "X..", "...", "..O");
        GameState b = GameState.parse(Turn.O, "X..", "...", "..O");

        assertNotEquals(a, b);
        assertTrue(a.sameBoard(b));
        assertEquals(a, GameState.parse(Turn.X, "X..", "...", "..O"));
        assertEquals(a.hashCode(), GameState.parse(Turn.X, "X..", "...", "..O").hashCode());
    }

    @Test
    void shouldRenderRows() {
        GameState state = GameState.parse(Turn.O, "X..", ".O.", "..X");

        assertArrayEquals(new String[] {"X..", ".O.", "..X"}, state.toRows());
    }
}
