package org.tictactoe.game;

import java.util.List;

public interface GameModel {
    GameState getInitialState(Turn firstMover);
    List<Move> getLegalMoves(GameState state);
    GameState getNextState(GameState state, Move move);
    Turn getWinner(GameState state);
    boolean isTerminal(GameState state);
    boolean isDraw(GameState state);
}
