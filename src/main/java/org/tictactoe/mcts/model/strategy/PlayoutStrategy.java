package org.tictactoe.mcts.model.strategy;

import org.tictactoe.game.GameModel;
import org.tictactoe.game.GameState;
import org.tictactoe.game.Move;
import org.tictactoe.game.Turn;
import org.tictactoe.mcts.model.SearchTreeNode;

import java.util.List;
import java.util.Random;

public class PlayoutStrategy {

    public static final double WIN_SCORE = 1.0;
    public static final double DRAW_SCORE = 0.5;
    public static final double LOSS_SCORE = 0.0;

    private final Random random;

    public PlayoutStrategy(Random random) {
        this.random = random;
    }

    // Score is relative to the side to move at the start node
    public double execute(SearchTreeNode startNode) {
        GameModel model = startNode.getGameModel();
        GameState state = startNode.getState();
        Turn initialTurn = state.getTurn();

        Turn winner = model.getWinner(state);
        List<Move> moves = model.getLegalMoves(state);
        while (winner == null && !moves.isEmpty()) {
            state = model.getNextState(state, moves.get(random.nextInt(moves.size())));
            winner = model.getWinner(state);
            moves = model.getLegalMoves(state);
        }
        return score(winner, initialTurn);
    }

    static double score(Turn winner, Turn perspective) {
        if (winner == null) {
            return DRAW_SCORE;
        }
        return winner == perspective ? WIN_SCORE : LOSS_SCORE;
    }
}
