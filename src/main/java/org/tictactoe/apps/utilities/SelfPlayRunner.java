package org.tictactoe.apps.utilities;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tictactoe.game.GameState;
import org.tictactoe.game.Move;
import org.tictactoe.game.Turn;
import org.tictactoe.mcts.MCTSPlayer;
import org.tictactoe.mcts.MctsConfig;
import org.tictactoe.mcts.model.MonteCarloTreeSearch;
import org.tictactoe.mcts.observer.TreeObserver;

/**
 * Plays the engine against itself: both sides always take the engine's top move.
 */
public class SelfPlayRunner {

    private static final Logger LOGGER = LogManager.getLogger();

    public static void main(String[] args) {
        int games = args.length > 0 ? Integer.parseInt(args[0]) : 1;
        MctsConfig config = MctsConfig.fromEnvironment();

        int xWins = 0;
        int oWins = 0;
        int draws = 0;
        for (int i = 0; i < games; i++) {
            MCTSPlayer player = new MCTSPlayer(config);
            player.addObserver(new TreeObserver());
            GameState result = playGame(player);
            Turn winner = player.getSearch().getWinner();
            if (winner == Turn.X) {
                xWins++;
            } else if (winner == Turn.O) {
                oWins++;
            } else {
                draws++;
            }
            LOGGER.info("Game " + (i + 1) + " finished: " + result);
        }
        LOGGER.info("X wins: " + xWins + ", O wins: " + oWins + ", draws: " + draws);
    }

    /**
     * Trains the player, then plays one full game and returns the final position.
     */
    public static GameState playGame(MCTSPlayer player) {
        player.metaGame();
        MonteCarloTreeSearch search = player.getSearch();
        while (!search.isTerminal()) {
            Move move = player.selectMove();
            player.observeMove(move);
            LOGGER.info(search.getCurrentState().getTurn().opposite() + " plays " + move + " -> " + search.getCurrentState());
        }
        Turn winner = search.getWinner();
        LOGGER.info(winner == null ? "Draw" : winner + " wins");
        return search.getCurrentState();
    }
}
