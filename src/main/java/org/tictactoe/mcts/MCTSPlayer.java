package org.tictactoe.mcts;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tictactoe.game.Move;
import org.tictactoe.mcts.event.TreeEvent;
import org.tictactoe.mcts.event.TreeStartEvent;
import org.tictactoe.mcts.model.MonteCarloTreeSearch;
import org.tictactoe.util.observer.Event;
import org.tictactoe.util.observer.Observer;
import org.tictactoe.util.observer.Subject;

import java.util.ArrayList;
import java.util.List;

public class MCTSPlayer implements Subject {

    private static final Logger LOGGER = LogManager.getLogger();

    private final MctsConfig config;
    private final List<Observer> observers = new ArrayList<>();

    private MonteCarloTreeSearch search = null;
    private int turnCount = 0;

    public MCTSPlayer(MctsConfig config) {
        this.config = config;
    }

    /**
     * Starts a new game and spends the upfront iteration budget on it.
     */
    public void metaGame() {
        search = new MonteCarloTreeSearch(config);
        turnCount = 0;
        notifyObservers(new TreeStartEvent());
        LOGGER.info("Training with " + config);
        search.train(config.getTrainingIterations());
    }

    public Move selectMove() {
        requireStarted();
        LOGGER.info("Starting turn " + turnCount);

        if (config.getMoveTimeMillis() > 0) {
            search.trainUntil(System.currentTimeMillis() + config.getMoveTimeMillis());
        }

        Move bestMove = search.chooseMove();
        LOGGER.info("Playing " + bestMove + " for " + search.getCurrentState().getTurn());
        notifyObservers(new TreeEvent(search.getTree(), turnCount));
        turnCount++;
        return bestMove;
    }

    /**
     * Follows a move made by either side.
     */
    public void observeMove(Move move) {
        requireStarted();
        search.advance(move);
    }

    public MonteCarloTreeSearch getSearch() {
        return search;
    }

    @Override
    public void addObserver(Observer observer) {
        observers.add(observer);
    }

    @Override
    public void notifyObservers(Event event) {
        for (Observer observer : observers) {
            observer.observe(event);
        }
    }

    private void requireStarted() {
        if (search == null) {
            throw new IllegalStateException("metaGame() must be called before playing");
        }
    }
}
