package org.tictactoe.mcts.model;

public class NodeStatistics {

    private int numVisits;
    private double wins; // Sum of playout scores (0, 0.5 or 1 each)

    public NodeStatistics() {
        numVisits = 0;
        wins = 0;
    }

    public int getNumVisits() {
        return numVisits;
    }

    public double getWins() {
        return wins;
    }

    public double getWinRate() {
        return numVisits == 0 ? 0 : wins / numVisits;
    }

    public void update(double score) {
        numVisits++;
        wins += score;
    }

    @Override
    public String toString() {
        return wins + "/" + numVisits;
    }
}
