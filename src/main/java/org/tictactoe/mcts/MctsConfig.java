package org.tictactoe.mcts;

import org.tictactoe.game.Turn;
import org.tictactoe.mcts.model.strategy.SelectionStrategy;

import java.util.Locale;
import java.util.Random;

/**
 * Engine settings.
 * <p>
 * Lookup order for each setting: system property, environment variable, default.
 * <ul>
 * <li>{@code mcts.training.iterations} / {@code MCTS_TRAINING_ITERATIONS}: upfront iteration budget</li>
 * <li>{@code mcts.exploration.constant} / {@code MCTS_EXPLORATION_CONSTANT}: UCB1 exploration constant</li>
 * <li>{@code mcts.move.time.ms} / {@code MCTS_MOVE_TIME_MS}: extra search time before each move, 0 for none</li>
 * <li>{@code mcts.seed} / {@code MCTS_SEED}: random seed, unseeded if absent</li>
 * <li>{@code mcts.first.mover} / {@code MCTS_FIRST_MOVER}: X | O</li>
 * </ul>
 */
public final class MctsConfig {
    public static final int DEFAULT_TRAINING_ITERATIONS = 100_000;

    private final int trainingIterations;
    private final double explorationConstant;
    private final long moveTimeMillis;
    private final Long seed;
    private final Turn firstMover;

    private MctsConfig(int trainingIterations, double explorationConstant, long moveTimeMillis, Long seed,
                       Turn firstMover) {
        if (trainingIterations < 0) {
            throw new IllegalArgumentException("Training iterations must not be negative: " + trainingIterations);
        }
        if (Double.isNaN(explorationConstant) || Double.isInfinite(explorationConstant) || explorationConstant < 0) {
            throw new IllegalArgumentException("Exploration constant must be finite and not negative: "
                + explorationConstant);
        }
        if (moveTimeMillis < 0) {
            throw new IllegalArgumentException("Move time must not be negative: " + moveTimeMillis);
        }
        this.trainingIterations = trainingIterations;
        this.explorationConstant = explorationConstant;
        this.moveTimeMillis = moveTimeMillis;
        this.seed = seed;
        this.firstMover = firstMover;
    }

    public static MctsConfig defaults() {
        return new MctsConfig(DEFAULT_TRAINING_ITERATIONS, SelectionStrategy.DEFAULT_EXPLORATION_CONSTANT, 0L, null,
            Turn.X);
    }

    public static MctsConfig fromEnvironment() {
        MctsConfig d = defaults();
        String seedText = readSetting("mcts.seed", "MCTS_SEED", "");
        return new MctsConfig(
            parseInt("mcts.training.iterations",
                readSetting("mcts.training.iterations", "MCTS_TRAINING_ITERATIONS", String.valueOf(d.trainingIterations))),
            parseDouble("mcts.exploration.constant",
                readSetting("mcts.exploration.constant", "MCTS_EXPLORATION_CONSTANT", String.valueOf(d.explorationConstant))),
            parseLong("mcts.move.time.ms", readSetting("mcts.move.time.ms", "MCTS_MOVE_TIME_MS", "0")),
            seedText.trim().isEmpty() ? null : parseLong("mcts.seed", seedText),
            parseTurn(readSetting("mcts.first.mover", "MCTS_FIRST_MOVER", d.firstMover.name())));
    }

    public MctsConfig withTrainingIterations(int value) {
        return new MctsConfig(value, explorationConstant, moveTimeMillis, seed, firstMover);
    }

    public MctsConfig withExplorationConstant(double value) {
        return new MctsConfig(trainingIterations, value, moveTimeMillis, seed, firstMover);
    }

    public MctsConfig withMoveTimeMillis(long value) {
        return new MctsConfig(trainingIterations, explorationConstant, value, seed, firstMover);
    }

    public MctsConfig withSeed(Long value) {
        return new MctsConfig(trainingIterations, explorationConstant, moveTimeMillis, value, firstMover);
    }

    public MctsConfig withFirstMover(Turn value) {
        return new MctsConfig(trainingIterations, explorationConstant, moveTimeMillis, seed, value);
    }

    public int getTrainingIterations() {
        return trainingIterations;
    }

    public double getExplorationConstant() {
        return explorationConstant;
    }

    public long getMoveTimeMillis() {
        return moveTimeMillis;
    }

    public Long getSeed() {
        return seed;
    }

    public Turn getFirstMover() {
        return firstMover;
    }

    public Random createRandom() {
        return seed == null ? new Random() : new Random(seed);
    }

    @Override
    public String toString() {
        return "MctsConfig{iterations=" + trainingIterations + ", c=" + explorationConstant
            + ", moveTimeMs=" + moveTimeMillis + ", seed=" + seed + ", firstMover=" + firstMover + "}";
    }

    private static String readSetting(String prop, String env, String defaultValue) {
        String v = System.getProperty(prop);
        if (v == null || v.trim().isEmpty()) {
            v = System.getenv(env);
        }
        if (v == null || v.trim().isEmpty()) {
            return defaultValue;
        }
        return v;
    }

    private static int parseInt(String key, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + raw, e);
        }
    }

    private static long parseLong(String key, String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + raw, e);
        }
    }

    private static double parseDouble(String key, String raw) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + raw, e);
        }
    }

    private static Turn parseTurn(String raw) {
        String t = raw.trim().toUpperCase(Locale.ROOT);
        if ("X".equals(t)) {
            return Turn.X;
        }
        if ("O".equals(t)) {
            return Turn.O;
        }
        throw new IllegalArgumentException("Invalid value for mcts.first.mover: " + raw);
    }
}
