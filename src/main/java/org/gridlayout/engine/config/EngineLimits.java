package org.gridlayout.engine.config;

import org.gridlayout.engine.Config;

/**
 * Immutable safety caps that bound the propagation loops of the engine.
 * Passed explicitly into every resolver so tests and callers can tune them.
 */
public final class EngineLimits {

    private final int moveMinIterations;
    private final int moveIterationsPerItem;
    private final int placementMaxAttemptsPerItem;
    private final int compactionMaxPushesPerItem;
    private final String compactionStrategy;

    /**
     * Creates a set of limits.
     *
     * @param moveMinIterations Lower bound of the move propagation cap.
     * @param moveIterationsPerItem Propagation steps granted per layout item.
     * @param placementMaxAttemptsPerItem Cursor attempts per item during bulk placement.
     * @param compactionMaxPushesPerItem Pushes per item inside one compaction pass.
     * @param compactionStrategy Name of the default compaction strategy.
     * @throws IllegalArgumentException if a cap is not positive or the strategy name is blank.
     */
    public EngineLimits(int moveMinIterations, int moveIterationsPerItem, int placementMaxAttemptsPerItem,
                        int compactionMaxPushesPerItem, String compactionStrategy) {
        this.moveMinIterations = requirePositive(moveMinIterations, "move.minIterations");
        this.moveIterationsPerItem = requirePositive(moveIterationsPerItem, "move.iterationsPerItem");
        this.placementMaxAttemptsPerItem = requirePositive(placementMaxAttemptsPerItem, "placement.maxAttemptsPerItem");
        this.compactionMaxPushesPerItem = requirePositive(compactionMaxPushesPerItem, "compaction.maxPushesPerItem");
        if (compactionStrategy == null || compactionStrategy.isBlank()) {
            throw new IllegalArgumentException("compaction.strategy must not be blank.");
        }
        this.compactionStrategy = compactionStrategy;
    }

    /**
     * Config-based constructor.
     *
     * @param config The {@code gridlayout.engine} subtree.
     */
    public EngineLimits(com.typesafe.config.Config config) {
        this(
            config.getInt("move.minIterations"),
            config.getInt("move.iterationsPerItem"),
            config.getInt("placement.maxAttemptsPerItem"),
            config.getInt("compaction.maxPushesPerItem"),
            config.getString("compaction.strategy")
        );
    }

    /**
     * Returns the built-in defaults from {@link Config}.
     */
    public static EngineLimits defaults() {
        return new EngineLimits(
            Config.MOVE_MIN_ITERATIONS,
            Config.MOVE_ITERATIONS_PER_ITEM,
            Config.PLACEMENT_MAX_ATTEMPTS_PER_ITEM,
            Config.COMPACTION_MAX_PUSHES_PER_ITEM,
            Config.DEFAULT_COMPACTION_STRATEGY);
    }

    /**
     * Computes the move propagation cap for a layout of the given size.
     *
     * @param itemCount Number of items in the layout.
     * @return {@code max(moveMinIterations, moveIterationsPerItem * itemCount)}.
     */
    public int moveIterationCap(int itemCount) {
        return Math.max(moveMinIterations, moveIterationsPerItem * itemCount);
    }

    public int moveMinIterations() {
        return moveMinIterations;
    }

    public int moveIterationsPerItem() {
        return moveIterationsPerItem;
    }

    public int placementMaxAttemptsPerItem() {
        return placementMaxAttemptsPerItem;
    }

    public int compactionMaxPushesPerItem() {
        return compactionMaxPushesPerItem;
    }

    public String compactionStrategy() {
        return compactionStrategy;
    }

    private static int requirePositive(int value, String key) {
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive, got: " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return "EngineLimits{moveMinIterations=" + moveMinIterations
            + ", moveIterationsPerItem=" + moveIterationsPerItem
            + ", placementMaxAttemptsPerItem=" + placementMaxAttemptsPerItem
            + ", compactionMaxPushesPerItem=" + compactionMaxPushesPerItem
            + ", compactionStrategy=" + compactionStrategy + "}";
    }
}
