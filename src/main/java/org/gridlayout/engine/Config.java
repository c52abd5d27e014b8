package org.gridlayout.engine;

/**
 * Provides the default settings of the layout engine.
 * This final class contains static constants for the safety caps that bound every
 * propagation loop. They are the fallback values of {@code reference.conf} and of
 * {@link org.gridlayout.engine.config.EngineLimits#defaults()}. It is not meant to be instantiated.
 */
public final class Config {

    /**
     * Private constructor to prevent instantiation of this utility class.
     */
    private Config() {}

    /**
     * The lower bound of the move propagation cap, regardless of layout size.
     */
    public static final int MOVE_MIN_ITERATIONS = 5000;

    /**
     * Additional move propagation steps granted per item in the layout.
     */
    public static final int MOVE_ITERATIONS_PER_ITEM = 2;

    /**
     * The number of cursor positions tried for one item during bulk placement.
     */
    public static final int PLACEMENT_MAX_ATTEMPTS_PER_ITEM = 10000;

    /**
     * The number of pushes a single item may receive inside one compaction or overlap-resolution pass.
     */
    public static final int COMPACTION_MAX_PUSHES_PER_ITEM = 10000;

    /**
     * The compaction strategy used when a caller does not name one.
     */
    public static final String DEFAULT_COMPACTION_STRATEGY = "vertical";

    /**
     * The root path of the engine settings inside a Typesafe configuration.
     */
    public static final String CONFIG_PATH = "gridlayout.engine";
}
