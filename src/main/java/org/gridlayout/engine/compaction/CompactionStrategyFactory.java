package org.gridlayout.engine.compaction;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.gridlayout.engine.config.EngineLimits;

/**
 * A factory for creating compaction strategies.
 * It uses a registry to store the creators by name. The built-in names cannot be
 * replaced, and {@link #forType} does not consult the registry.
 */
public final class CompactionStrategyFactory {

    private static final Set<String> BUILT_IN = Set.of("none", "vertical", "horizontal", "fast-vertical", "fast-horizontal");

    private static final Map<String, ICompactionStrategyCreator> registry = new ConcurrentHashMap<>();

    static {
        registry.put("none", (params, limits) -> {
            String axis = String.valueOf(params.getOrDefault("axis", "vertical"));
            return new NoCompactionStrategy(parseAxis(axis), limits.compactionMaxPushesPerItem());
        });
        registry.put("vertical", (params, limits) -> new VerticalCompactionStrategy(limits.compactionMaxPushesPerItem()));
        registry.put("horizontal", (params, limits) -> new HorizontalCompactionStrategy(limits.compactionMaxPushesPerItem()));
        registry.put("fast-vertical", (params, limits) -> new FastVerticalCompactionStrategy(limits.compactionMaxPushesPerItem()));
        registry.put("fast-horizontal", (params, limits) -> new FastHorizontalCompactionStrategy(limits.compactionMaxPushesPerItem()));
    }

    private CompactionStrategyFactory() {}

    /**
     * Registers a new compaction strategy creator, replacing any custom creator of the same name.
     * @param type The name of the strategy.
     * @param creator The creator for the strategy.
     * @throws IllegalArgumentException if {@code type} names a built-in strategy.
     */
    public static void register(String type, ICompactionStrategyCreator creator) {
        Objects.requireNonNull(type, "Strategy type cannot be null.");
        Objects.requireNonNull(creator, "Creator cannot be null.");
        String key = type.toLowerCase(Locale.ROOT);
        if (BUILT_IN.contains(key)) {
            throw new IllegalArgumentException("Built-in compaction strategy cannot be replaced: " + type);
        }
        registry.put(key, creator);
    }

    /**
     * Creates a compaction strategy by name.
     * @param type The name of the strategy.
     * @param params The parameters for the strategy, may be null.
     * @param limits The safety caps.
     * @return The created strategy.
     * @throws IllegalArgumentException if the strategy type is unknown.
     */
    public static ICompactionStrategy create(String type, Map<String, Object> params, EngineLimits limits) {
        Objects.requireNonNull(type, "Strategy type cannot be null.");
        Objects.requireNonNull(limits, "Engine limits cannot be null.");
        ICompactionStrategyCreator creator = registry.get(type.toLowerCase(Locale.ROOT));
        if (creator == null) {
            throw new IllegalArgumentException("Unknown compaction strategy type: " + type);
        }
        return creator.create(params != null ? params : Map.of(), limits);
    }

    /**
     * Returns the baseline strategy for a compaction direction.
     *
     * @param compactType The direction.
     * @param limits The safety caps.
     * @return {@link NoCompactionStrategy}, {@link VerticalCompactionStrategy} or {@link HorizontalCompactionStrategy}.
     */
    public static ICompactionStrategy forType(CompactType compactType, EngineLimits limits) {
        Objects.requireNonNull(compactType, "Compact type cannot be null.");
        Objects.requireNonNull(limits, "Engine limits cannot be null.");
        int maxPushes = limits.compactionMaxPushesPerItem();
        return switch (compactType) {
            case NONE -> new NoCompactionStrategy(maxPushes);
            case VERTICAL -> new VerticalCompactionStrategy(maxPushes);
            case HORIZONTAL -> new HorizontalCompactionStrategy(maxPushes);
        };
    }

    private static CompactType parseAxis(String axis) {
        return switch (axis.toLowerCase(Locale.ROOT)) {
            case "vertical", "y" -> CompactType.VERTICAL;
            case "horizontal", "x" -> CompactType.HORIZONTAL;
            default -> throw new IllegalArgumentException("Unknown overlap resolution axis: " + axis);
        };
    }
}
