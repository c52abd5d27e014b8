package org.gridlayout.engine;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.gridlayout.engine.compaction.CompactType;
import org.gridlayout.engine.compaction.CompactionStrategyFactory;
import org.gridlayout.engine.compaction.ICompactionStrategy;
import org.gridlayout.engine.config.EngineConfigLoader;
import org.gridlayout.engine.config.EngineLimits;
import org.gridlayout.engine.model.LayoutItem;
import org.gridlayout.engine.move.ClusterMover;
import org.gridlayout.engine.move.MoveResolver;
import org.gridlayout.engine.move.MoveResult;
import org.gridlayout.engine.placement.BoundsCorrector;
import org.gridlayout.engine.placement.BulkPlacer;
import org.gridlayout.engine.placement.LayoutOptimizer;
import org.gridlayout.engine.resize.ResizeBehavior;
import org.gridlayout.engine.resize.ResizeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the layout engine.
 * <p>
 * Bundles every layout operation behind one object configured with a single set of
 * {@link EngineLimits}. All operations are pure: they take an immutable layout and
 * return a new one, so one engine can serve any number of grids and threads.
 */
public class LayoutEngine {

    private static final Logger LOG = LoggerFactory.getLogger(LayoutEngine.class);

    private final EngineLimits limits;
    private final ICompactionStrategy defaultStrategy;
    private final MoveResolver moveResolver;
    private final ClusterMover clusterMover;
    private final ResizeResolver resizeResolver;
    private final BulkPlacer bulkPlacer;
    private final LayoutOptimizer optimizer;
    private final BoundsCorrector boundsCorrector;

    /**
     * Creates an engine with the built-in defaults.
     */
    public LayoutEngine() {
        this(EngineLimits.defaults());
    }

    public LayoutEngine(EngineLimits limits) {
        this.limits = Objects.requireNonNull(limits, "Engine limits cannot be null.");
        this.defaultStrategy = CompactionStrategyFactory.create(limits.compactionStrategy(), Map.of(), limits);
        this.moveResolver = new MoveResolver(limits);
        this.clusterMover = new ClusterMover(moveResolver);
        this.resizeResolver = new ResizeResolver(moveResolver);
        this.bulkPlacer = new BulkPlacer(limits);
        this.optimizer = new LayoutOptimizer(limits);
        this.boundsCorrector = new BoundsCorrector(limits);
        LOG.debug("Layout engine created with {} and default strategy {}", limits, defaultStrategy);
    }

    /**
     * Creates an engine from the layered configuration (environment, system properties,
     * {@code gridlayout.conf}, {@code reference.conf}).
     */
    public static LayoutEngine fromConfig() {
        return new LayoutEngine(EngineConfigLoader.loadLimits());
    }

    public static LayoutEngine fromConfig(com.typesafe.config.Config config) {
        return new LayoutEngine(EngineConfigLoader.limitsFrom(config));
    }

    public EngineLimits limits() {
        return limits;
    }

    /** The strategy named by {@code compaction.strategy}. */
    public ICompactionStrategy defaultStrategy() {
        return defaultStrategy;
    }

    public ICompactionStrategy strategyFor(CompactType compactType) {
        return CompactionStrategyFactory.forType(compactType, limits);
    }

    public List<LayoutItem> compact(List<LayoutItem> layout, int columns) {
        return defaultStrategy.compact(layout, columns);
    }

    public List<LayoutItem> compact(List<LayoutItem> layout, CompactType compactType, int columns, boolean allowOverlap) {
        return strategyFor(compactType).compact(layout, columns, allowOverlap);
    }

    /**
     * Compacts with a strategy registered in {@link CompactionStrategyFactory}.
     *
     * @throws IllegalArgumentException if no strategy is registered under {@code strategyName}.
     */
    public List<LayoutItem> compact(List<LayoutItem> layout, String strategyName, Map<String, Object> params,
                                    int columns, boolean allowOverlap) {
        return CompactionStrategyFactory.create(strategyName, params, limits).compact(layout, columns, allowOverlap);
    }

    public List<LayoutItem> resolveCollisions(List<LayoutItem> layout, CompactType compactType, int columns) {
        return strategyFor(compactType).resolveCollisions(layout, columns);
    }

    public List<LayoutItem> moveElement(List<LayoutItem> layout, LayoutItem item, int x, int y, int columns,
                                        CompactType compactType, boolean preventCollision, boolean force) {
        return moveResolver.moveElement(layout, item, x, y, columns, strategyFor(compactType), preventCollision, force);
    }

    /**
     * Like {@link #moveElement} but also reports whether propagation hit the iteration cap.
     */
    public MoveResult move(List<LayoutItem> layout, LayoutItem item, int x, int y, int columns,
                           CompactType compactType, boolean preventCollision, boolean force) {
        return moveResolver.move(layout, item, x, y, columns, strategyFor(compactType), preventCollision, force);
    }

    public List<LayoutItem> moveCluster(List<LayoutItem> layout, Set<String> clusterIds, int x, int y, int columns,
                                        CompactType compactType, boolean preventCollision) {
        return clusterMover.moveCluster(layout, clusterIds, x, y, columns, compactType, preventCollision);
    }

    public List<LayoutItem> resizeItem(List<LayoutItem> layout, LayoutItem resizedItem, ResizeBehavior behavior,
                                       int columns, boolean preventCollision) {
        return resizeResolver.resizeItem(layout, resizedItem, behavior, columns, preventCollision);
    }

    public List<LayoutItem> placeNewItems(List<LayoutItem> existingLayout, List<LayoutItem> newItems, int columns) {
        return bulkPlacer.placeNewItems(existingLayout, newItems, columns);
    }

    public List<LayoutItem> optimizeLayout(List<LayoutItem> layout, int columns) {
        return optimizer.optimizeLayout(layout, columns);
    }

    public List<LayoutItem> correctBounds(List<LayoutItem> layout, int columns) {
        return boundsCorrector.correctBounds(layout, columns);
    }
}
