package org.gridlayout.engine.compaction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.gridlayout.engine.geometry.Collisions;
import org.gridlayout.engine.model.LayoutItem;
import org.gridlayout.engine.model.Layouts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class of the built-in strategies. Handles argument checks, the
 * {@code allowOverlap} fast path, overlap resolution along the strategy's axis and
 * the rebuild of the output in input order.
 */
public abstract class AbstractCompactionStrategy implements ICompactionStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractCompactionStrategy.class);

    /** Upper bound on pushes for a single item within one pass. */
    protected final int maxPushesPerItem;

    protected AbstractCompactionStrategy(int maxPushesPerItem) {
        if (maxPushesPerItem <= 0) {
            throw new IllegalArgumentException("maxPushesPerItem must be positive, got: " + maxPushesPerItem);
        }
        this.maxPushesPerItem = maxPushesPerItem;
    }

    @Override
    public final List<LayoutItem> compact(List<LayoutItem> layout, int columns, boolean allowOverlap) {
        Layouts.requireValid(layout, columns);
        if (allowOverlap || layout.isEmpty()) {
            return layout;
        }
        Map<String, LayoutItem> compacted = doCompact(layout, columns);
        return rebuild(layout, compacted, true);
    }

    @Override
    public List<LayoutItem> resolveCollisions(List<LayoutItem> layout, int columns) {
        Layouts.requireValid(layout, columns);
        if (layout.isEmpty()) {
            return layout;
        }
        return resolveOverlaps(layout, compactType().isVerticalAxis());
    }

    /**
     * Computes the compacted position of every item.
     *
     * @param layout A non-empty layout.
     * @param columns The cross-axis extent.
     * @return The resulting items keyed by id; must contain every input id.
     */
    protected abstract Map<String, LayoutItem> doCompact(List<LayoutItem> layout, int columns);

    /**
     * Pushes each item that overlaps an earlier one (in axis order) forward until clear.
     * Static items seed the placed set and are never moved.
     *
     * @param layout The layout to clean up.
     * @param vertical True to push along {@code y}, false along {@code x}.
     * @return The resolved layout in input order.
     */
    protected final List<LayoutItem> resolveOverlaps(List<LayoutItem> layout, boolean vertical) {
        List<LayoutItem> placed = Layouts.statics(layout);
        List<LayoutItem> sorted = Layouts.sortLayoutItems(layout, vertical ? CompactType.VERTICAL : CompactType.HORIZONTAL);
        Map<String, LayoutItem> resolved = new HashMap<>(layout.size() * 2);

        for (LayoutItem item : sorted) {
            if (item.isStatic()) {
                resolved.put(item.id(), item);
                continue;
            }
            LayoutItem current = item;
            int pushes = 0;
            LayoutItem collider;
            while ((collider = Collisions.firstCollisionOrNull(placed, current)) != null) {
                if (++pushes > maxPushesPerItem) {
                    LOG.warn("Overlap resolution for item '{}' exceeded {} pushes; keeping best-effort position",
                        item.id(), maxPushesPerItem);
                    break;
                }
                current = vertical ? current.withY(collider.bottom()) : current.withX(collider.right());
            }
            placed.add(current);
            resolved.put(item.id(), current);
        }
        return rebuild(layout, resolved, false);
    }

    /**
     * Reassembles the output in input order.
     * <p>
     * In compaction mode the {@code moved} flag is cleared; an item that kept its
     * position and was not flagged is returned as the same instance. In resolution mode
     * unchanged items keep their flag and displaced items are flagged.
     */
    static List<LayoutItem> rebuild(List<LayoutItem> original, Map<String, LayoutItem> byId, boolean clearMoved) {
        List<LayoutItem> out = new ArrayList<>(original.size());
        for (LayoutItem before : original) {
            LayoutItem after = byId.getOrDefault(before.id(), before);
            boolean samePosition = after.x() == before.x() && after.y() == before.y();
            if (clearMoved) {
                out.add(samePosition && !before.moved() ? before : after.withMoved(false));
            } else {
                out.add(samePosition ? before : after.withMoved(true));
            }
        }
        return Layouts.freeze(out);
    }

    /**
     * Clamps both coordinates to be non-negative.
     */
    static LayoutItem clampToOrigin(LayoutItem item) {
        return item.withPosition(Math.max(0, item.x()), Math.max(0, item.y()));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{maxPushesPerItem=" + maxPushesPerItem + "}";
    }
}
