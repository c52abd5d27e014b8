package org.gridlayout.engine.placement;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.gridlayout.engine.compaction.CompactType;
import org.gridlayout.engine.compaction.ICompactionStrategy;
import org.gridlayout.engine.compaction.NoCompactionStrategy;
import org.gridlayout.engine.config.EngineLimits;
import org.gridlayout.engine.geometry.Collisions;
import org.gridlayout.engine.model.LayoutItem;
import org.gridlayout.engine.model.Layouts;

/**
 * Defragments a layout by re-placing every movable item into the first free slot.
 * <p>
 * Static items stay where they are. Movable items are taken in reading order
 * ({@code y}, then {@code x}) and each one is put at the top-most, then left-most,
 * position where it fits next to the items placed before it.
 */
public class LayoutOptimizer {

    private final ICompactionStrategy cleanup;

    public LayoutOptimizer(EngineLimits limits) {
        Objects.requireNonNull(limits, "Engine limits cannot be null.");
        this.cleanup = new NoCompactionStrategy(CompactType.VERTICAL, limits.compactionMaxPushesPerItem());
    }

    /**
     * Re-packs the layout.
     *
     * @param layout The layout to optimize.
     * @param columns Column count of the grid.
     * @return The items in input order at their new positions, {@code moved} cleared.
     */
    public List<LayoutItem> optimizeLayout(List<LayoutItem> layout, int columns) {
        Layouts.requireValid(layout, columns);
        if (layout.isEmpty()) {
            return layout;
        }

        List<LayoutItem> placed = Layouts.statics(layout);
        List<LayoutItem> movables = new ArrayList<>(layout.size());
        for (LayoutItem item : layout) {
            if (!item.isStatic()) {
                movables.add(item);
            }
        }
        movables.sort(Layouts.BY_ROW_THEN_COLUMN);

        Map<String, LayoutItem> positioned = new HashMap<>(layout.size() * 2);
        for (LayoutItem item : movables) {
            LayoutItem target = firstFit(placed, item, columns);
            placed.add(target);
            positioned.put(item.id(), target);
        }

        List<LayoutItem> ordered = new ArrayList<>(layout.size());
        for (LayoutItem item : layout) {
            ordered.add(positioned.getOrDefault(item.id(), item));
        }
        List<LayoutItem> resolved = cleanup.resolveCollisions(ordered, columns);

        List<LayoutItem> out = new ArrayList<>(layout.size());
        for (int i = 0; i < layout.size(); i++) {
            LayoutItem before = layout.get(i);
            LayoutItem after = resolved.get(i);
            boolean samePosition = after.x() == before.x() && after.y() == before.y();
            out.add(samePosition && !before.moved() ? before : after.withMoved(false));
        }
        return Layouts.freeze(out);
    }

    private static LayoutItem firstFit(List<LayoutItem> placed, LayoutItem item, int columns) {
        int bottom = Layouts.bottom(placed);
        if (item.w() > columns) {
            return item.withPosition(0, bottom);
        }
        for (int y = 0; y <= bottom; y++) {
            for (int x = 0; x <= columns - item.w(); x++) {
                LayoutItem candidate = item.withPosition(x, y);
                if (Collisions.firstCollisionOrNull(placed, candidate) == null) {
                    return candidate;
                }
            }
        }
        return item.withPosition(0, bottom);
    }
}
