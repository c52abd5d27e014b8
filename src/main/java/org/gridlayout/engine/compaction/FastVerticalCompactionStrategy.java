package org.gridlayout.engine.compaction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.gridlayout.engine.geometry.Collisions;
import org.gridlayout.engine.model.LayoutItem;
import org.gridlayout.engine.model.Layouts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * "Rising tide" variant of {@link VerticalCompactionStrategy} for large layouts.
 * <p>
 * Keeps, per column, the lowest free row ({@code tide}). Items are visited in
 * {@code (y, x)} order with static items first among ties. A static item only raises
 * the tide over its columns. A movable item is dropped onto the highest tide under its
 * span and then shifted below any not-yet-visited static item it would overlap.
 * Runs in {@code O(n log n + n * w)} plus the static checks.
 */
public class FastVerticalCompactionStrategy extends AbstractCompactionStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(FastVerticalCompactionStrategy.class);

    static final Comparator<LayoutItem> ORDER = Layouts.BY_ROW_THEN_COLUMN
        .thenComparing((a, b) -> Boolean.compare(b.isStatic(), a.isStatic()));

    public FastVerticalCompactionStrategy(int maxPushesPerItem) {
        super(maxPushesPerItem);
    }

    @Override
    public CompactType compactType() {
        return CompactType.VERTICAL;
    }

    @Override
    protected Map<String, LayoutItem> doCompact(List<LayoutItem> layout, int columns) {
        List<LayoutItem> sorted = new ArrayList<>(layout);
        sorted.sort(ORDER);

        List<LayoutItem> statics = new ArrayList<>();
        for (LayoutItem item : sorted) {
            if (item.isStatic()) {
                statics.add(item);
            }
        }

        int[] tide = new int[Math.max(columns, Layouts.right(layout))];
        Map<String, LayoutItem> result = new HashMap<>(layout.size() * 2);
        int staticOffset = 0;

        for (LayoutItem item : sorted) {
            if (item.isStatic()) {
                staticOffset++;
                raise(tide, item);
                result.put(item.id(), item);
                continue;
            }

            LayoutItem current = item.withX(Math.max(0, item.x()));
            current = current.withY(highestTide(tide, current));

            int pushes = 0;
            int j = staticOffset;
            while (j < statics.size()) {
                LayoutItem obstacle = statics.get(j);
                if (obstacle.y() >= current.bottom()) {
                    break; // statics are sorted by row, nothing further down can overlap
                }
                if (Collisions.collides(obstacle, current)) {
                    if (++pushes > maxPushesPerItem) {
                        LOG.warn("Fast vertical compaction of item '{}' exceeded {} pushes", item.id(), maxPushesPerItem);
                        break;
                    }
                    current = current.withY(obstacle.bottom());
                    // a lower static may now be hit that was skipped before
                    j = staticOffset;
                    continue;
                }
                j++;
            }

            raise(tide, current);
            result.put(current.id(), current);
        }
        return result;
    }

    private static int highestTide(int[] tide, LayoutItem item) {
        int top = 0;
        int end = Math.min(tide.length, item.right());
        for (int c = Math.max(0, item.x()); c < end; c++) {
            top = Math.max(top, tide[c]);
        }
        return top;
    }

    private static void raise(int[] tide, LayoutItem item) {
        int end = Math.min(tide.length, item.right());
        int level = item.bottom();
        for (int c = Math.max(0, item.x()); c < end; c++) {
            if (tide[c] < level) {
                tide[c] = level;
            }
        }
    }
}
