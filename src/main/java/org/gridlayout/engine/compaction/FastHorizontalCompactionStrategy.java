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
 * "Rising tide" variant of {@link HorizontalCompactionStrategy}.
 * <p>
 * Same algorithm as {@link FastVerticalCompactionStrategy} with the axes swapped: the
 * tide is kept per row and items are visited in {@code (x, y)} order. For a horizontal
 * grid the fixed extent is the row count, so the {@code columns} argument is read as
 * the number of rows. Unlike {@link HorizontalCompactionStrategy} there is no wrapping.
 */
public class FastHorizontalCompactionStrategy extends AbstractCompactionStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(FastHorizontalCompactionStrategy.class);

    static final Comparator<LayoutItem> ORDER = Layouts.BY_COLUMN_THEN_ROW
        .thenComparing((a, b) -> Boolean.compare(b.isStatic(), a.isStatic()));

    public FastHorizontalCompactionStrategy(int maxPushesPerItem) {
        super(maxPushesPerItem);
    }

    @Override
    public CompactType compactType() {
        return CompactType.HORIZONTAL;
    }

    @Override
    protected Map<String, LayoutItem> doCompact(List<LayoutItem> layout, int rows) {
        List<LayoutItem> sorted = new ArrayList<>(layout);
        sorted.sort(ORDER);

        List<LayoutItem> statics = new ArrayList<>();
        for (LayoutItem item : sorted) {
            if (item.isStatic()) {
                statics.add(item);
            }
        }

        int[] tide = new int[Math.max(rows, Layouts.bottom(layout))];
        Map<String, LayoutItem> result = new HashMap<>(layout.size() * 2);
        int staticOffset = 0;

        for (LayoutItem item : sorted) {
            if (item.isStatic()) {
                staticOffset++;
                raise(tide, item);
                result.put(item.id(), item);
                continue;
            }

            LayoutItem current = item.withY(Math.max(0, item.y()));
            current = current.withX(highestTide(tide, current));

            int pushes = 0;
            int j = staticOffset;
            while (j < statics.size()) {
                LayoutItem obstacle = statics.get(j);
                if (obstacle.x() >= current.right()) {
                    break;
                }
                if (Collisions.collides(obstacle, current)) {
                    if (++pushes > maxPushesPerItem) {
                        LOG.warn("Fast horizontal compaction of item '{}' exceeded {} pushes", item.id(), maxPushesPerItem);
                        break;
                    }
                    current = current.withX(obstacle.right());
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
        int end = Math.min(tide.length, item.bottom());
        for (int r = Math.max(0, item.y()); r < end; r++) {
            top = Math.max(top, tide[r]);
        }
        return top;
    }

    private static void raise(int[] tide, LayoutItem item) {
        int end = Math.min(tide.length, item.bottom());
        int level = item.right();
        for (int r = Math.max(0, item.y()); r < end; r++) {
            if (tide[r] < level) {
                tide[r] = level;
            }
        }
    }
}
