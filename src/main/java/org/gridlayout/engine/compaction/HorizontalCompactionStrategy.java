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
 * Gravity towards column 0.
 * <p>
 * Mirror image of {@link VerticalCompactionStrategy} on {@code (x, y)} order, with one
 * addition: an item pushed past the right edge of the grid wraps to the start of the
 * next row and is resolved again from there.
 */
public class HorizontalCompactionStrategy extends AbstractCompactionStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(HorizontalCompactionStrategy.class);

    public HorizontalCompactionStrategy(int maxPushesPerItem) {
        super(maxPushesPerItem);
    }

    @Override
    public CompactType compactType() {
        return CompactType.HORIZONTAL;
    }

    @Override
    protected Map<String, LayoutItem> doCompact(List<LayoutItem> layout, int columns) {
        List<LayoutItem> placed = Layouts.statics(layout);
        List<LayoutItem> work = new ArrayList<>(Layouts.sortLayoutItems(layout, CompactType.HORIZONTAL));
        Map<String, LayoutItem> result = new HashMap<>(layout.size() * 2);

        for (int i = 0; i < work.size(); i++) {
            LayoutItem item = work.get(i);
            if (item.isStatic()) {
                result.put(item.id(), item);
                continue;
            }
            LayoutItem current = clampToOrigin(item);

            while (current.x() > 0 && Collisions.firstCollisionOrNull(placed, current) == null) {
                current = current.withX(current.x() - 1);
            }

            int pushes = 0;
            LayoutItem collider;
            while ((collider = Collisions.firstCollisionOrNull(placed, current)) != null) {
                if (++pushes > maxPushesPerItem) {
                    LOG.warn("Horizontal compaction of item '{}' exceeded {} pushes", item.id(), maxPushesPerItem);
                    break;
                }
                current = current.withX(collider.right());
                work.set(i, current);
                CascadingPush.propagate(work, i, false, maxPushesPerItem);
                if (current.right() > columns) {
                    // wrap
                    current = current.withPosition(0, current.y() + 1);
                }
            }

            work.set(i, current);
            placed.add(current);
            result.put(current.id(), current);
        }
        return result;
    }
}
