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
 * Gravity towards row 0.
 * <p>
 * Items are processed in {@code (y, x)} order against a growing set of placed items
 * seeded with every static item. Each item floats up while it is free, then is pushed
 * below whatever it still overlaps; the push cascades onto later items of the pass.
 * Quadratic in the number of items.
 */
public class VerticalCompactionStrategy extends AbstractCompactionStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(VerticalCompactionStrategy.class);

    public VerticalCompactionStrategy(int maxPushesPerItem) {
        super(maxPushesPerItem);
    }

    @Override
    public CompactType compactType() {
        return CompactType.VERTICAL;
    }

    @Override
    protected Map<String, LayoutItem> doCompact(List<LayoutItem> layout, int columns) {
        List<LayoutItem> placed = Layouts.statics(layout);
        List<LayoutItem> work = new ArrayList<>(Layouts.sortLayoutItems(layout, CompactType.VERTICAL));
        Map<String, LayoutItem> result = new HashMap<>(layout.size() * 2);

        for (int i = 0; i < work.size(); i++) {
            LayoutItem item = work.get(i);
            if (item.isStatic()) {
                result.put(item.id(), item);
                continue;
            }
            LayoutItem current = clampToOrigin(item);

            while (current.y() > 0 && Collisions.firstCollisionOrNull(placed, current) == null) {
                current = current.withY(current.y() - 1);
            }

            int pushes = 0;
            LayoutItem collider;
            while ((collider = Collisions.firstCollisionOrNull(placed, current)) != null) {
                if (++pushes > maxPushesPerItem) {
                    LOG.warn("Vertical compaction of item '{}' exceeded {} pushes", item.id(), maxPushesPerItem);
                    break;
                }
                current = current.withY(collider.bottom());
                work.set(i, current);
                CascadingPush.propagate(work, i, true, maxPushesPerItem);
            }

            work.set(i, current);
            placed.add(current);
            result.put(current.id(), current);
        }
        return result;
    }
}
