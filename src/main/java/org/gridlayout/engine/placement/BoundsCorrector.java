package org.gridlayout.engine.placement;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.gridlayout.engine.config.EngineLimits;
import org.gridlayout.engine.geometry.Collisions;
import org.gridlayout.engine.model.LayoutItem;
import org.gridlayout.engine.model.Layouts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings items back inside the column range, for example after the grid lost columns.
 * <p>
 * A movable item that overflows on the right is shifted left; one that starts left of
 * column 0 is anchored at 0 and stretched to the full width. Static items keep their
 * column even when outside the grid and only step down, one row at a time, while they
 * overlap a movable item corrected earlier in the same pass.
 */
public class BoundsCorrector {

    private static final Logger LOG = LoggerFactory.getLogger(BoundsCorrector.class);

    private final int maxPushesPerItem;

    public BoundsCorrector(EngineLimits limits) {
        this.maxPushesPerItem = Objects.requireNonNull(limits, "Engine limits cannot be null.")
            .compactionMaxPushesPerItem();
    }

    public List<LayoutItem> correctBounds(List<LayoutItem> layout, int columns) {
        Layouts.requireValid(layout, columns);
        List<LayoutItem> corrected = new ArrayList<>(layout.size());
        List<LayoutItem> accepted = new ArrayList<>(layout.size());

        for (LayoutItem item : layout) {
            LayoutItem current = item;
            if (!current.isStatic()) {
                if (current.right() > columns) {
                    current = current.withX(columns - current.w());
                }
                if (current.x() < 0) {
                    current = current.withGeometry(0, current.y(), columns, current.h());
                }
                accepted.add(current);
            } else {
                if (current.x() < 0 || current.right() > columns) {
                    LOG.debug("Static item '{}' lies outside {} columns; keeping its column", current.id(), columns);
                }
                int pushes = 0;
                while (Collisions.firstCollisionOrNull(accepted, current) != null) {
                    if (++pushes > maxPushesPerItem) {
                        LOG.warn("Bounds correction of static item '{}' exceeded {} steps", current.id(), maxPushesPerItem);
                        break;
                    }
                    current = current.withY(current.y() + 1);
                }
            }
            corrected.add(current);
        }
        return Layouts.freeze(corrected);
    }
}
