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
 * Places a batch of new items below the existing content.
 * <p>
 * Items that already carry a position are kept as they are. The others are placed
 * greedily, in input order, by a cursor that starts at column 0 of the first empty
 * row and moves left to right, wrapping to the next row when the item would overflow.
 */
public class BulkPlacer {

    private static final Logger LOG = LoggerFactory.getLogger(BulkPlacer.class);

    private final int maxAttemptsPerItem;

    public BulkPlacer(EngineLimits limits) {
        this.maxAttemptsPerItem = Objects.requireNonNull(limits, "Engine limits cannot be null.")
            .placementMaxAttemptsPerItem();
    }

    /**
     * Merges new items into a layout.
     *
     * @param existingLayout Items already on the grid, returned unchanged.
     * @param newItems Items to add; unplaced ones get a position.
     * @param columns Column count of the grid.
     * @return The existing items followed by the new ones in input order.
     */
    public List<LayoutItem> placeNewItems(List<LayoutItem> existingLayout, List<LayoutItem> newItems, int columns) {
        Layouts.requireValid(existingLayout, columns);
        Objects.requireNonNull(newItems, "New items cannot be null.");

        List<LayoutItem> result = new ArrayList<>(existingLayout.size() + newItems.size());
        result.addAll(existingLayout);
        List<LayoutItem> toPlace = new ArrayList<>();
        for (LayoutItem item : newItems) {
            if (item.isPlaced()) {
                result.add(item);
            } else {
                toPlace.add(item);
            }
        }
        if (toPlace.isEmpty()) {
            return Layouts.freeze(result);
        }

        int cursorX = 0;
        int cursorY = Layouts.bottom(result);

        for (LayoutItem item : toPlace) {
            LayoutItem placed = null;
            if (item.w() <= columns) {
                int attempts = 0;
                while (placed == null && attempts++ < maxAttemptsPerItem) {
                    if (cursorX + item.w() > columns) {
                        cursorX = 0;
                        cursorY++;
                        continue;
                    }
                    LayoutItem candidate = item.withPosition(cursorX, cursorY);
                    if (Collisions.firstCollisionOrNull(result, candidate) == null) {
                        placed = candidate;
                    } else {
                        cursorX++;
                    }
                }
            }
            if (placed == null) {
                placed = item.withPosition(0, Layouts.bottom(result));
                LOG.warn("No free slot found for item '{}' ({}x{}) on {} columns; placing it at ({}, {})",
                    item.id(), item.w(), item.h(), columns, placed.x(), placed.y());
                cursorY = placed.y();
            }
            result.add(placed);
            cursorX = placed.right();
        }
        return Layouts.freeze(result);
    }
}
