package org.gridlayout.engine.geometry;

import java.util.Collection;
import java.util.Objects;
import org.gridlayout.engine.model.LayoutItem;

/**
 * The minimal grid rectangle enclosing a set of items.
 *
 * @param x Left column.
 * @param y Top row.
 * @param w Width in cells.
 * @param h Height in cells.
 */
public record BoundingBox(int x, int y, int w, int h) {

    /**
     * Computes the enclosing rectangle of the given items.
     *
     * @param items A non-empty collection of items.
     * @return The bounding box.
     * @throws IllegalArgumentException if {@code items} is empty.
     */
    public static BoundingBox of(Collection<LayoutItem> items) {
        Objects.requireNonNull(items, "Items cannot be null.");
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Cannot compute the bounding box of an empty item set.");
        }
        int minX = Integer.MAX_VALUE;
        int minY = Integer.MAX_VALUE;
        int maxX = Integer.MIN_VALUE;
        int maxY = Integer.MIN_VALUE;
        for (LayoutItem item : items) {
            minX = Math.min(minX, item.x());
            minY = Math.min(minY, item.y());
            maxX = Math.max(maxX, item.right());
            maxY = Math.max(maxY, item.bottom());
        }
        return new BoundingBox(minX, minY, maxX - minX, maxY - minY);
    }

    /**
     * Materializes the box as a movable layout item with the given id.
     */
    public LayoutItem toItem(String id) {
        return LayoutItem.of(id, x, y, w, h);
    }
}
