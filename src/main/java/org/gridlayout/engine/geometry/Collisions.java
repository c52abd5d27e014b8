package org.gridlayout.engine.geometry;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.gridlayout.engine.model.LayoutItem;

/**
 * Axis-aligned overlap tests on grid rectangles {@code [x, x+w) x [y, y+h)}.
 * An item never collides with itself (same id).
 */
public final class Collisions {

    private Collisions() {}

    /**
     * Checks whether two items share at least one grid cell.
     *
     * @param a The first item.
     * @param b The second item.
     * @return false for equal ids, otherwise true iff the rectangles overlap on both axes.
     */
    public static boolean collides(LayoutItem a, LayoutItem b) {
        if (a.id().equals(b.id())) return false; // same element
        if (a.x() + a.w() <= b.x()) return false; // a is left of b
        if (a.x() >= b.x() + b.w()) return false; // a is right of b
        if (a.y() + a.h() <= b.y()) return false; // a is above b
        if (a.y() >= b.y() + b.h()) return false; // a is below b
        return true;
    }

    /**
     * Returns the first candidate, in iteration order, that collides with the item.
     */
    public static Optional<LayoutItem> firstCollision(Iterable<LayoutItem> candidates, LayoutItem item) {
        for (LayoutItem candidate : candidates) {
            if (collides(candidate, item)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Same as {@link #firstCollision} but returns {@code null} when nothing collides.
     * Used by the inner loops of the compaction strategies.
     */
    public static LayoutItem firstCollisionOrNull(Iterable<LayoutItem> candidates, LayoutItem item) {
        for (LayoutItem candidate : candidates) {
            if (collides(candidate, item)) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Returns every candidate colliding with the item, in iteration order.
     *
     * @param candidates Items to test.
     * @param item The probe.
     * @return A new list, empty if nothing collides.
     */
    public static List<LayoutItem> allCollisions(Iterable<LayoutItem> candidates, LayoutItem item) {
        List<LayoutItem> collisions = new ArrayList<>();

        final int left = item.x();
        final int right = item.x() + item.w();
        final int top = item.y();
        final int bottom = item.y() + item.h();
        final String id = item.id();

        for (LayoutItem other : candidates) {
            if (other.id().equals(id)) continue;
            if (right <= other.x()) continue;
            if (left >= other.x() + other.w()) continue;
            if (bottom <= other.y()) continue;
            if (top >= other.y() + other.h()) continue;
            collisions.add(other);
        }
        return collisions;
    }

    /**
     * Checks whether any pair of items overlaps, ignoring pairs of two static items.
     * Quadratic; intended for assertions and diagnostics.
     */
    public static boolean hasOverlaps(List<LayoutItem> layout) {
        for (int i = 0; i < layout.size(); i++) {
            for (int j = i + 1; j < layout.size(); j++) {
                LayoutItem a = layout.get(i);
                LayoutItem b = layout.get(j);
                if (a.isStatic() && b.isStatic()) {
                    continue;
                }
                if (collides(a, b)) {
                    return true;
                }
            }
        }
        return false;
    }
}
