package org.gridlayout.engine.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.gridlayout.engine.compaction.CompactType;

/**
 * Static helpers over a layout, an ordered {@code List<LayoutItem>} with unique ids.
 * None of the methods modify their input.
 */
public final class Layouts {

    /** Reading order: row first, then column. */
    public static final Comparator<LayoutItem> BY_ROW_THEN_COLUMN =
        Comparator.comparingInt(LayoutItem::y).thenComparingInt(LayoutItem::x);

    /** Column first, then row. Used by horizontal strategies. */
    public static final Comparator<LayoutItem> BY_COLUMN_THEN_ROW =
        Comparator.comparingInt(LayoutItem::x).thenComparingInt(LayoutItem::y);

    private Layouts() {}

    /**
     * Returns the first row below every item, {@code 0} for an empty layout.
     *
     * @param layout The layout to measure.
     * @return {@code max(y + h)} over all items.
     */
    public static int bottom(List<LayoutItem> layout) {
        int max = 0;
        for (LayoutItem item : layout) {
            int bottomY = item.y() + item.h();
            if (bottomY > max) {
                max = bottomY;
            }
        }
        return max;
    }

    /**
     * Returns the first column right of every item, {@code 0} for an empty layout.
     */
    public static int right(List<LayoutItem> layout) {
        int max = 0;
        for (LayoutItem item : layout) {
            if (item.right() > max) {
                max = item.right();
            }
        }
        return max;
    }

    /**
     * Filters the static items, keeping layout order.
     */
    public static List<LayoutItem> statics(List<LayoutItem> layout) {
        List<LayoutItem> result = new ArrayList<>();
        for (LayoutItem item : layout) {
            if (item.isStatic()) {
                result.add(item);
            }
        }
        return result;
    }

    /**
     * Returns a stably sorted copy: by {@code (x, y)} for horizontal compaction,
     * by {@code (y, x)} otherwise.
     *
     * @param layout The layout to sort.
     * @param compactType The compaction direction that decides the key order.
     * @return A new, sorted list.
     */
    public static List<LayoutItem> sortLayoutItems(List<LayoutItem> layout, CompactType compactType) {
        List<LayoutItem> sorted = new ArrayList<>(layout);
        sorted.sort(compactType == CompactType.HORIZONTAL ? BY_COLUMN_THEN_ROW : BY_ROW_THEN_COLUMN);
        return sorted;
    }

    public static Optional<LayoutItem> findById(List<LayoutItem> layout, String id) {
        for (LayoutItem item : layout) {
            if (item.id().equals(id)) {
                return Optional.of(item);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns a copy of the layout with the item of the same id replaced, or the
     * item appended if the id is not present.
     */
    public static List<LayoutItem> replace(List<LayoutItem> layout, LayoutItem replacement) {
        Objects.requireNonNull(replacement, "Replacement item cannot be null.");
        List<LayoutItem> result = new ArrayList<>(layout.size() + 1);
        boolean replaced = false;
        for (LayoutItem item : layout) {
            if (!replaced && item.id().equals(replacement.id())) {
                result.add(replacement);
                replaced = true;
            } else {
                result.add(item);
            }
        }
        if (!replaced) {
            result.add(replacement);
        }
        return result;
    }

    /**
     * Validates the common arguments of every engine operation.
     *
     * @throws NullPointerException if the layout is null.
     * @throws IllegalArgumentException if {@code columns} is not positive.
     */
    public static void requireValid(List<LayoutItem> layout, int columns) {
        Objects.requireNonNull(layout, "Layout cannot be null.");
        if (columns <= 0) {
            throw new IllegalArgumentException("Column count must be positive, got: " + columns);
        }
    }

    /**
     * Wraps a result list so callers cannot mutate engine output.
     */
    public static List<LayoutItem> freeze(List<LayoutItem> layout) {
        return Collections.unmodifiableList(layout);
    }
}
