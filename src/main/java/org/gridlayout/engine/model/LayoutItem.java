package org.gridlayout.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single, immutable item of a grid layout.
 * <p>
 * Holds the grid position ({@code x}, {@code y}), the span ({@code w}, {@code h}),
 * resize bounds and behavior flags. Every engine operation returns new instances;
 * an item is never changed in place.
 *
 * @param id          Unique identifier within a layout.
 * @param x           Cross-axis cell index, or {@link #UNPLACED} if the item needs auto-placement.
 * @param y           Main-axis cell index, or {@link #UNPLACED} if the item needs auto-placement.
 * @param w           Width in cells, at least 1.
 * @param h           Height in cells, at least 1.
 * @param minW        Minimum width during resize.
 * @param minH        Minimum height during resize.
 * @param maxW        Maximum width during resize, {@link #UNBOUNDED} for no limit.
 * @param maxH        Maximum height during resize, {@link #UNBOUNDED} for no limit.
 * @param isDraggable Per-item drag override, {@code null} to inherit the caller's default.
 * @param isResizable Per-item resize override, {@code null} to inherit the caller's default.
 * @param isStatic    Immovable obstacle flag.
 * @param moved       Transient animation hint set when an operation changed the position.
 */
public record LayoutItem(
    String id,
    int x,
    int y,
    int w,
    int h,
    int minW,
    int minH,
    int maxW,
    int maxH,
    Boolean isDraggable,
    Boolean isResizable,
    boolean isStatic,
    boolean moved
) {

    /** Coordinate sentinel marking an item that still has to be placed. */
    public static final int UNPLACED = -1;

    /** Resize bound meaning "no limit". Serialized as {@code null}. */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    /** Reserved id of the transient placeholder shown while an external item is dragged over the grid. */
    public static final String DROPPING_ITEM_ID = "__dropping_item__";

    public LayoutItem {
        Objects.requireNonNull(id, "Item id cannot be null.");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Item id cannot be blank.");
        }
        if (w < 1 || h < 1) {
            throw new IllegalArgumentException("Item '" + id + "' must span at least one cell, got " + w + "x" + h);
        }
        if (minW < 1 || minH < 1) {
            throw new IllegalArgumentException("Item '" + id + "' has minimum size below 1: " + minW + "x" + minH);
        }
        if (minW > maxW || minH > maxH) {
            throw new IllegalArgumentException("Item '" + id + "' has minimum size above its maximum size.");
        }
    }

    /**
     * Creates an item from its key-value form. Missing numbers fall back to the
     * defaults, a {@code null} maximum means unbounded.
     *
     * @param map The serialized record, typically parsed from JSON.
     * @return The item.
     * @throws IllegalArgumentException if the id is missing, a value has the wrong type, or a
     *         number is not an integer within {@code int} range.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static LayoutItem fromMap(Map<String, Object> map) {
        Objects.requireNonNull(map, "Item map cannot be null.");
        Object rawId = map.get("id");
        if (!(rawId instanceof String id)) {
            throw new IllegalArgumentException("Item map requires a string 'id', got: " + rawId);
        }
        return new LayoutItem(
            id,
            intValue(map, "x", 0),
            intValue(map, "y", 0),
            intValue(map, "w", 1),
            intValue(map, "h", 1),
            intValue(map, "minW", 1),
            intValue(map, "minH", 1),
            intValue(map, "maxW", UNBOUNDED),
            intValue(map, "maxH", UNBOUNDED),
            boolValue(map, "isDraggable"),
            boolValue(map, "isResizable"),
            Boolean.TRUE.equals(boolValue(map, "isStatic")),
            Boolean.TRUE.equals(boolValue(map, "moved")));
    }

    /**
     * Converts the item to its key-value form. Unbounded maxima become {@code null}.
     *
     * @return An insertion-ordered map with every field.
     */
    @JsonValue
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("x", x);
        map.put("y", y);
        map.put("w", w);
        map.put("h", h);
        map.put("minW", minW);
        map.put("minH", minH);
        map.put("maxW", maxW == UNBOUNDED ? null : maxW);
        map.put("maxH", maxH == UNBOUNDED ? null : maxH);
        map.put("isDraggable", isDraggable);
        map.put("isResizable", isResizable);
        map.put("isStatic", isStatic);
        map.put("moved", moved);
        return map;
    }

    private static int intValue(Map<String, Object> map, String key, int fallback) {
        Object value = map.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        if (value instanceof Number number) {
            try {
                return new BigDecimal(number.toString()).intValueExact();
            } catch (ArithmeticException | NumberFormatException e) {
                throw new IllegalArgumentException(
                    "Item field '" + key + "' must be an integer within int range, got: " + value, e);
            }
        }
        throw new IllegalArgumentException("Item field '" + key + "' must be numeric, got: " + value);
    }

    private static Boolean boolValue(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null || value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new IllegalArgumentException("Item field '" + key + "' must be boolean, got: " + value);
    }

    /**
     * Creates a movable item with default bounds and no flag overrides.
     */
    public static LayoutItem of(String id, int x, int y, int w, int h) {
        return new LayoutItem(id, x, y, w, h, 1, 1, UNBOUNDED, UNBOUNDED, null, null, false, false);
    }

    /**
     * Creates a static obstacle with default bounds.
     */
    public static LayoutItem staticItem(String id, int x, int y, int w, int h) {
        return new LayoutItem(id, x, y, w, h, 1, 1, UNBOUNDED, UNBOUNDED, null, null, true, false);
    }

    /**
     * Creates an item that still needs a position (both coordinates set to {@link #UNPLACED}).
     */
    public static LayoutItem unplaced(String id, int w, int h) {
        return of(id, UNPLACED, UNPLACED, w, h);
    }

    /**
     * Returns false when either coordinate is the {@link #UNPLACED} sentinel.
     */
    public boolean isPlaced() {
        return x != UNPLACED && y != UNPLACED;
    }

    /** Exclusive right edge. */
    public int right() {
        return x + w;
    }

    /** Exclusive bottom edge. */
    public int bottom() {
        return y + h;
    }

    public LayoutItem withX(int newX) {
        return withPosition(newX, y);
    }

    public LayoutItem withY(int newY) {
        return withPosition(x, newY);
    }

    public LayoutItem withPosition(int newX, int newY) {
        if (newX == x && newY == y) {
            return this;
        }
        return new LayoutItem(id, newX, newY, w, h, minW, minH, maxW, maxH, isDraggable, isResizable, isStatic, moved);
    }

    /**
     * Moves the item and sets the {@code moved} flag in one step.
     */
    public LayoutItem movedTo(int newX, int newY) {
        return new LayoutItem(id, newX, newY, w, h, minW, minH, maxW, maxH, isDraggable, isResizable, isStatic, true);
    }

    public LayoutItem withSize(int newW, int newH) {
        if (newW == w && newH == h) {
            return this;
        }
        return new LayoutItem(id, x, y, newW, newH, minW, minH, maxW, maxH, isDraggable, isResizable, isStatic, moved);
    }

    public LayoutItem withGeometry(int newX, int newY, int newW, int newH) {
        return new LayoutItem(id, newX, newY, newW, newH, minW, minH, maxW, maxH, isDraggable, isResizable, isStatic, moved);
    }

    public LayoutItem withMoved(boolean newMoved) {
        if (newMoved == moved) {
            return this;
        }
        return new LayoutItem(id, x, y, w, h, minW, minH, maxW, maxH, isDraggable, isResizable, isStatic, newMoved);
    }

    public LayoutItem withBounds(int newMinW, int newMinH, int newMaxW, int newMaxH) {
        return new LayoutItem(id, x, y, w, h, newMinW, newMinH, newMaxW, newMaxH, isDraggable, isResizable, isStatic, moved);
    }

    /**
     * Clamps the requested span into this item's resize bounds.
     *
     * @param requestedW Desired width.
     * @param requestedH Desired height.
     * @return A copy whose size lies within {@code [minW, maxW] x [minH, maxH]}.
     */
    public LayoutItem withSizeClamped(int requestedW, int requestedH) {
        int clampedW = Math.max(minW, Math.min(maxW, requestedW));
        int clampedH = Math.max(minH, Math.min(maxH, requestedH));
        return withSize(clampedW, clampedH);
    }

    /**
     * Checks position and span against another item, ignoring flags.
     */
    public boolean sameGeometry(LayoutItem other) {
        return x == other.x && y == other.y && w == other.w && h == other.h;
    }

    @Override
    public String toString() {
        return "LayoutItem(id: " + id + ", x: " + x + ", y: " + y + ", w: " + w + ", h: " + h
            + ", isStatic: " + isStatic + ")";
    }
}
