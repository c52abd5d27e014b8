package org.gridlayout.engine.compaction;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.gridlayout.engine.model.LayoutItem;
import org.gridlayout.engine.model.Layouts;

/**
 * No gravity: items stay where they are unless they overlap an item that comes
 * earlier in axis order, in which case they are pushed forward along the axis until
 * clear. Compacting and resolving collisions are the same operation here.
 */
public class NoCompactionStrategy extends AbstractCompactionStrategy {

    private final CompactType axis;

    /**
     * Creates a strategy resolving overlaps along {@code y}.
     */
    public NoCompactionStrategy(int maxPushesPerItem) {
        this(CompactType.VERTICAL, maxPushesPerItem);
    }

    /**
     * @param axis {@link CompactType#VERTICAL} to push along {@code y} and sort by {@code (y, x)},
     *             {@link CompactType#HORIZONTAL} to push along {@code x} and sort by {@code (x, y)}.
     * @param maxPushesPerItem Upper bound on pushes for one item.
     */
    public NoCompactionStrategy(CompactType axis, int maxPushesPerItem) {
        super(maxPushesPerItem);
        Objects.requireNonNull(axis, "Axis cannot be null.");
        if (axis == CompactType.NONE) {
            throw new IllegalArgumentException("Overlap resolution axis must be VERTICAL or HORIZONTAL.");
        }
        this.axis = axis;
    }

    @Override
    public CompactType compactType() {
        return CompactType.NONE;
    }

    public CompactType axis() {
        return axis;
    }

    @Override
    public List<LayoutItem> resolveCollisions(List<LayoutItem> layout, int columns) {
        Layouts.requireValid(layout, columns);
        if (layout.isEmpty()) {
            return layout;
        }
        return resolveOverlaps(layout, axis == CompactType.VERTICAL);
    }

    @Override
    protected Map<String, LayoutItem> doCompact(List<LayoutItem> layout, int columns) {
        Map<String, LayoutItem> byId = new HashMap<>(layout.size() * 2);
        for (LayoutItem item : resolveOverlaps(layout, axis == CompactType.VERTICAL)) {
            byId.put(item.id(), item);
        }
        return byId;
    }
}
