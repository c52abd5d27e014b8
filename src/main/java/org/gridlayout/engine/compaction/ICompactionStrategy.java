package org.gridlayout.engine.compaction;

import java.util.List;
import org.gridlayout.engine.model.LayoutItem;

/**
 * A pluggable algorithm that moves items towards one edge of the grid to close gaps.
 * Implementations are stateless and safe to share between threads.
 */
public interface ICompactionStrategy {

    /**
     * Compacts the layout. Static items are never moved.
     *
     * @param layout The layout to compact.
     * @param columns The cross-axis extent of the grid.
     * @param allowOverlap If true the input is returned unchanged.
     * @return A new layout in the input order; items whose position did not change and
     *         whose {@code moved} flag was false are returned as the same instances.
     */
    List<LayoutItem> compact(List<LayoutItem> layout, int columns, boolean allowOverlap);

    /**
     * Compacts without allowing overlap.
     */
    default List<LayoutItem> compact(List<LayoutItem> layout, int columns) {
        return compact(layout, columns, false);
    }

    /**
     * Resolves overlaps without applying gravity: every item that overlaps an item
     * earlier in this strategy's sort order is pushed forward along the strategy's axis
     * until it is clear. Items keep their {@code moved} flag; pushed ones get it set.
     *
     * @param layout The layout to clean up.
     * @param columns The cross-axis extent of the grid.
     * @return A layout without overlaps between non-static items or against static items.
     */
    List<LayoutItem> resolveCollisions(List<LayoutItem> layout, int columns);

    /**
     * Returns the direction this strategy compacts in.
     */
    CompactType compactType();
}
