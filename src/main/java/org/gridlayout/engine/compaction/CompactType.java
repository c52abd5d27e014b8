package org.gridlayout.engine.compaction;

/**
 * The direction in which a layout is compacted.
 */
public enum CompactType {
    /** No gravity. Only pre-existing overlaps are resolved. */
    NONE,
    /** Items float up towards row 0. */
    VERTICAL,
    /** Items float left towards column 0. */
    HORIZONTAL;

    /**
     * Returns true if pushes along this direction change {@code y}. {@link #NONE}
     * resolves vertically.
     */
    public boolean isVerticalAxis() {
        return this != HORIZONTAL;
    }
}
