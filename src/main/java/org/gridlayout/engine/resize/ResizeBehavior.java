package org.gridlayout.engine.resize;

/**
 * How a resize treats the items it grows into.
 */
public enum ResizeBehavior {
    /** Colliding items are pushed down. */
    PUSH,
    /** Horizontal neighbours give up width down to their {@code minW}; falls back to {@link #PUSH} otherwise. */
    SHRINK
}
