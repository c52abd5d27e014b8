package org.gridlayout.engine.move;

import java.util.List;
import org.gridlayout.engine.model.LayoutItem;

/**
 * Outcome of a move propagation.
 *
 * @param layout The resulting layout.
 * @param iterations Number of queue entries processed.
 * @param truncated True if propagation stopped at the safety cap and the layout is only partially resolved.
 */
public record MoveResult(List<LayoutItem> layout, int iterations, boolean truncated) {

    static MoveResult unchanged(List<LayoutItem> layout) {
        return new MoveResult(layout, 0, false);
    }
}
