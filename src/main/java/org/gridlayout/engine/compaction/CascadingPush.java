package org.gridlayout.engine.compaction;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import java.util.List;
import org.gridlayout.engine.geometry.Collisions;
import org.gridlayout.engine.model.LayoutItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Propagates a compaction push onto the items that come later in the pass.
 * <p>
 * When the item at {@code origin} is pushed, every later non-static item it now
 * overlaps is moved just past it, and so on transitively. Uses an explicit stack and
 * a visited set so the depth is bounded by the pass length, not by the call stack.
 */
final class CascadingPush {

    private static final Logger LOG = LoggerFactory.getLogger(CascadingPush.class);

    private CascadingPush() {}

    /**
     * Applies the cascade in place on the working list of the pass.
     *
     * @param work The items of the pass in processing order; entries after {@code origin} are updated.
     * @param origin Index of the item that was just pushed.
     * @param vertical True to push along {@code y}, false along {@code x}.
     * @param maxSteps Upper bound on processed stack entries.
     */
    static void propagate(List<LayoutItem> work, int origin, boolean vertical, int maxSteps) {
        IntArrayList stack = new IntArrayList();
        IntSet visited = new IntOpenHashSet();
        stack.push(origin);
        visited.add(origin);
        int steps = 0;

        while (!stack.isEmpty()) {
            if (++steps > maxSteps) {
                LOG.warn("Cascading push from item '{}' exceeded {} steps; remaining items are resolved in their own turn",
                    work.get(origin).id(), maxSteps);
                return;
            }
            int index = stack.popInt();
            LayoutItem mover = work.get(index);
            for (int j = index + 1; j < work.size(); j++) {
                LayoutItem other = work.get(j);
                if (other.isStatic() || !Collisions.collides(mover, other)) {
                    continue;
                }
                LayoutItem pushed = vertical ? other.withY(mover.bottom()) : other.withX(mover.right());
                work.set(j, pushed);
                if (visited.add(j)) {
                    stack.push(j);
                }
            }
        }
    }
}
