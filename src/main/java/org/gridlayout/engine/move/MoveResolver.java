package org.gridlayout.engine.move;

import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.gridlayout.engine.compaction.ICompactionStrategy;
import org.gridlayout.engine.config.EngineLimits;
import org.gridlayout.engine.geometry.Collisions;
import org.gridlayout.engine.model.LayoutItem;
import org.gridlayout.engine.model.Layouts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves one item to a target cell and pushes everything it lands on downwards.
 * <p>
 * Propagation is breadth-first: a queue is seeded with the moved item, and every
 * item overlapped by the head of the queue is pushed to the head's bottom edge and
 * enqueued. Each item is pushed at most once per call. When the head overlaps a
 * static item, the head itself jumps below the obstacle and is re-checked first.
 * Instances hold only their limits and are safe to share between threads.
 */
public class MoveResolver {

    private static final Logger LOG = LoggerFactory.getLogger(MoveResolver.class);

    private final EngineLimits limits;

    public MoveResolver(EngineLimits limits) {
        this.limits = Objects.requireNonNull(limits, "Engine limits cannot be null.");
    }

    /**
     * Moves an item and returns the new layout.
     *
     * @see #move(List, LayoutItem, int, int, int, ICompactionStrategy, boolean, boolean)
     */
    public List<LayoutItem> moveElement(List<LayoutItem> layout, LayoutItem item, int targetX, int targetY,
                                        int columns, ICompactionStrategy strategy,
                                        boolean preventCollision, boolean force) {
        return move(layout, item, targetX, targetY, columns, strategy, preventCollision, force).layout();
    }

    /**
     * Moves an item to {@code (targetX, targetY)} and resolves the resulting collisions.
     *
     * @param layout The current layout.
     * @param item The item to move; its current geometry is taken from {@code layout} when present.
     * @param targetX Target column.
     * @param targetY Target row.
     * @param columns Column count of the grid.
     * @param strategy Strategy whose overlap resolution runs when {@code preventCollision} is set.
     * @param preventCollision If true the pushed layout is passed through
     *                         {@link ICompactionStrategy#resolveCollisions} before returning.
     * @param force If true the move runs even if the item is already at the target.
     * @return The result; its layout is the input instance on the no-op paths.
     */
    public MoveResult move(List<LayoutItem> layout, LayoutItem item, int targetX, int targetY, int columns,
                           ICompactionStrategy strategy, boolean preventCollision, boolean force) {
        Layouts.requireValid(layout, columns);
        Objects.requireNonNull(item, "Item to move cannot be null.");
        Objects.requireNonNull(strategy, "Compaction strategy cannot be null.");

        LayoutItem stored = Layouts.findById(layout, item.id()).orElse(item);
        if (item.isStatic() || stored.isStatic()) {
            return MoveResult.unchanged(layout);
        }
        if (!force
            && stored.x() == targetX && stored.y() == targetY
            && stored.w() == item.w() && stored.h() == item.h()) {
            return MoveResult.unchanged(layout);
        }

        LayoutItem moving = stored.movedTo(targetX, targetY);

        Map<String, LayoutItem> byId = new LinkedHashMap<>(layout.size() * 2);
        for (LayoutItem existing : layout) {
            byId.put(existing.id(), existing);
        }
        byId.put(moving.id(), moving);

        Deque<LayoutItem> queue = new ArrayDeque<>();
        queue.add(moving);
        Set<String> processed = new ObjectOpenHashSet<>();
        processed.add(moving.id());

        int cap = limits.moveIterationCap(byId.size());
        int iterations = 0;
        boolean truncated = false;

        while (!queue.isEmpty()) {
            if (++iterations > cap) {
                LOG.warn("Move of item '{}' to ({}, {}) exceeded {} propagation steps; returning partially resolved layout",
                    item.id(), targetX, targetY, cap);
                truncated = true;
                iterations = cap;
                break;
            }
            LayoutItem current = byId.get(queue.pollFirst().id());

            List<LayoutItem> collisions = Collisions.allCollisions(byId.values(), current);
            collisions.sort(Comparator.comparingInt(LayoutItem::y));

            for (LayoutItem collision : collisions) {
                if (processed.contains(collision.id())) {
                    continue;
                }
                if (collision.isStatic()) {
                    LayoutItem jumped = current.movedTo(current.x(), collision.bottom());
                    byId.put(jumped.id(), jumped);
                    queue.addFirst(jumped);
                    break;
                }
                processed.add(collision.id());

                int newY = current.bottom();
                if (collision.y() >= newY) {
                    continue;
                }
                LayoutItem pushed = collision.movedTo(collision.x(), newY);
                byId.put(pushed.id(), pushed);
                queue.addLast(pushed);
            }
        }

        List<LayoutItem> result = new ArrayList<>(byId.values());
        if (preventCollision) {
            return new MoveResult(strategy.resolveCollisions(result, columns), iterations, truncated);
        }
        return new MoveResult(Layouts.freeze(result), iterations, truncated);
    }

    public EngineLimits limits() {
        return limits;
    }
}
