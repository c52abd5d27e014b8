package org.gridlayout.engine.resize;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.gridlayout.engine.compaction.ICompactionStrategy;
import org.gridlayout.engine.compaction.VerticalCompactionStrategy;
import org.gridlayout.engine.geometry.Collisions;
import org.gridlayout.engine.model.LayoutItem;
import org.gridlayout.engine.model.Layouts;
import org.gridlayout.engine.move.MoveResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a new size to an item and makes room for it.
 * <p>
 * With {@link ResizeBehavior#SHRINK} each colliding neighbour loses exactly the
 * overlapping width, provided no neighbour is static and none drops below its
 * {@code minW}. Otherwise, and always with {@link ResizeBehavior#PUSH}, the resized
 * item is run through the {@link MoveResolver} at its own position so the colliding
 * items are pushed down.
 */
public class ResizeResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ResizeResolver.class);

    private final MoveResolver moveResolver;
    private final ICompactionStrategy pushStrategy;

    public ResizeResolver(MoveResolver moveResolver) {
        this.moveResolver = Objects.requireNonNull(moveResolver, "Move resolver cannot be null.");
        this.pushStrategy = new VerticalCompactionStrategy(moveResolver.limits().compactionMaxPushesPerItem());
    }

    /**
     * Resizes an item.
     *
     * @param layout The current layout.
     * @param resizedItem The item carrying the requested position and size; its id selects the target.
     * @param behavior How colliding items make room.
     * @param columns Column count of the grid.
     * @param preventCollision If true, a push that would end with the resized item overlapping a
     *                         static item, or displaced from its requested geometry, is rejected
     *                         and the input layout is returned.
     * @return The new layout, or the input for static, non-resizable or unknown items.
     */
    public List<LayoutItem> resizeItem(List<LayoutItem> layout, LayoutItem resizedItem, ResizeBehavior behavior,
                                       int columns, boolean preventCollision) {
        Layouts.requireValid(layout, columns);
        Objects.requireNonNull(resizedItem, "Resized item cannot be null.");
        Objects.requireNonNull(behavior, "Resize behavior cannot be null.");

        Optional<LayoutItem> stored = Layouts.findById(layout, resizedItem.id());
        if (stored.isEmpty()) {
            LOG.debug("Ignoring resize of unknown item '{}'", resizedItem.id());
            return layout;
        }
        if (stored.get().isStatic() || Boolean.FALSE.equals(stored.get().isResizable())) {
            return layout;
        }

        LayoutItem candidate = resizedItem.withSizeClamped(resizedItem.w(), resizedItem.h());
        List<LayoutItem> resized = Layouts.replace(layout, candidate);
        List<LayoutItem> collisions = Collisions.allCollisions(resized, candidate);
        if (collisions.isEmpty()) {
            return Layouts.freeze(resized);
        }

        if (behavior == ResizeBehavior.SHRINK) {
            Optional<List<LayoutItem>> shrunk = shrinkNeighbours(resized, candidate, collisions);
            if (shrunk.isPresent()) {
                return Layouts.freeze(shrunk.get());
            }
            LOG.debug("Neighbours of '{}' cannot shrink far enough; pushing instead", candidate.id());
        }

        if (!preventCollision) {
            return moveResolver.moveElement(
                resized, candidate, candidate.x(), candidate.y(), columns, pushStrategy, false, true);
        }

        List<LayoutItem> pushed = moveResolver.moveElement(
            resized, candidate, candidate.x(), candidate.y(), columns, pushStrategy, false, true);
        LayoutItem result = Layouts.findById(pushed, candidate.id()).orElseThrow();
        // a static collider makes the mover jump below it
        if (!result.sameGeometry(candidate)) {
            LOG.debug("Resize of '{}' runs into a static item; keeping the previous layout", candidate.id());
            return layout;
        }
        return pushStrategy.resolveCollisions(pushed, columns);
    }

    /**
     * Shrinks every colliding item by its horizontal overlap with the resized item.
     * All or nothing: empty if any collider is static or would fall below {@code minW}.
     */
    private static Optional<List<LayoutItem>> shrinkNeighbours(List<LayoutItem> layout, LayoutItem resized,
                                                               List<LayoutItem> collisions) {
        List<LayoutItem> shrunk = new ArrayList<>(collisions.size());
        for (LayoutItem collider : collisions) {
            if (collider.isStatic()) {
                return Optional.empty();
            }
            LayoutItem replacement;
            if (resized.x() < collider.x()) {
                // growing towards the right: the neighbour gives up its left part
                int overlap = resized.right() - collider.x();
                int newW = collider.w() - overlap;
                if (newW < collider.minW()) {
                    return Optional.empty();
                }
                replacement = collider.withGeometry(collider.x() + overlap, collider.y(), newW, collider.h());
            } else {
                int overlap = collider.right() - resized.x();
                int newW = collider.w() - overlap;
                if (newW < collider.minW()) {
                    return Optional.empty();
                }
                replacement = collider.withSize(newW, collider.h());
            }
            shrunk.add(replacement);
        }

        List<LayoutItem> result = layout;
        for (LayoutItem replacement : shrunk) {
            result = Layouts.replace(result, replacement);
        }
        return Optional.of(result);
    }
}
