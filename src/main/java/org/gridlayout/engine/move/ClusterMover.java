package org.gridlayout.engine.move;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.gridlayout.engine.compaction.CompactType;
import org.gridlayout.engine.compaction.CompactionStrategyFactory;
import org.gridlayout.engine.compaction.ICompactionStrategy;
import org.gridlayout.engine.geometry.BoundingBox;
import org.gridlayout.engine.model.LayoutItem;
import org.gridlayout.engine.model.Layouts;

/**
 * Moves a set of items rigidly.
 * <p>
 * The members are replaced by their bounding box, which is moved through the
 * {@link MoveResolver} like a single item against every other item. The delta of the
 * box is then applied to each member. Static members are not moved and count as
 * obstacles.
 */
public class ClusterMover {

    /** Id of the transient item standing in for the cluster during the move. */
    public static final String CLUSTER_ID = "__cluster__";

    private final MoveResolver moveResolver;

    public ClusterMover(MoveResolver moveResolver) {
        this.moveResolver = Objects.requireNonNull(moveResolver, "Move resolver cannot be null.");
    }

    /**
     * Moves the cluster so that its bounding box starts at {@code (targetX, targetY)}.
     *
     * @param layout The current layout.
     * @param clusterIds Ids of the items to move together.
     * @param targetX Target column of the bounding box.
     * @param targetY Target row of the bounding box.
     * @param columns Column count of the grid.
     * @param compactType Direction whose overlap resolution runs when {@code preventCollision} is set.
     * @param preventCollision Passed to the move of the bounding box.
     * @return The new layout in input order, or the input if no member exists or nothing moved.
     * @throws IllegalArgumentException if the layout already contains an item with id {@link #CLUSTER_ID}.
     */
    public List<LayoutItem> moveCluster(List<LayoutItem> layout, Set<String> clusterIds, int targetX, int targetY,
                                        int columns, CompactType compactType, boolean preventCollision) {
        Layouts.requireValid(layout, columns);
        Objects.requireNonNull(clusterIds, "Cluster ids cannot be null.");
        Objects.requireNonNull(compactType, "Compact type cannot be null.");
        if (Layouts.findById(layout, CLUSTER_ID).isPresent()) {
            throw new IllegalArgumentException("Layout uses the reserved cluster id '" + CLUSTER_ID + "'.");
        }
        if (clusterIds.isEmpty()) {
            return layout;
        }

        List<LayoutItem> members = new ArrayList<>();
        List<LayoutItem> work = new ArrayList<>(layout.size() + 1);
        for (LayoutItem item : layout) {
            if (clusterIds.contains(item.id()) && !item.isStatic()) {
                members.add(item);
            } else {
                work.add(item);
            }
        }
        if (members.isEmpty()) {
            return layout;
        }

        LayoutItem box = BoundingBox.of(members).toItem(CLUSTER_ID);
        work.add(box);

        ICompactionStrategy strategy = CompactionStrategyFactory.forType(compactType, moveResolver.limits());
        List<LayoutItem> moved = moveResolver.moveElement(
            work, box, targetX, targetY, columns, strategy, preventCollision, false);
        if (moved == work) {
            return layout;
        }

        Map<String, LayoutItem> resolved = moved.stream()
            .collect(Collectors.toMap(LayoutItem::id, Function.identity()));
        LayoutItem movedBox = resolved.get(CLUSTER_ID);
        int dx = movedBox.x() - box.x();
        int dy = movedBox.y() - box.y();

        List<LayoutItem> result = new ArrayList<>(layout.size());
        for (LayoutItem item : layout) {
            if (clusterIds.contains(item.id()) && !item.isStatic()) {
                result.add(item.movedTo(item.x() + dx, item.y() + dy));
            } else {
                result.add(resolved.getOrDefault(item.id(), item));
            }
        }
        return Layouts.freeze(result);
    }
}
