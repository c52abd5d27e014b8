package org.gridlayout.engine.move;

import java.util.List;
import java.util.Set;
import org.gridlayout.engine.compaction.CompactType;
import org.gridlayout.engine.config.EngineLimits;
import org.gridlayout.engine.model.LayoutItem;
import org.gridlayout.engine.testing.logging.LogWatchExtension;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for {@link ClusterMover}.
 */
@ExtendWith(LogWatchExtension.class)
public class ClusterMoverTest {

    private final ClusterMover mover = new ClusterMover(new MoveResolver(EngineLimits.defaults()));

    private static LayoutItem find(List<LayoutItem> layout, String id) {
        return layout.stream().filter(item -> item.id().equals(id)).findFirst().orElseThrow();
    }

    @Test
    @Tag("unit")
    void movesAllMembersBySameDelta() {
        List<LayoutItem> layout = List.of(
            LayoutItem.of("A", 0, 0, 2, 1),
            LayoutItem.of("B", 0, 1, 2, 1));

        List<LayoutItem> result = mover.moveCluster(layout, Set.of("A", "B"), 2, 0, 4, CompactType.NONE, false);

        assertThat(result).extracting(LayoutItem::id).containsExactly("A", "B");
        assertThat(find(result, "A").x()).isEqualTo(2);
        assertThat(find(result, "A").y()).isZero();
        assertThat(find(result, "B").x()).isEqualTo(2);
        assertThat(find(result, "B").y()).isEqualTo(1);
        assertThat(result).allMatch(LayoutItem::moved);
    }

    @Test
    @Tag("unit")
    void pushesObstaclesOutOfTheBoundingBox() {
        List<LayoutItem> layout = List.of(
            LayoutItem.of("A", 0, 0, 2, 1),
            LayoutItem.of("B", 0, 1, 2, 1),
            LayoutItem.of("O", 2, 0, 2, 2));

        List<LayoutItem> result = mover.moveCluster(layout, Set.of("A", "B"), 1, 0, 10, CompactType.VERTICAL, true);

        assertThat(find(result, "A").x()).isEqualTo(1);
        assertThat(find(result, "B").x()).isEqualTo(1);
        assertThat(find(result, "O").y()).isEqualTo(2);
        assertThat(result).extracting(LayoutItem::id).doesNotContain(ClusterMover.CLUSTER_ID);
    }

    @Test
    @Tag("unit")
    void emptyOrUnknownClusterIsNoOp() {
        List<LayoutItem> layout = List.of(LayoutItem.of("A", 0, 0, 1, 1));

        assertThat(mover.moveCluster(layout, Set.of(), 2, 2, 4, CompactType.VERTICAL, true)).isSameAs(layout);
        assertThat(mover.moveCluster(layout, Set.of("missing"), 2, 2, 4, CompactType.VERTICAL, true)).isSameAs(layout);
    }

    @Test
    @Tag("unit")
    void staticMembersStayInPlace() {
        LayoutItem s = LayoutItem.staticItem("S", 3, 3, 1, 1);
        List<LayoutItem> layout = List.of(LayoutItem.of("A", 0, 0, 1, 1), s);

        List<LayoutItem> result = mover.moveCluster(layout, Set.of("A", "S"), 1, 0, 4, CompactType.NONE, false);

        assertThat(find(result, "A").x()).isEqualTo(1);
        assertThat(find(result, "S")).isSameAs(s);
    }

    @Test
    @Tag("unit")
    void rejectsLayoutUsingReservedClusterId() {
        List<LayoutItem> layout = List.of(
            LayoutItem.of("A", 0, 0, 1, 1),
            LayoutItem.of(ClusterMover.CLUSTER_ID, 3, 0, 1, 1));

        assertThatThrownBy(() -> mover.moveCluster(layout, Set.of("A"), 2, 0, 4, CompactType.NONE, false))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining(ClusterMover.CLUSTER_ID);
    }
}
