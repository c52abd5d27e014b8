package org.gridlayout.engine.compaction;

import java.util.List;
import org.gridlayout.engine.model.LayoutItem;
import org.gridlayout.engine.testing.logging.LogWatchExtension;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for {@link VerticalCompactionStrategy}.
 * They verify gravity towards row 0, static anchors, the cascading push and the
 * handling of the {@code moved} flag.
 */
@ExtendWith(LogWatchExtension.class)
public class VerticalCompactionStrategyTest {

    private final VerticalCompactionStrategy strategy = new VerticalCompactionStrategy(10000);

    private static LayoutItem find(List<LayoutItem> layout, String id) {
        return layout.stream().filter(item -> item.id().equals(id)).findFirst().orElseThrow();
    }

    @Test
    @Tag("unit")
    void compactsItemsUpwards() {
        List<LayoutItem> result = strategy.compact(List.of(LayoutItem.of("1", 0, 2, 1, 1)), 12);

        assertThat(result.get(0).y()).isZero();
    }

    @Test
    @Tag("unit")
    void allowOverlapReturnsInput() {
        List<LayoutItem> layout = List.of(LayoutItem.of("1", 0, 2, 1, 1));

        assertThat(strategy.compact(layout, 12, true)).isSameAs(layout);
    }

    @Test
    @Tag("unit")
    void staticItemsAnchorOthers() {
        List<LayoutItem> layout = List.of(
            LayoutItem.staticItem("s", 0, 0, 12, 2),
            LayoutItem.of("a", 0, 5, 1, 1));

        List<LayoutItem> result = strategy.compact(layout, 12);

        assertThat(find(result, "s").y()).isZero();
        assertThat(find(result, "a").y()).isEqualTo(2);
    }

    /**
     * Verifies the exact result on a mixed layout and that a second pass changes nothing.
     */
    @Test
    @Tag("unit")
    void compactionIsIdempotent() {
        List<LayoutItem> layout = List.of(
            LayoutItem.of("A", 0, 3, 2, 2),
            LayoutItem.of("B", 1, 7, 2, 1),
            LayoutItem.staticItem("S", 2, 1, 1, 1),
            LayoutItem.of("C", 3, 0, 1, 4));

        List<LayoutItem> once = strategy.compact(layout, 4);
        List<LayoutItem> twice = strategy.compact(once, 4);

        assertThat(find(once, "A").y()).isZero();
        assertThat(find(once, "B").y()).isEqualTo(2);
        assertThat(find(once, "C").y()).isZero();
        assertThat(find(once, "S").y()).isEqualTo(1);
        assertThat(twice).isEqualTo(once);
    }

    @Test
    @Tag("unit")
    void clearsMovedFlagAndKeepsUnchangedInstances() {
        LayoutItem still = LayoutItem.of("still", 0, 0, 1, 1);
        LayoutItem flagged = LayoutItem.of("flagged", 1, 0, 1, 1).withMoved(true);
        LayoutItem falling = LayoutItem.of("falling", 2, 4, 1, 1);

        List<LayoutItem> result = strategy.compact(List.of(still, flagged, falling), 4);

        assertThat(result.get(0)).isSameAs(still);
        assertThat(result).extracting(LayoutItem::moved).containsOnly(false);
        assertThat(result.get(2).y()).isZero();
    }

    @Test
    @Tag("unit")
    void overlappingItemsArePushedBelow() {
        List<LayoutItem> layout = List.of(
            LayoutItem.of("A", 0, 0, 2, 2),
            LayoutItem.of("B", 0, 1, 2, 1),
            LayoutItem.of("C", 0, 2, 2, 1));

        List<LayoutItem> result = strategy.compact(layout, 4);

        assertThat(result).extracting(LayoutItem::y).containsExactly(0, 2, 3);
    }

    @Test
    @Tag("unit")
    void resolveCollisionsPushesDown() {
        List<LayoutItem> layout = List.of(LayoutItem.of("A", 0, 0, 1, 1), LayoutItem.of("B", 0, 0, 1, 1));

        List<LayoutItem> result = strategy.resolveCollisions(layout, 4);

        assertThat(result.get(1).y()).isEqualTo(1);
        assertThat(result.get(1).moved()).isTrue();
    }
}
