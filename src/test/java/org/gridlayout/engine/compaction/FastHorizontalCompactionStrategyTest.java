package org.gridlayout.engine.compaction;

import java.util.List;
import org.gridlayout.engine.model.LayoutItem;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for {@link FastHorizontalCompactionStrategy}. The grid extent
 * passed to {@code compact} is the row count for this strategy.
 */
public class FastHorizontalCompactionStrategyTest {

    private final FastHorizontalCompactionStrategy strategy = new FastHorizontalCompactionStrategy(10000);

    private static LayoutItem find(List<LayoutItem> layout, String id) {
        return layout.stream().filter(item -> item.id().equals(id)).findFirst().orElseThrow();
    }

    @Test
    @Tag("unit")
    void compactsItemsLeftwards() {
        assertThat(strategy.compact(List.of(LayoutItem.of("1", 5, 0, 1, 1)), 10).get(0).x()).isZero();
    }

    @Test
    @Tag("unit")
    void staticItemBlocksRow() {
        List<LayoutItem> layout = List.of(
            LayoutItem.staticItem("S", 2, 0, 2, 1),
            LayoutItem.of("A", 5, 0, 1, 1));

        assertThat(find(strategy.compact(layout, 10), "A").x()).isEqualTo(4);
    }

    @Test
    @Tag("unit")
    void adjacentStaticsAreSkippedInSequence() {
        List<LayoutItem> layout = List.of(
            LayoutItem.staticItem("S1", 0, 0, 2, 1),
            LayoutItem.staticItem("S2", 2, 0, 2, 1),
            LayoutItem.of("A", 10, 0, 2, 1));

        assertThat(find(strategy.compact(layout, 10), "A").x()).isEqualTo(4);
    }

    @Test
    @Tag("unit")
    void laterStaticOnSameRowsPushesItemPastIt() {
        List<LayoutItem> layout = List.of(
            LayoutItem.of("D", 0, 0, 5, 2),
            LayoutItem.staticItem("S", 2, 0, 2, 2));

        assertThat(find(strategy.compact(layout, 10), "D").x()).isEqualTo(4);
    }

    /**
     * Items above, below and left of a static item do not touch its rows and reach column 0.
     */
    @Test
    @Tag("unit")
    void itemsOnOtherRowsIgnoreStatic() {
        List<LayoutItem> layout = List.of(
            LayoutItem.staticItem("Static", 5, 5, 2, 2),
            LayoutItem.of("Above", 10, 0, 2, 2),
            LayoutItem.of("Below", 10, 8, 2, 2),
            LayoutItem.of("Left", 0, 5, 2, 2));

        List<LayoutItem> result = strategy.compact(layout, 20);

        assertThat(find(result, "Above").x()).isZero();
        assertThat(find(result, "Below").x()).isZero();
        assertThat(find(result, "Left").x()).isZero();
        assertThat(find(result, "Static").x()).isEqualTo(5);
    }

    @Test
    @Tag("unit")
    void resolveCollisionsUsesHorizontalAxis() {
        List<LayoutItem> layout = List.of(LayoutItem.of("A", 0, 0, 1, 1), LayoutItem.of("B", 0, 0, 1, 1));

        assertThat(strategy.resolveCollisions(layout, 10).get(1).x()).isEqualTo(1);
    }
}
