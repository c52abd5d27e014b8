package org.gridlayout.engine.placement;

import java.util.List;
import org.gridlayout.engine.config.EngineLimits;
import org.gridlayout.engine.model.LayoutItem;
import org.gridlayout.engine.testing.logging.LogWatchExtension;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for {@link LayoutOptimizer}. Each test builds a fragmented
 * layout and checks where the defragmentation puts the items.
 */
@ExtendWith(LogWatchExtension.class)
public class LayoutOptimizerTest {

    private final LayoutOptimizer optimizer = new LayoutOptimizer(EngineLimits.defaults());

    private static LayoutItem find(List<LayoutItem> layout, String id) {
        return layout.stream().filter(item -> item.id().equals(id)).findFirst().orElseThrow();
    }

    @Test
    @Tag("unit")
    void packsDiagonalItemsIntoFirstRow() {
        List<LayoutItem> input = List.of(
            LayoutItem.of("A", 0, 0, 1, 1),
            LayoutItem.of("B", 1, 1, 1, 1),
            LayoutItem.of("C", 2, 2, 1, 1));

        List<LayoutItem> result = optimizer.optimizeLayout(input, 3);

        assertThat(result).extracting(LayoutItem::x).containsExactly(0, 1, 2);
        assertThat(result).extracting(LayoutItem::y).containsOnly(0);
        assertThat(result).extracting(LayoutItem::moved).containsOnly(false);
    }

    @Test
    @Tag("unit")
    void staticItemsAreWalls() {
        List<LayoutItem> input = List.of(
            LayoutItem.staticItem("S", 1, 0, 1, 1),
            LayoutItem.of("D", 0, 2, 1, 1));

        List<LayoutItem> result = optimizer.optimizeLayout(input, 3);

        assertThat(find(result, "S").x()).isEqualTo(1);
        assertThat(find(result, "S").y()).isZero();
        assertThat(find(result, "D").x()).isZero();
        assertThat(find(result, "D").y()).isZero();
    }

    @Test
    @Tag("unit")
    void preservesReadingOrderButNotListOrder() {
        List<LayoutItem> input = List.of(
            LayoutItem.of("2", 0, 2, 1, 1),
            LayoutItem.of("1", 0, 1, 1, 1));

        List<LayoutItem> result = optimizer.optimizeLayout(input, 1);

        assertThat(result).extracting(LayoutItem::id).containsExactly("2", "1");
        assertThat(find(result, "1").y()).isZero();
        assertThat(find(result, "2").y()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void largeItemsSkipGapsThatAreTooSmall() {
        List<LayoutItem> input = List.of(
            LayoutItem.of("A", 0, 0, 1, 1),
            LayoutItem.of("B", 2, 0, 1, 1),
            LayoutItem.of("L", 0, 2, 2, 1));

        List<LayoutItem> result = optimizer.optimizeLayout(input, 3);

        assertThat(find(result, "B").x()).isEqualTo(1);
        assertThat(find(result, "L").x()).isZero();
        assertThat(find(result, "L").y()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void itemWiderThanGridGoesBelowEverything() {
        List<LayoutItem> input = List.of(
            LayoutItem.of("A", 0, 0, 2, 2),
            LayoutItem.of("W", 0, 5, 5, 1));

        List<LayoutItem> result = optimizer.optimizeLayout(input, 3);

        assertThat(find(result, "W").x()).isZero();
        assertThat(find(result, "W").y()).isEqualTo(2);
    }

    @Test
    @Tag("unit")
    void emptyLayoutIsReturnedAsIs() {
        List<LayoutItem> empty = List.of();

        assertThat(optimizer.optimizeLayout(empty, 3)).isSameAs(empty);
    }
}
