package org.gridlayout.engine.compaction;

import java.util.List;
import java.util.Map;
import org.gridlayout.engine.config.EngineLimits;
import org.gridlayout.engine.model.LayoutItem;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the registry in {@link CompactionStrategyFactory}.
 */
public class CompactionStrategyFactoryTest {

    private final EngineLimits limits = EngineLimits.defaults();

    @Test
    @Tag("unit")
    void createsBuiltInStrategies() {
        assertThat(CompactionStrategyFactory.create("vertical", Map.of(), limits))
            .isInstanceOf(VerticalCompactionStrategy.class);
        assertThat(CompactionStrategyFactory.create("horizontal", Map.of(), limits))
            .isInstanceOf(HorizontalCompactionStrategy.class);
        assertThat(CompactionStrategyFactory.create("fast-vertical", null, limits))
            .isInstanceOf(FastVerticalCompactionStrategy.class);
        assertThat(CompactionStrategyFactory.create("fast-horizontal", Map.of(), limits))
            .isInstanceOf(FastHorizontalCompactionStrategy.class);
        assertThat(CompactionStrategyFactory.create("none", Map.of(), limits))
            .isInstanceOf(NoCompactionStrategy.class);
    }

    @Test
    @Tag("unit")
    void noneStrategyReadsAxisParameter() {
        ICompactionStrategy strategy = CompactionStrategyFactory.create("none", Map.of("axis", "x"), limits);

        assertThat(((NoCompactionStrategy) strategy).axis()).isEqualTo(CompactType.HORIZONTAL);
        assertThatThrownBy(() -> CompactionStrategyFactory.create("none", Map.of("axis", "z"), limits))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    void unknownTypeIsRejected() {
        assertThatThrownBy(() -> CompactionStrategyFactory.create("sideways", Map.of(), limits))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("sideways");
    }

    @Test
    @Tag("unit")
    void forTypeMapsCompactTypes() {
        assertThat(CompactionStrategyFactory.forType(CompactType.NONE, limits).compactType()).isEqualTo(CompactType.NONE);
        assertThat(CompactionStrategyFactory.forType(CompactType.VERTICAL, limits).compactType()).isEqualTo(CompactType.VERTICAL);
        assertThat(CompactionStrategyFactory.forType(CompactType.HORIZONTAL, limits).compactType()).isEqualTo(CompactType.HORIZONTAL);
    }

    @Test
    @Tag("unit")
    void customStrategiesCanBeRegistered() {
        CompactionStrategyFactory.register("frozen-test", (params, l) -> new NoCompactionStrategy(l.compactionMaxPushesPerItem()));
        List<LayoutItem> layout = List.of(LayoutItem.of("a", 0, 3, 1, 1));

        ICompactionStrategy strategy = CompactionStrategyFactory.create("frozen-test", Map.of(), limits);

        assertThat(strategy.compact(layout, 4).get(0).y()).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    void builtInNamesAreRejectedOnRegister() {
        for (String name : List.of("none", "vertical", "HORIZONTAL", "fast-vertical", "fast-horizontal")) {
            assertThatThrownBy(() -> CompactionStrategyFactory.register(name,
                (params, l) -> new NoCompactionStrategy(l.compactionMaxPushesPerItem())))
                .as(name)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Built-in");
        }
        assertThat(CompactionStrategyFactory.create("vertical", Map.of(), limits))
            .isInstanceOf(VerticalCompactionStrategy.class);
    }

    @Test
    @Tag("unit")
    void forTypeBuildsBaselineStrategiesDirectly() {
        assertThat(CompactionStrategyFactory.forType(CompactType.NONE, limits)).isInstanceOf(NoCompactionStrategy.class);
        assertThat(CompactionStrategyFactory.forType(CompactType.VERTICAL, limits))
            .isExactlyInstanceOf(VerticalCompactionStrategy.class);
        assertThat(CompactionStrategyFactory.forType(CompactType.HORIZONTAL, limits))
            .isExactlyInstanceOf(HorizontalCompactionStrategy.class);
    }
}
