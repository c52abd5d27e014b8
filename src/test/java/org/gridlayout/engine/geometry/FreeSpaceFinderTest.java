package org.gridlayout.engine.geometry;

import java.util.List;
import org.gridlayout.engine.model.LayoutItem;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the free-space queries of {@link FreeSpaceFinder}.
 */
public class FreeSpaceFinderTest {

    private static final List<LayoutItem> HALF_FILLED = List.of(LayoutItem.of("a", 0, 0, 2, 2));

    @Test
    @Tag("unit")
    void emptyLayoutHasOneRowOfSpace() {
        assertThat(FreeSpaceFinder.freeAreas(List.of(), 4))
            .singleElement()
            .satisfies(area -> assertThat(area.sameGeometry(LayoutItem.of("x", 0, 0, 4, 1))).isTrue());
    }

    @Test
    @Tag("unit")
    void findsMaximalRectangleBesideItem() {
        List<LayoutItem> areas = FreeSpaceFinder.freeAreas(HALF_FILLED, 4);

        assertThat(areas).singleElement()
            .satisfies(area -> {
                assertThat(area.id()).isEqualTo("free_area_0");
                assertThat(area.sameGeometry(LayoutItem.of("x", 2, 0, 2, 2))).isTrue();
            });
    }

    @Test
    @Tag("unit")
    void horizontalAreasAreSplitPerRow() {
        List<LayoutItem> areas = FreeSpaceFinder.horizontalFreeAreas(HALF_FILLED, 4);

        assertThat(areas).extracting(LayoutItem::y).containsExactly(0, 1);
        assertThat(areas).allSatisfy(area -> {
            assertThat(area.x()).isEqualTo(2);
            assertThat(area.w()).isEqualTo(2);
            assertThat(area.h()).isEqualTo(1);
        });
    }

    @Test
    @Tag("unit")
    void canItemFitChecksSpanAgainstFreeAreas() {
        assertThat(FreeSpaceFinder.canItemFit(HALF_FILLED, 4, LayoutItem.of("n", 0, 0, 2, 2))).isTrue();
        assertThat(FreeSpaceFinder.canItemFit(HALF_FILLED, 4, LayoutItem.of("n", 0, 0, 3, 1))).isFalse();
    }

    @Test
    @Tag("unit")
    void lastRowAreaStartsOnRowOfLowestItem() {
        List<LayoutItem> layout = List.of(LayoutItem.of("a", 0, 0, 4, 1), LayoutItem.of("b", 0, 1, 1, 1));

        assertThat(FreeSpaceFinder.lastRowFreeArea(layout, 4))
            .hasValueSatisfying(area -> {
                assertThat(area.y()).isEqualTo(1);
                assertThat(area.x()).isEqualTo(1);
            });
        assertThat(FreeSpaceFinder.lastRowFreeArea(List.of(), 4)).isEmpty();
        assertThat(FreeSpaceFinder.firstFreeArea(layout, 4)).isPresent();
    }
}
