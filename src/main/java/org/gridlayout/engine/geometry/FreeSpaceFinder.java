package org.gridlayout.engine.geometry;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.gridlayout.engine.model.LayoutItem;
import org.gridlayout.engine.model.Layouts;

/**
 * Queries for empty space inside the occupied part of a grid, i.e. the rows
 * {@code [0, bottom)} of a layout. Results are returned as transient layout items
 * with ids {@code free_area_<n>}.
 */
public final class FreeSpaceFinder {

    private static final String AREA_ID_PREFIX = "free_area_";

    private FreeSpaceFinder() {}

    /**
     * Finds all maximal empty rectangles, sorted by {@code (y, x)}.
     * An empty layout has a single {@code columns x 1} area at the origin.
     *
     * @param layout The layout to inspect.
     * @param columns The column count of the grid.
     * @return The maximal free rectangles.
     */
    public static List<LayoutItem> freeAreas(List<LayoutItem> layout, int columns) {
        Layouts.requireValid(layout, columns);
        if (layout.isEmpty()) {
            return List.of(LayoutItem.of(AREA_ID_PREFIX + 0, 0, 0, columns, 1));
        }
        int rows = Layouts.bottom(layout);
        boolean[][] occupied = occupancy(layout, columns, rows);

        // Histogram sweep: heights[c] is the run of free cells ending at the current row.
        int[] heights = new int[columns];
        Set<Rect> candidates = new LinkedHashSet<>();
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                heights[c] = occupied[r][c] ? 0 : heights[c] + 1;
            }
            for (int c = 0; c < columns; c++) {
                int minHeight = heights[c];
                for (int k = c; k >= 0; k--) {
                    minHeight = Math.min(minHeight, heights[k]);
                    if (minHeight == 0) break;
                    candidates.add(new Rect(k, r - minHeight + 1, c - k + 1, minHeight));
                }
            }
        }

        List<Rect> maximal = new ArrayList<>();
        for (Rect a : candidates) {
            boolean contained = false;
            for (Rect b : candidates) {
                if (a != b && b.contains(a)) {
                    contained = true;
                    break;
                }
            }
            if (!contained) {
                maximal.add(a);
            }
        }
        maximal.sort((a, b) -> a.y != b.y ? Integer.compare(a.y, b.y) : Integer.compare(a.x, b.x));

        List<LayoutItem> result = new ArrayList<>(maximal.size());
        for (int i = 0; i < maximal.size(); i++) {
            Rect rect = maximal.get(i);
            result.add(LayoutItem.of(AREA_ID_PREFIX + i, rect.x, rect.y, rect.w, rect.h));
        }
        return result;
    }

    /**
     * Finds the empty runs of every row, each as a {@code w x 1} area, row by row.
     */
    public static List<LayoutItem> horizontalFreeAreas(List<LayoutItem> layout, int columns) {
        Layouts.requireValid(layout, columns);
        if (layout.isEmpty()) {
            return List.of(LayoutItem.of(AREA_ID_PREFIX + 0, 0, 0, columns, 1));
        }
        int rows = Layouts.bottom(layout);
        boolean[][] occupied = occupancy(layout, columns, rows);

        List<LayoutItem> areas = new ArrayList<>();
        int counter = 0;
        for (int r = 0; r < rows; r++) {
            int c = 0;
            while (c < columns) {
                if (occupied[r][c]) {
                    c++;
                    continue;
                }
                int start = c;
                while (c < columns && !occupied[r][c]) {
                    c++;
                }
                areas.add(LayoutItem.of(AREA_ID_PREFIX + counter++, start, r, c - start, 1));
            }
        }
        return areas;
    }

    public static Optional<LayoutItem> firstFreeArea(List<LayoutItem> layout, int columns) {
        List<LayoutItem> areas = freeAreas(layout, columns);
        return areas.isEmpty() ? Optional.empty() : Optional.of(areas.get(0));
    }

    /**
     * Returns the first free area starting on the row of the lowest item origin
     * ({@code max(y)} over the layout). Empty for an empty layout.
     */
    public static Optional<LayoutItem> lastRowFreeArea(List<LayoutItem> layout, int columns) {
        if (layout.isEmpty()) {
            return Optional.empty();
        }
        int lastItemRow = Integer.MIN_VALUE;
        for (LayoutItem item : layout) {
            lastItemRow = Math.max(lastItemRow, item.y());
        }
        for (LayoutItem area : freeAreas(layout, columns)) {
            if (area.y() == lastItemRow) {
                return Optional.of(area);
            }
        }
        return Optional.empty();
    }

    /**
     * Checks whether the item's span fits inside at least one maximal free area.
     */
    public static boolean canItemFit(List<LayoutItem> layout, int columns, LayoutItem item) {
        for (LayoutItem area : freeAreas(layout, columns)) {
            if (item.w() <= area.w() && item.h() <= area.h()) {
                return true;
            }
        }
        return false;
    }

    private static boolean[][] occupancy(List<LayoutItem> layout, int columns, int rows) {
        boolean[][] occupied = new boolean[rows][columns];
        for (LayoutItem item : layout) {
            int fromY = Math.max(0, item.y());
            int fromX = Math.max(0, item.x());
            int toY = Math.min(rows, item.bottom());
            int toX = Math.min(columns, item.right());
            for (int y = fromY; y < toY; y++) {
                for (int x = fromX; x < toX; x++) {
                    occupied[y][x] = true;
                }
            }
        }
        return occupied;
    }

    private record Rect(int x, int y, int w, int h) {
        boolean contains(Rect other) {
            return other.x >= x && other.y >= y && other.x + other.w <= x + w && other.y + other.h <= y + h;
        }
    }
}
