package com.company.dashboards.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;

/**
 * Placement of a chart on the 12-column dashboard grid. Cells are addressed by
 * column {@code [x, x + w)} and row {@code [y, y + h)}.
 */
@Value
@Builder
@Jacksonized
public class GridPosition implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final int GRID_COLUMNS = 12;
    public static final int MAX_HEIGHT = 20;

    int x;
    int y;
    int w;
    int h;

    public static GridPosition of(int x, int y, int w, int h) {
        return new GridPosition(x, y, w, h);
    }

    public boolean overlaps(GridPosition other) {
        return x < other.x + other.w && other.x < x + w
                && y < other.y + other.h && other.y < y + h;
    }

    /**
     * First and last shared column, or {@code null} when the two positions share no cell.
     */
    public int[] sharedColumns(GridPosition other) {
        if (!overlaps(other)) {
            return null;
        }
        return new int[]{Math.max(x, other.x), Math.min(x + w, other.x + other.w) - 1};
    }

    public int[] sharedRows(GridPosition other) {
        if (!overlaps(other)) {
            return null;
        }
        return new int[]{Math.max(y, other.y), Math.min(y + h, other.y + other.h) - 1};
    }
}
