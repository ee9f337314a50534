package org.latex2typst;

import java.util.*;

/**
 * Cells of one table row plus the rules drawn above it.
 *
 * Each cell remembers the logical column it was placed at, the
 * normalization pass needs it to tell an overriding cell apart from one
 * that belongs further right.
 */
public class GridRow {
    private final ArrayList<GridCell> cells = new ArrayList<>();
    private final ArrayList<Integer> startColumns = new ArrayList<>();
    private final ArrayList<HLine> hlinesBefore = new ArrayList<>();
    private int coveredColumns = 0;
    private boolean header = false;

    public void addCell(GridCell cell, int startColumn) {
        cells.add(cell);
        startColumns.add(startColumn);
    }

    public void addHlines(List<HLine> hlines) {
        hlinesBefore.addAll(hlines);
    }

    // A column filled by a row span from above
    void skipCoveredColumn() {
        coveredColumns++;
    }

    public List<GridCell> cells() {
        return Collections.unmodifiableList(cells);
    }

    public int startColumn(int cellIndex) {
        return startColumns.get(cellIndex);
    }

    public List<HLine> hlinesBefore() {
        return Collections.unmodifiableList(hlinesBefore);
    }

    public int coveredColumns() {
        return coveredColumns;
    }

    // Covered columns plus the columns the cells span
    public int logicalWidth() {
        int width = coveredColumns;
        for (var cell : cells) {
            width += cell.colspan();
        }
        return width;
    }

    public boolean isHeader() {
        return header;
    }

    void markHeader() {
        this.header = true;
    }

    public boolean isEmpty() {
        return cells.isEmpty() && hlinesBefore.isEmpty();
    }
}
