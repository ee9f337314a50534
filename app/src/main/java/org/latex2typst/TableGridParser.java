package org.latex2typst;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Rebuilds the logical grid of a tabular from its physical rows.
 *
 * <p>LaTeX leaves a placeholder cell, usually empty, under every column a
 * {@code \multirow} covers, while Typst wants nothing there. The parser
 * keeps one counter per column with the number of rows that are still
 * covered and drops placeholders while it is nonzero.
 *
 * <p>Output is produced in two passes. {@link #processRow} records the
 * cells as the input declared them. {@link #generateTypst} then normalizes
 * every row to the same width, padding short rows and clamping spans that
 * run past the last column.
 *
 * One instance per table.
 */
public class TableGridParser {
    /*
     * Logger
     */
    private static final Logger log = LogManager.getLogger("table");

    private final List<CellAlign> alignments;
    private final DegradationSink sink;

    // Rows each column is still covered by a row span from above
    private final ArrayList<Integer> coverage = new ArrayList<>();
    private final ArrayList<GridRow> rows = new ArrayList<>();
    private final ArrayList<HLine> pendingHlines = new ArrayList<>();
    private int maxCols = 0;

    public TableGridParser(List<CellAlign> alignments) {
        this(alignments, DegradationSink.IGNORE);
    }

    public TableGridParser(List<CellAlign> alignments, DegradationSink sink) {
        this.alignments = List.copyOf(alignments);
        this.sink = sink;
    }

    public List<GridRow> rows() {
        return Collections.unmodifiableList(rows);
    }

    public int maxCols() {
        return maxCols;
    }

    public void addHline() {
        pendingHlines.add(HLine.full());
    }

    public void addPartialHline(int start, int end) {
        pendingHlines.add(HLine.partial(start, end));
    }

    public void processRow(List<String> rawCells) {
        processRow(rawCells, false);
    }

    /**
     * Places the cells of one physical row, left to right, skipping the
     * columns that a row span from above still covers.
     */
    public void processRow(List<String> rawCells, boolean header) {
        var row = new GridRow();
        row.addHlines(pendingHlines);
        pendingHlines.clear();
        if (header) {
            row.markHeader();
        }

        int col = 0;
        for (var raw : rawCells) {
            ensureCoverage(col + 1);
            var cell = GridCell.parse(raw);

            if (coverage.get(col) > 0 && cell.isBlank()) {
                // Placeholder under a row span, Typst draws the spanned area
                int span = cell.colspan();
                for (int i = col; i < col + span && i < coverage.size(); i++) {
                    if (coverage.get(i) > 0) {
                        coverage.set(i, coverage.get(i) - 1);
                    }
                }
                col += span;
                continue;
            }

            if (coverage.get(col) > 0) {
                // Real content where a placeholder belongs. Keep the content,
                // the row span above loses this column
                sink.record(
                    DegradationKind.TABLE_STRUCTURE,
                    "multirow",
                    "content in column " + (col + 1) + " overrides a row span from above",
                    Optional.of(raw.trim())
                );
            }

            setCoverage(col, cell.colspan(), cell.rowspan() - 1);
            if (header) {
                cell = cell.asHeader();
            }
            // `\\` alone is what is left of a line break in an empty cell
            row.addCell(raw.equals("\\") ? GridCell.empty() : cell, col);
            col += cell.colspan();
        }

        // Columns a short row never reached still lose one row of coverage
        for (int i = col; i < coverage.size(); i++) {
            if (coverage.get(i) > 0) {
                coverage.set(i, coverage.get(i) - 1);
            }
        }

        maxCols = Math.max(maxCols, col);

        if (!row.isEmpty()) {
            rows.add(row);
        }
    }

    private void ensureCoverage(int size) {
        while (coverage.size() < size) {
            coverage.add(0);
        }
    }

    private void setCoverage(int col, int span, int rowsToCover) {
        ensureCoverage(col + span);
        for (int i = col; i < col + span; i++) {
            coverage.set(i, rowsToCover);
        }
    }

    /**
     * Rows at a fixed width: every row spans exactly {@code effectiveCols}
     * logical columns, counting the ones covered from above.
     */
    public List<GridRow> normalizedRows(int effectiveCols) {
        var normalized = new ArrayList<GridRow>(rows.size());
        var covered = new int[effectiveCols];

        for (int r = 0; r < rows.size(); r++) {
            var row = rows.get(r);
            var out = new GridRow();
            out.addHlines(row.hlinesBefore());
            if (row.isHeader()) {
                out.markHeader();
            }

            var cells = row.cells();
            int col = 0;
            int next = 0;
            int padded = 0;

            while (col < effectiveCols) {
                if (covered[col] > 0) {
                    boolean overrides = next < cells.size()
                        && row.startColumn(next) == col
                        && !cells.get(next).isBarePlaceholder();
                    if (!overrides) {
                        if (next < cells.size() && row.startColumn(next) == col) {
                            // stray placeholder under the span
                            next++;
                        }
                        covered[col]--;
                        out.skipCoveredColumn();
                        col++;
                        continue;
                    }
                }

                if (next < cells.size() && row.startColumn(next) <= col) {
                    var cell = cells.get(next++);
                    int remaining = effectiveCols - col;
                    if (cell.colspan() > remaining) {
                        sink.record(
                            DegradationKind.TABLE_STRUCTURE,
                            "multicolumn",
                            "row " + (r + 1) + ": span of " + cell.colspan()
                                + " columns clamped to " + remaining,
                            Optional.of(cell.content())
                        );
                        cell = cell.withColspan(remaining);
                    }
                    for (int i = col; i < col + cell.colspan(); i++) {
                        covered[i] = cell.rowspan() - 1;
                    }
                    out.addCell(cell, col);
                    col += cell.colspan();
                } else {
                    // out of cells, or the next one starts further right
                    out.addCell(row.isHeader() ? GridCell.empty().asHeader() : GridCell.empty(), col);
                    padded++;
                    col++;
                }
            }

            if (padded > 0) {
                log.debug("row {} padded with {} empty cells", r + 1, padded);
                sink.record(
                    DegradationKind.TABLE_STRUCTURE,
                    "tabular",
                    "row " + (r + 1) + " is short, padded with " + padded + " empty cells"
                );
            }
            if (next < cells.size()) {
                sink.record(
                    DegradationKind.TABLE_STRUCTURE,
                    "tabular",
                    "row " + (r + 1) + " has " + (cells.size() - next) + " cells past the last column, dropped"
                );
            }

            normalized.add(out);
        }
        return normalized;
    }

    /**
     * Typst {@code #table(...)} call for everything processed so far.
     *
     * @param colCount number of columns the tabular declared
     */
    public String generateTypst(int colCount) {
        int effectiveCols = Math.max(Math.max(colCount, maxCols), 1);
        var sb = new StringBuilder();

        sb.append("#table(\n");
        sb.append("    columns: (").append(String.join(", ", Collections.nCopies(effectiveCols, "auto"))).append("),\n");

        if (!alignments.isEmpty()) {
            var aligns = new ArrayList<String>();
            for (int i = 0; i < effectiveCols; i++) {
                aligns.add(i < alignments.size() ? alignments.get(i).toTypst() : CellAlign.AUTO.toTypst());
            }
            sb.append("    align: (").append(String.join(", ", aligns)).append("),\n");
        }

        var normalized = normalizedRows(effectiveCols);

        int headerRows = 0;
        while (headerRows < normalized.size() && normalized.get(headerRows).isHeader()) {
            headerRows++;
        }

        if (headerRows > 0) {
            sb.append("    table.header(\n");
            for (var row : normalized.subList(0, headerRows)) {
                writeRow(row, "        ", sb);
            }
            sb.append("    ),\n");
        }
        for (var row : normalized.subList(headerRows, normalized.size())) {
            writeRow(row, "    ", sb);
        }

        for (var hline : pendingHlines) {
            sb.append("    ").append(hline.toTypst()).append(",\n");
        }

        sb.append(")\n");
        return sb.toString();
    }

    private static void writeRow(GridRow row, String indent, StringBuilder sb) {
        for (var hline : row.hlinesBefore()) {
            sb.append(indent).append(hline.toTypst()).append(",\n");
        }
        if (row.cells().isEmpty()) {
            return;
        }
        var cells = new ArrayList<String>();
        for (var cell : row.cells()) {
            cells.add(cell.toTypst());
        }
        sb.append(indent).append(String.join(", ", cells)).append(",\n");
    }
}
