package org.latex2typst;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point for a {@code tabular} environment whose body has already been
 * flattened to the {@link TableMarkup} marker form.
 */
public final class TabularConverter {
    private static final Logger log = LogManager.getLogger("table");

    private TabularConverter() {}

    /**
     * Converts one tabular. Outside math it becomes a Typst table, inside math
     * (an {@code array}) a {@code mat(...)}.
     */
    public static String convert(
        EnvironmentStack environments,
        String colSpec,
        String content,
        boolean mathMode,
        DegradationSink sink
    ) {
        environments.push(EnvironmentContext.TABULAR);
        try {
            if (mathMode) {
                return renderMathMatrix(content);
            }
            return parseWithGridParser(content, ColumnSpec.alignments(colSpec), sink);
        } finally {
            environments.pop();
        }
    }

    public static String parseWithGridParser(String content, List<CellAlign> alignments) {
        return parseWithGridParser(content, alignments, DegradationSink.IGNORE);
    }

    public static String parseWithGridParser(String content, List<CellAlign> alignments, DegradationSink sink) {
        int colCount = Math.max(alignments.size(), 1);
        var parser = new TableGridParser(alignments, sink);

        var rows = TableMarkup.split(content, TableMarkup.ROW);
        var longtable = LongtableFilter.of(rows);
        longtable.ifPresent(f -> log.debug("longtable: head ends at {}, body starts at {}", f.headerEnd(), f.bodyStart()));

        for (int idx = 0; idx < rows.size(); idx++) {
            var row = rows.get(idx).trim();
            if (row.isEmpty()) {
                continue;
            }
            if (longtable.isPresent() && !longtable.get().shouldKeep(idx)) {
                continue;
            }

            var clean = row;
            if (row.contains(TableMarkup.HLINE)) {
                var range = TableMarkup.extractHlineRange(row);
                if (range.isPresent()) {
                    parser.addPartialHline(range.get().first(), range.get().second());
                } else {
                    parser.addHline();
                }
                clean = TableMarkup.cleanHlineArgs(row.replace(TableMarkup.HLINE, ""));
            }
            if (clean.isBlank()) {
                continue;
            }

            var cells = TableMarkup.cleanCells(clean);
            if (TableMarkup.containsLongtableControl(row)
                && !clean.contains(TableMarkup.CELL)
                && cells.stream().allMatch(String::isBlank)) {
                continue;
            }

            boolean header = longtable.isPresent() && longtable.get().isHeader(idx);
            parser.processRow(cells, header);
        }

        // a single row without row markers that was filtered away entirely
        if (parser.rows().isEmpty() && content.contains(TableMarkup.CELL)) {
            parser.processRow(TableMarkup.cleanCells(content.replace(TableMarkup.HLINE, "")));
        }

        return parser.generateTypst(colCount);
    }

    /**
     * Rows become {@code ;} separated, cells {@code ,} separated. Empty cells
     * get a zero-width space so the matrix keeps its shape.
     */
    public static String renderMathMatrix(String content) {
        var rowsOut = new ArrayList<String>();
        for (var row : TableMarkup.split(content, TableMarkup.ROW)) {
            var rowText = stripCommas(row.trim()).replace(TableMarkup.HLINE, "");
            if (rowText.isBlank() || isRule(rowText)) {
                continue;
            }

            var cellsOut = new ArrayList<String>();
            for (var cell : TableMarkup.split(rowText, TableMarkup.CELL)) {
                var cellText = stripCommas(cell.trim()).replace(TableMarkup.HLINE, "").trim();
                if (isRule(cellText)) {
                    continue;
                }
                cellsOut.add(cellText.isEmpty() ? "zws" : cellText);
            }
            if (!cellsOut.isEmpty()) {
                rowsOut.add(String.join(", ", cellsOut));
            }
        }
        return "mat(" + String.join("; ", rowsOut) + ")";
    }

    private static boolean isRule(String text) {
        return text.contains("table.hline") || text.contains("table.cline");
    }

    private static String stripCommas(String text) {
        int from = 0;
        int to = text.length();
        while (from < to && text.charAt(from) == ',') {
            from++;
        }
        while (to > from && text.charAt(to - 1) == ',') {
            to--;
        }
        return text.substring(from, to);
    }
}
