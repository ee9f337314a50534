package org.latex2typst;

import java.util.*;

/**
 * Decides which physical rows of a longtable survive.
 *
 * A longtable repeats its head and foot on every page. Rows before the
 * first head-end marker are the head, rendered once. Rows after the last
 * foot marker are the body. Everything in between is a repeated head or
 * foot and goes.
 */
public record LongtableFilter(OptionalInt headerEnd, int bodyStart) {

    // Empty when no row is a longtable control row
    public static Optional<LongtableFilter> of(List<String> rows) {
        boolean any = false;
        for (var row : rows) {
            if (TableMarkup.containsLongtableControl(row)) {
                any = true;
                break;
            }
        }
        if (!any) {
            return Optional.empty();
        }

        var endFirstHead = findControlRow(rows, "endfirsthead");
        var endHead = findControlRow(rows, "endhead");
        var endFoot = findControlRow(rows, "endfoot");
        var endLastFoot = findControlRow(rows, "endlastfoot");

        var headerEnd = endFirstHead.isPresent() ? endFirstHead : endHead;

        int bodyStart = 0;
        for (var marker : List.of(endLastFoot, endFoot, endHead, endFirstHead)) {
            if (marker.isPresent()) {
                bodyStart = marker.getAsInt() + 1;
                break;
            }
        }
        return Optional.of(new LongtableFilter(headerEnd, bodyStart));
    }

    public boolean isHeader(int rowIndex) {
        return headerEnd.isPresent() && rowIndex < headerEnd.getAsInt();
    }

    public boolean shouldKeep(int rowIndex) {
        return isHeader(rowIndex) || rowIndex >= bodyStart;
    }

    private static OptionalInt findControlRow(List<String> rows, String keyword) {
        for (int i = 0; i < rows.size(); i++) {
            var row = rows.get(i);
            if (row.toLowerCase(Locale.ROOT).contains(keyword) && isControlRow(row)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    // The keyword alone is not enough, `see \endhead` in a data cell is text
    static boolean isControlRow(String row) {
        if (!TableMarkup.containsLongtableControl(row)) {
            return false;
        }
        for (var cell : TableMarkup.cleanCells(row)) {
            if (!cell.isBlank()) {
                return false;
            }
        }
        return true;
    }
}
