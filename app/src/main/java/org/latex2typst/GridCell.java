package org.latex2typst;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One cell of a reconstructed table.
 *
 * {@code content} is Typst markup that was already converted upstream.
 * {@code special} marks cells that arrived as a pre-rendered
 * {@code table.cell(...)} with their spans resolved, as opposed to plain text.
 */
public record GridCell(
    String content,
    int colspan,
    int rowspan,
    Optional<CellAlign> align,
    boolean header,
    boolean special
) {
    public static final String SPECIAL_PREFIX = "___TYPST_CELL___:";

    private static final Pattern SPECIAL_CELL =
        Pattern.compile("^table\\.cell\\(([^)]*)\\)\\[(.*)\\]$", Pattern.DOTALL);
    private static final Pattern NAMED_ARG =
        Pattern.compile("\\s*([a-z]+)\\s*:\\s*([^,]+?)\\s*(?:,|$)");

    public GridCell {
        if (colspan < 1 || rowspan < 1) {
            throw new IllegalArgumentException("cell spans must be at least 1, got " + colspan + "x" + rowspan);
        }
    }

    public static GridCell empty() {
        return new GridCell("", 1, 1, Optional.empty(), false, false);
    }

    public static GridCell plain(String content) {
        return new GridCell(content, 1, 1, Optional.empty(), false, false);
    }

    /**
     * Reads a raw cell. {@code ___TYPST_CELL___:table.cell(rowspan: R,
     * colspan: C, align: A)[content]} with any subset of the arguments is a
     * special cell, anything else is plain text.
     */
    public static GridCell parse(String raw) {
        var text = raw.trim();
        if (!text.startsWith(SPECIAL_PREFIX)) {
            return plain(text);
        }

        Matcher m = SPECIAL_CELL.matcher(text.substring(SPECIAL_PREFIX.length()).trim());
        if (!m.matches()) {
            return plain(text.substring(SPECIAL_PREFIX.length()).trim());
        }

        int colspan = 1;
        int rowspan = 1;
        Optional<CellAlign> align = Optional.empty();

        Matcher arg = NAMED_ARG.matcher(m.group(1));
        while (arg.find()) {
            var value = arg.group(2);
            switch (arg.group(1)) {
                case "colspan" -> colspan = parseSpan(value);
                case "rowspan" -> rowspan = parseSpan(value);
                case "align" -> align = Optional.of(CellAlign.fromTypst(value));
                default -> {}
            }
        }
        return new GridCell(m.group(2), colspan, rowspan, align, false, true);
    }

    // Garbage or zero counts as 1
    private static int parseSpan(String value) {
        try {
            return Math.max(Integer.parseInt(value.trim()), 1);
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    public boolean isBlank() {
        return content.trim().isEmpty();
    }

    // Blank, one by one, no alignment: stands for nothing at all
    public boolean isBarePlaceholder() {
        return isBlank() && !special && rowspan == 1 && colspan == 1 && align.isEmpty();
    }

    public GridCell withColspan(int colspan) {
        return new GridCell(content, colspan, rowspan, align, header, special);
    }

    public GridCell asHeader() {
        return new GridCell(content, colspan, rowspan, align, true, special);
    }

    // Only arguments that differ from the defaults are written
    public String toTypst() {
        var args = new ArrayList<String>();
        if (colspan > 1) {
            args.add("colspan: " + colspan);
        }
        if (rowspan > 1) {
            args.add("rowspan: " + rowspan);
        }
        align.ifPresent(a -> args.add("align: " + a.toTypst()));

        if (args.isEmpty()) {
            return "[" + content + "]";
        }
        return "table.cell(" + String.join(", ", args) + ")[" + content + "]";
    }
}
