package org.latex2typst;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The flattened form a tabular body arrives in: rows, cells and rules
 * separated by sentinel markers, plus the cleanup of rule commands that
 * are left inside cell text.
 */
public final class TableMarkup {
    public static final String ROW = "|||ROW|||";
    public static final String CELL = "|||CELL|||";
    public static final String HLINE = "|||HLINE|||";

    private static final Pattern RULE_COMMANDS = Pattern.compile(
        "\\\\(?:hline|toprule|midrule|bottomrule|endfirsthead|endhead|endfoot|endlastfoot)(?![a-zA-Z])"
            + "|\\\\(?:cline|hhline)\\s*\\{[^}]*\\}"
            + "|\\\\cmidrule\\s*(?:\\([^)]*\\))?\\s*(?:\\[[^\\]]*\\])?\\s*\\{[^}]*\\}"
    );

    // (lr)2-4, 3-4, {2-5}
    private static final Pattern RULE_RANGE =
        Pattern.compile("^\\s*(?:\\([a-zA-Z]*\\))?\\s*\\{?(\\d+)\\s*-\\s*(\\d+)\\}?");

    private static final List<String> LONGTABLE_KEYWORDS =
        List.of("endfirsthead", "endhead", "endfoot", "endlastfoot");

    private TableMarkup() {}

    public static List<String> split(String text, String marker) {
        return Arrays.asList(text.split(Pattern.quote(marker), -1));
    }

    // Cell text without rule commands and longtable markers
    public static String cleanCellContent(String cell) {
        return RULE_COMMANDS.matcher(cell).replaceAll("").trim();
    }

    // Drops a leading rule range annotation, `(lr)2-5 rest` -> `rest`
    public static String cleanHlineArgs(String row) {
        return RULE_RANGE.matcher(row).replaceFirst("").stripLeading();
    }

    /**
     * Column range of a partial rule in {@code row}, looked for in front of
     * the first rule marker and right after each one.
     */
    public static Optional<Pair<Integer, Integer>> extractHlineRange(String row) {
        var segments = split(row, HLINE);
        for (var segment : segments) {
            Matcher m = RULE_RANGE.matcher(segment);
            if (!m.find()) {
                continue;
            }
            try {
                int start = Integer.parseInt(m.group(1));
                int end = Integer.parseInt(m.group(2));
                if (start >= 1 && end >= start) {
                    return Optional.of(Pair.of(start, end));
                }
            } catch (NumberFormatException e) {
                // more digits than an int holds, not a column range
                continue;
            }
        }
        return Optional.empty();
    }

    public static boolean containsLongtableControl(String text) {
        var lower = text.toLowerCase(Locale.ROOT);
        for (var keyword : LONGTABLE_KEYWORDS) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    // Cells of a row after removing rule markers, annotations and commands
    public static List<String> cleanCells(String row) {
        var clean = row;
        if (clean.contains(HLINE)) {
            clean = cleanHlineArgs(clean.replace(HLINE, ""));
        }
        var cells = new ArrayList<String>();
        for (var cell : split(clean, CELL)) {
            cells.add(cleanCellContent(cell));
        }
        return cells;
    }
}
