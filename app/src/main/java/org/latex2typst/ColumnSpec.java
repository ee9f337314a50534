package org.latex2typst;

import java.util.*;

/**
 * Column letters of a tabular preamble such as {@code |l|*{2}{c}|p{3cm}|}.
 *
 * Every column comes out as one of {@code l}, {@code c} or {@code r}.
 * Paragraph and package column types count as {@code l}.
 */
public final class ColumnSpec {
    // *{n}{...} repeats at most this often
    static final int MAX_REPEAT = 1000;

    private ColumnSpec() {}

    public static List<String> parse(String spec) {
        var columns = new ArrayList<String>();
        int i = 0;
        while (i < spec.length()) {
            char c = spec.charAt(i);
            switch (c) {
                case 'l', 'c', 'r' -> {
                    columns.add(String.valueOf(c));
                    i++;
                }
                case '*' -> {
                    i = skipWhitespace(spec, i + 1);
                    int count = 1;
                    if (i < spec.length() && spec.charAt(i) == '{') {
                        int end = closingBrace(spec, i);
                        count = parseCount(spec.substring(i + 1, Math.max(end - 1, i + 1)));
                        i = end;
                    }
                    i = skipWhitespace(spec, i);
                    if (i < spec.length() && spec.charAt(i) == '{') {
                        int end = closingBrace(spec, i);
                        var inner = parse(spec.substring(i + 1, Math.max(end - 1, i + 1)));
                        for (int n = 0; n < count; n++) {
                            columns.addAll(inner);
                        }
                        i = end;
                    }
                }
                // decorations, not columns
                case '>', '<', '@', '!' -> i = skipArgument(spec, i + 1);
                case '|' -> i++;
                default -> {
                    if (CharClass.isLetter(c)) {
                        // p{..}, m{..}, b{..}, X, S[..], and unknown column types
                        i = skipArgument(spec, i + 1);
                        columns.add("l");
                    } else {
                        i++;
                    }
                }
            }
        }

        if (columns.isEmpty()) {
            columns.add("l");
        }
        return columns;
    }

    public static List<CellAlign> alignments(String spec) {
        var aligns = new ArrayList<CellAlign>();
        for (var column : parse(spec)) {
            aligns.add(CellAlign.fromSpec(column));
        }
        return aligns;
    }

    private static int parseCount(String text) {
        try {
            return Math.min(Math.max(Integer.parseInt(text.trim()), 0), MAX_REPEAT);
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    private static int skipWhitespace(String spec, int i) {
        while (i < spec.length() && Character.isWhitespace(spec.charAt(i))) {
            i++;
        }
        return i;
    }

    // Skips an optional braced argument
    private static int skipArgument(String spec, int i) {
        i = skipWhitespace(spec, i);
        if (i < spec.length() && spec.charAt(i) == '{') {
            return closingBrace(spec, i);
        }
        return i;
    }

    // Index just past the brace that closes the one at `open`
    private static int closingBrace(String spec, int open) {
        int depth = 0;
        for (int i = open; i < spec.length(); i++) {
            char c = spec.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return spec.length();
    }
}
