package org.latex2typst;

import java.util.*;

/**
 * Maps TeX delimiters, the text after {@code \left} or {@code \right}, to
 * Typst delimiter names.
 */
public class DelimiterNames {
    public static final String EMPTY = ".";

    private final Map<String, String> table;

    public DelimiterNames(Map<String, String> table) {
        this.table = Map.copyOf(table);
    }

    public static DelimiterNames standard() {
        var table = new HashMap<String, String>();
        table.put(".", EMPTY);
        table.put("(", "(");
        table.put(")", ")");
        table.put("[", "[");
        table.put("]", "]");
        table.put("\\{", "{");
        table.put("\\lbrace", "{");
        table.put("\\}", "}");
        table.put("\\rbrace", "}");
        for (var bar : List.of("|", "\\vert", "\\lvert", "\\rvert")) {
            table.put(bar, "bar.v");
        }
        for (var bar : List.of("\\|", "\\Vert", "\\lVert", "\\rVert")) {
            table.put(bar, "bar.v.double");
        }
        table.put("\\langle", "chevron.l");
        table.put("\\rangle", "chevron.r");
        table.put("\\lfloor", "floor.l");
        table.put("\\rfloor", "floor.r");
        table.put("\\lceil", "ceil.l");
        table.put("\\rceil", "ceil.r");
        table.put("\\lgroup", "paren.l.flat");
        table.put("\\rgroup", "paren.r.flat");
        return new DelimiterNames(table);
    }

    /**
     * First delimiter in {@code text}: one character, a control word like
     * {@code \langle}, or a control symbol like {@code \|}. Empty text is the
     * empty delimiter {@code .}.
     */
    public static String extractDelimiter(String text) {
        if (text.isEmpty()) {
            return EMPTY;
        }
        if (text.charAt(0) != '\\') {
            return text.substring(0, Character.charCount(text.codePointAt(0)));
        }
        if (text.length() == 1) {
            return "\\";
        }
        if (!CharClass.isLetter(text.charAt(1))) {
            return text.substring(0, 1 + Character.charCount(text.codePointAt(1)));
        }
        int end = 1;
        while (end < text.length() && CharClass.isLetter(text.charAt(end))) {
            end++;
        }
        return text.substring(0, end);
    }

    // Unknown delimiters pass through unchanged
    public String toTypst(String delimiter) {
        var trimmed = delimiter.trim();
        return table.getOrDefault(trimmed, trimmed);
    }

    // Typst name of the delimiter at the start of `text`
    public String fromClauseText(String text) {
        return toTypst(extractDelimiter(text.trim()));
    }
}
