package org.latex2typst;

import java.util.Optional;

// Horizontal rule, full width or over the 1-based inclusive column range
public record HLine(Optional<Pair<Integer, Integer>> range) {
    public static HLine full() {
        return new HLine(Optional.empty());
    }

    public static HLine partial(int start, int end) {
        if (start < 1 || end < start) {
            throw new IllegalArgumentException("bad rule range " + start + "-" + end);
        }
        return new HLine(Optional.of(Pair.of(start, end)));
    }

    // Typst counts columns from 0 and `end` is exclusive
    public String toTypst() {
        return range
            .map(r -> "table.hline(start: " + (r.first() - 1) + ", end: " + r.second() + ")")
            .orElse("table.hline()");
    }
}
