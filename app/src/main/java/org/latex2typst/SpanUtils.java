package org.latex2typst;

import java.util.*;

public class SpanUtils {
    // Returns (line, column), both starting with 1.
    //
    // `numChar` is a 1-based character position, `lineIndex` holds the
    // 0-based offsets where each line starts (first entry is always 0).
    public static Pair<Integer, Integer> locate(
        int numChar, List<Integer> lineIndex
    ) {
        int offset = Math.max(numChar - 1, 0);
        var lineFind = Collections.binarySearch(lineIndex, offset);

        int lineIdx;
        if (lineFind >= 0) {
            lineIdx = lineFind;
        } else {
            // binarySearch returns (-(insertion_point) - 1), we want the
            // line that starts right before the insertion point
            lineIdx = -(lineFind + 1) - 1;
        }
        if (lineIdx < 0) {
            lineIdx = 0;
        }

        var column = offset - lineIndex.get(lineIdx) + 1;
        return new Pair<>(lineIdx + 1, column);
    }

    // Takes a span of two numChars
    public static String formatSpan(
        Pair<Integer, Integer> span,
        List<Integer> lineIndex
    ) {
        var firstPos = SpanUtils.locate(span.first(), lineIndex);
        var secondPos = SpanUtils.locate(span.second(), lineIndex);
        return String.format("%d,%d..%d,%d",
            firstPos.first(), firstPos.second(),
            secondPos.first(), secondPos.second()
        );
    }
}
