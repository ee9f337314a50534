package org.latex2typst;

import java.util.*;
import java.util.function.BiPredicate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Converts {@code \left <l> body \right <r>} to Typst.
 *
 * <p>The delimiter pair picks one of the shapes below. Rules are tried top to
 * bottom and the first match wins, so {@code \| \|} and {@code | |} are
 * decided before the general pair rules see them.
 *
 * <pre>
 *   \| \|           norm(body)
 *   |  |            abs(body)
 *   () [] {}        ( body )
 *   anything else   lr(l body r)
 *   missing side    body, without delimiters
 * </pre>
 */
public class DelimiterClassifier {
    public enum PairShape {
        // norm(...)
        NORM,
        // abs(...)
        ABS,
        // delimiters written out, Typst pairs them itself
        BARE,
        // lr(...)
        WRAPPED,
        // no wrapper, no delimiters
        UNWRAPPED
    }

    private record PairRule(String name, BiPredicate<String, String> matches, PairShape shape) {}

    private static final Set<List<String>> CROSS_PAIRS = Set.of(
        List.of("(", "]"),
        List.of("[", ")"),
        List.of("chevron.l", "chevron.r"),
        List.of("floor.l", "floor.r"),
        List.of("ceil.l", "ceil.r")
    );

    // Both sides present from here on, except for the "missing" rule
    private static final List<PairRule> RULES = List.of(
        new PairRule("norm",
            (l, r) -> "bar.v.double".equals(l) && "bar.v.double".equals(r), PairShape.NORM),
        new PairRule("abs",
            (l, r) -> "bar.v".equals(l) && "bar.v".equals(r), PairShape.ABS),
        new PairRule("bracket",
            (l, r) -> isBracketPair(l, r), PairShape.BARE),
        new PairRule("identical",
            (l, r) -> l != null && l.equals(r), PairShape.WRAPPED),
        new PairRule("cross",
            (l, r) -> l != null && r != null && CROSS_PAIRS.contains(List.of(l, r)), PairShape.WRAPPED),
        new PairRule("empty side",
            (l, r) -> l != null && r != null && (l.equals(DelimiterNames.EMPTY) || r.equals(DelimiterNames.EMPTY)),
            PairShape.WRAPPED),
        new PairRule("missing",
            (l, r) -> l == null || r == null, PairShape.UNWRAPPED),
        new PairRule("other",
            (l, r) -> true, PairShape.WRAPPED)
    );

    private static boolean isBracketPair(String l, String r) {
        return ("(".equals(l) && ")".equals(r))
            || ("[".equals(l) && "]".equals(r))
            || ("{".equals(l) && "}".equals(r));
    }

    /*
     * Logger
     */
    private static final Logger log = LogManager.getLogger("delimiters");

    private final DelimiterNames names;
    private final DegradationSink sink;

    public DelimiterClassifier() {
        this(DelimiterNames.standard(), DegradationSink.IGNORE);
    }

    public DelimiterClassifier(DelimiterNames names, DegradationSink sink) {
        this.names = names;
        this.sink = sink;
    }

    // null stands for a side that has no delimiter at all
    public static PairShape classify(String left, String right) {
        for (var rule : RULES) {
            if (rule.matches().test(left, right)) {
                log.trace("{} {} matched rule '{}'", left, right, rule.name());
                return rule.shape();
            }
        }
        throw new IllegalStateException("unreachable, the last rule matches everything");
    }

    /**
     * Appends the Typst form of a {@code \left...\right} node with the given
     * children to {@code out}.
     */
    public void convertLr(List<MathElement> children, ElementRenderer renderer, StringBuilder out) {
        String left = null;
        String right = null;
        int bodyStart = 0;
        int bodyEnd = children.size();

        for (int i = 0; i < children.size(); i++) {
            var child = children.get(i);
            if (isClause(child, "\\left")) {
                left = delimiterAfter(child, "\\left").orElse(null);
                bodyStart = i + 1;
                break;
            }
        }
        for (int i = children.size() - 1; i >= bodyStart; i--) {
            var child = children.get(i);
            if (isClause(child, "\\right")) {
                right = delimiterAfter(child, "\\right").orElse(null);
                bodyEnd = i;
                break;
            }
        }

        var shape = classify(left, right);
        log.debug("\\left{} \\right{} -> {}", left, right, shape);

        var body = new StringBuilder();
        renderBody(children.subList(bodyStart, bodyEnd), renderer, body);

        switch (shape) {
            case NORM -> writeCall("norm", body.toString(), out);
            case ABS -> writeCall("abs", body.toString(), out);
            case BARE -> out.append(left).append(' ').append(body).append(' ').append(right).append(' ');
            case WRAPPED -> {
                out.append("lr(");
                if (!isEmpty(left)) {
                    out.append(left).append(' ');
                }
                out.append(body);
                if (!isEmpty(right)) {
                    out.append(' ').append(right);
                }
                out.append(") ");
            }
            case UNWRAPPED -> {
                var missing = left == null ? "\\left" : "\\right";
                sink.record(
                    DegradationKind.DELIMITER_MISMATCH,
                    missing,
                    "no delimiter found for " + missing + ", emitted the content without delimiters",
                    Optional.of(sourceOf(children))
                );
                out.append(body);
            }
        }
    }

    private static boolean isClause(MathElement element, String prefix) {
        return !(element instanceof MathElement.Group) && startsWithCommand(element.text(), prefix);
    }

    // Typst name of the delimiter in a \left or \right clause, empty when
    // the clause carries no delimiter text at all
    private Optional<String> delimiterAfter(MathElement clause, String prefix) {
        var rest = clause.text().substring(prefix.length());
        if (rest.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(names.fromClauseText(rest));
    }

    // `\left` but not `\leftarrow`
    static boolean startsWithCommand(String text, String command) {
        if (!text.startsWith(command)) {
            return false;
        }
        return text.length() == command.length() || !CharClass.isLetter(text.charAt(command.length()));
    }

    private static void renderBody(List<MathElement> body, ElementRenderer renderer, StringBuilder out) {
        for (var element : body) {
            if (element instanceof MathElement.Token token
                && (token.text().equals(DelimiterNames.EMPTY) || token.text().startsWith("\\right"))) {
                continue;
            }
            renderer.render(element, out);
        }
    }

    private static void writeCall(String function, String body, StringBuilder out) {
        out.append(function).append('(');
        if (hasTopLevelComma(body)) {
            out.append('{').append(body.trim()).append('}');
        } else {
            out.append(body);
        }
        out.append(") ");
    }

    private static boolean isEmpty(String delimiter) {
        return delimiter == null || delimiter.isEmpty() || delimiter.equals(DelimiterNames.EMPTY);
    }

    /**
     * Whether {@code content} has a comma outside any (), [] or {} group and
     * outside string literals. Such a comma would split a function argument.
     */
    public static boolean hasTopLevelComma(String content) {
        int depth = 0;
        boolean inString = false;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '(', '[', '{' -> depth++;
                case ')', ']', '}' -> depth = Math.max(depth - 1, 0);
                case ',' -> {
                    if (depth == 0) {
                        return true;
                    }
                }
                default -> {}
            }
        }
        return false;
    }

    private static String sourceOf(List<MathElement> children) {
        var sb = new StringBuilder();
        for (var child : children) {
            sb.append(child.text());
        }
        return sb.toString();
    }
}
