package org.latex2typst;

import java.util.List;

/**
 * Child of a {@code \left...\right} node, as handed over by the math parser
 * that walks the formula tree.
 */
public sealed interface MathElement {
    // Source text of the element
    String text();

    // A single source token, `x`, `+`, `\right)`
    record Token(String text) implements MathElement {}

    // Delimiter clause such as `\left\langle` or `\right.`
    record Clause(String text) implements MathElement {}

    // Any other sub-node; converted by the caller's renderer
    record Group(String text, List<MathElement> children) implements MathElement {
        public Group {
            children = List.copyOf(children);
        }
    }
}
