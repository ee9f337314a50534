package org.latex2typst;

// Converts one math element to target markup, supplied by the tree walker
@FunctionalInterface
public interface ElementRenderer {
    // Copies source text as is
    ElementRenderer VERBATIM = (element, out) -> out.append(element.text());

    void render(MathElement element, StringBuilder out);
}
