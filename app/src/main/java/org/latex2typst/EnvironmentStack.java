package org.latex2typst;

import java.util.*;

/**
 * Environments the tree walker is nested in, innermost last.
 *
 * One stack per conversion, passed along explicitly. Every {@link #push} must
 * be matched by a {@link #pop} on all exit paths, usually from a
 * {@code finally} block.
 */
public class EnvironmentStack {
    private final ArrayDeque<EnvironmentContext> stack = new ArrayDeque<>();

    public void push(EnvironmentContext context) {
        stack.push(context);
    }

    public Optional<EnvironmentContext> pop() {
        return Optional.ofNullable(stack.poll());
    }

    // NONE when empty
    public EnvironmentContext current() {
        var context = stack.peek();
        return context == null ? EnvironmentContext.NONE : context;
    }

    public boolean isInside(EnvironmentContext context) {
        return stack.contains(context);
    }

    public int depth() {
        return stack.size();
    }

    public boolean isEmpty() {
        return stack.isEmpty();
    }
}
