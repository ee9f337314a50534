package org.latex2typst;

import java.util.*;

// How the call site of a macro is matched against its arguments
public sealed interface MacroSignature {
    int numArgs();

    // Plain positional arguments #1..#N, nothing between them
    record Simple(int arity) implements MacroSignature {
        public Simple {
            if (arity < 0 || arity > 9) {
                throw new IllegalArgumentException("arity out of range: " + arity);
            }
        }

        public int numArgs() {
            return arity;
        }
    }

    // TeX delimited parameters, e.g. \def\foo#1=#2. gives
    // [Argument(1), Literal(=), Argument(2), Literal(.)]
    record Pattern(List<PatternPart> parts) implements MacroSignature {
        public Pattern {
            parts = List.copyOf(parts);
        }

        public int numArgs() {
            int max = 0;
            for (var part : parts) {
                if (part instanceof PatternPart.Argument arg) {
                    max = Math.max(max, arg.n());
                }
            }
            return max;
        }
    }

    sealed interface PatternPart {
        record Argument(int n) implements PatternPart {}

        // Tokens that must appear verbatim at the call site
        record Literal(TokenList tokens) implements PatternPart {}
    }

    // Simple only when the parts are exactly #1, #2, ..., #N
    static MacroSignature of(List<PatternPart> parts) {
        for (int i = 0; i < parts.size(); i++) {
            if (!(parts.get(i) instanceof PatternPart.Argument arg) || arg.n() != i + 1) {
                return new Pattern(parts);
            }
        }
        return new Simple(parts.size());
    }
}
