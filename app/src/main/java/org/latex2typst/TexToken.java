package org.latex2typst;

// The smallest unit of TeX processing.
//
// Closed set of shapes, every consumer dispatches with instanceof.
public sealed interface TexToken {
    TexToken BEGIN_GROUP = new BeginGroup();
    TexToken END_GROUP = new EndGroup();
    TexToken SPACE = new Space();
    TexToken MATH_SHIFT = new MathShift();
    TexToken ALIGN_TAB = new AlignTab();
    TexToken SUPERSCRIPT = new Superscript();
    TexToken SUBSCRIPT = new Subscript();

    // Text form of a single token, no separating spaces
    String display();

    default boolean isControlSeq(String name) {
        return this instanceof ControlSeq cs && cs.name().equals(name);
    }

    default boolean isChar(char c) {
        return this instanceof Char ch && ch.c() == c;
    }

    default boolean isSpaceOrComment() {
        return this instanceof Space || this instanceof Comment;
    }

    // ControlSeq = '\' ( Letter { Letter } | NonLetter )
    // The name does NOT include the leading backslash.
    record ControlSeq(String name) implements TexToken {
        public String display() {
            return "\\" + name;
        }

        boolean isControlWord() {
            if (name.isEmpty()) {
                return false;
            }
            for (int i = 0; i < name.length(); i++) {
                if (!CharClass.isLetter(name.charAt(i))) {
                    return false;
                }
            }
            return true;
        }
    }

    record BeginGroup() implements TexToken {
        public String display() {
            return "{";
        }
    }

    record EndGroup() implements TexToken {
        public String display() {
            return "}";
        }
    }

    // Param = '#' Digit, digit is 1..9
    record Param(int n) implements TexToken {
        public Param {
            if (n < 1 || n > 9) {
                throw new IllegalArgumentException("parameter number out of range: " + n);
            }
        }

        public String display() {
            return "#" + n;
        }
    }

    // DeferredParam = '##' Digit
    //
    // Belongs to a macro defined inside another macro's body, becomes
    // Param(n) once the outer macro is expanded.
    record DeferredParam(int n) implements TexToken {
        public DeferredParam {
            if (n < 1 || n > 9) {
                throw new IllegalArgumentException("parameter number out of range: " + n);
            }
        }

        public String display() {
            return "##" + n;
        }
    }

    record Char(char c) implements TexToken {
        public String display() {
            return String.valueOf(c);
        }
    }

    // Any run of blanks, or a single line break
    record Space() implements TexToken {
        public String display() {
            return " ";
        }
    }

    // Comment text without the leading '%' and without the line terminator
    record Comment(String text) implements TexToken {
        public String display() {
            return "%" + text;
        }
    }

    record MathShift() implements TexToken {
        public String display() {
            return "$";
        }
    }

    record AlignTab() implements TexToken {
        public String display() {
            return "&";
        }
    }

    record Superscript() implements TexToken {
        public String display() {
            return "^";
        }
    }

    record Subscript() implements TexToken {
        public String display() {
            return "_";
        }
    }

    // '~', non-breaking space in LaTeX
    record ActiveChar(char c) implements TexToken {
        public String display() {
            return String.valueOf(c);
        }
    }
}
