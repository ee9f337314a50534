package org.latex2typst;

import java.util.Optional;

// A macro, environment, alias, conditional or operator declared in the
// source, reduced to one normalized shape per family
public sealed interface Definition {
    // Name of the thing being defined, without the backslash
    String name();

    enum CommandKind { NEW, RENEW, PROVIDE }

    // \newcommand{\name}[n][default]{body} and friends
    record CommandDef(
        CommandKind kind,
        String name,
        int numArgs,
        Optional<TokenList> defaultArg,
        TokenList body
    ) implements Definition {}

    // \def\name<parameter text>{body}; expanded for \edef/\xdef, global for \gdef/\xdef
    record PrimitiveDef(
        String name,
        MacroSignature signature,
        TokenList body,
        boolean expanded,
        boolean global
    ) implements Definition {}

    // \let\name=\target
    record LetDef(String name, String target) implements Definition {}

    // \newenvironment{name}[n][default]{begin}{end}
    record EnvironmentDef(
        boolean renew,
        String name,
        int numArgs,
        Optional<TokenList> defaultArg,
        TokenList beginBody,
        TokenList endBody
    ) implements Definition {}

    // \newif\iffoo, keeps only "foo"
    record NewIfDef(String baseName) implements Definition {
        public String name() {
            return "if" + baseName;
        }
    }

    // \DeclareMathOperator{\name}{text}
    record MathOperatorDef(String name, TokenList body, boolean starred) implements Definition {}
}
