package org.latex2typst;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Pulls macro, environment, alias, conditional and operator definitions
 * out of a token sequence.
 *
 * <p>Recognizes {@code \newcommand}, {@code \renewcommand},
 * {@code \providecommand}, {@code \DeclareRobustCommand},
 * {@code \NewDocumentCommand}, {@code \RenewDocumentCommand},
 * {@code \DeclareMathOperator}, {@code \newenvironment},
 * {@code \renewenvironment}, {@code \def}, {@code \gdef}, {@code \edef},
 * {@code \xdef}, {@code \let} and {@code \newif}.
 *
 * <p>Every form is parsed against the tokens that follow the command. If
 * the grammar doesn't match, the cursor goes back to where it was, the
 * command stays in the output as an ordinary token and scanning continues
 * with the token after it. Nothing is dropped and nothing is thrown.
 */
public class DefinitionParser {
    static final Set<String> DEFINITION_COMMANDS = Set.of(
        // LaTeX commands
        "newcommand", "renewcommand", "providecommand", "DeclareRobustCommand",
        // xparse, simplified
        "NewDocumentCommand", "RenewDocumentCommand",
        // operators
        "DeclareMathOperator",
        // environments
        "newenvironment", "renewenvironment",
        // primitives
        "def", "gdef", "edef", "xdef", "let",
        // conditionals
        "newif"
    );

    // how much source goes into a degradation snippet
    private static final int SNIPPET_TOKENS = 40;

    /*
     * Logger
     */
    private static final Logger log = LogManager.getLogger("definitions");

    private final int maxArgTokens;
    private final DegradationSink sink;

    public DefinitionParser() {
        this(TokenCursor.DEFAULT_MAX_ARG_TOKENS, DegradationSink.IGNORE);
    }

    public DefinitionParser(DegradationSink sink) {
        this(TokenCursor.DEFAULT_MAX_ARG_TOKENS, sink);
    }

    public DefinitionParser(int maxArgTokens, DegradationSink sink) {
        this.maxArgTokens = maxArgTokens;
        this.sink = sink;
    }

    public static boolean isDefinitionCommand(String name) {
        return DEFINITION_COMMANDS.contains(name);
    }

    // Grammar didn't match, unwinds to the checkpoint in parseDefinition
    private static final class DefinitionMismatch extends RuntimeException {
        DefinitionMismatch(String message) {
            super(message, null, false, false);
        }
    }

    private static DefinitionMismatch fail(String message) {
        return new DefinitionMismatch(message);
    }

    /**
     * Single left-to-right scan over {@code tokens}.
     */
    public ParsedDefinitions parseDefinitions(TokenList tokens) {
        var cursor = new TokenCursor(tokens, maxArgTokens);
        var definitions = new ArrayList<Definition>();
        var remaining = new ArrayList<TexToken>();

        while (cursor.hasNext()) {
            var token = cursor.next();
            if (token instanceof TexToken.ControlSeq cs && isDefinitionCommand(cs.name())) {
                var definition = parseDefinition(cs.name(), cursor);
                if (definition.isPresent()) {
                    definitions.add(definition.get());
                    continue;
                }
            }
            remaining.add(token);
        }

        log.debug("found {} definitions, {} tokens left", definitions.size(), remaining.size());
        return new ParsedDefinitions(definitions, new TokenList(remaining));
    }

    /**
     * Parses one definition from the tokens that follow {@code command}.
     *
     * @return the definition and the tokens after it, or no definition and
     *         {@code tokens} unchanged
     */
    public DefinitionResult parseDefinition(String command, TokenList tokens) {
        var cursor = new TokenCursor(tokens, maxArgTokens);
        var definition = parseDefinition(command, cursor);
        if (definition.isEmpty()) {
            return new DefinitionResult(Optional.empty(), tokens);
        }
        return new DefinitionResult(definition, cursor.remaining());
    }

    public record DefinitionResult(Optional<Definition> definition, TokenList rest) {}

    /**
     * Parses one definition at the cursor. On a mismatch the cursor is left
     * exactly where it was.
     */
    public Optional<Definition> parseDefinition(String command, TokenCursor cursor) {
        int checkpoint = cursor.position();
        cursor.resetLastRead();
        try {
            Definition definition = switch (command) {
                case "newcommand" -> parseCommandStyle(Definition.CommandKind.NEW, cursor);
                case "renewcommand" -> parseCommandStyle(Definition.CommandKind.RENEW, cursor);
                case "providecommand" -> parseCommandStyle(Definition.CommandKind.PROVIDE, cursor);
                case "DeclareRobustCommand" -> parseCommandStyle(Definition.CommandKind.NEW, cursor);
                case "NewDocumentCommand" -> parseDocumentCommand(Definition.CommandKind.NEW, cursor);
                case "RenewDocumentCommand" -> parseDocumentCommand(Definition.CommandKind.RENEW, cursor);
                case "DeclareMathOperator" -> parseMathOperator(cursor);
                case "newenvironment" -> parseEnvironment(false, cursor);
                case "renewenvironment" -> parseEnvironment(true, cursor);
                case "def" -> parseDef(false, false, cursor);
                case "gdef" -> parseDef(false, true, cursor);
                case "edef" -> parseDef(true, false, cursor);
                case "xdef" -> parseDef(true, true, cursor);
                case "let" -> parseLet(cursor);
                case "newif" -> parseNewIf(cursor);
                default -> throw fail("not a definition command");
            };

            if (!cursor.lastReadClosed()) {
                sink.record(
                    DegradationKind.PARSE_ERROR,
                    command,
                    "unterminated group in definition of \\" + definition.name() + ", read was cut short",
                    Optional.of(snippetAt(cursor, checkpoint))
                );
            }
            log.debug("\\{} -> {}", command, definition);
            return Optional.of(definition);
        } catch (DefinitionMismatch e) {
            log.debug("\\{} not a definition here: {}", command, e.getMessage());
            sink.record(
                DegradationKind.MACRO_DEFINITION,
                command,
                "\\" + command + " kept as plain text: " + e.getMessage(),
                Optional.of(snippetAt(cursor, checkpoint))
            );
            cursor.rewind(checkpoint);
            return Optional.empty();
        }
    }

    private static String snippetAt(TokenCursor cursor, int checkpoint) {
        return cursor.between(checkpoint, checkpoint + SNIPPET_TOKENS).detokenize();
    }

    /*
     * Shared grammar pieces
     */

    // `*`?
    private static boolean parseStar(TokenCursor cursor) {
        cursor.skipSpaces();
        if (cursor.peekIs('*')) {
            cursor.next();
            cursor.skipSpaces();
            return true;
        }
        return false;
    }

    // `{\name}` or `\name`
    private static String parseMacroName(TokenCursor cursor) {
        cursor.skipSpaces();
        var token = cursor.peek();
        if (token instanceof TexToken.BeginGroup) {
            cursor.next();
            var name = cursor.readControlSeqName()
                .orElseThrow(() -> fail("expected a control sequence inside braces"));
            if (!(cursor.next() instanceof TexToken.EndGroup)) {
                throw fail("expected '}' after \\" + name);
            }
            return name;
        }
        if (token instanceof TexToken.ControlSeq cs) {
            cursor.next();
            return cs.name();
        }
        throw fail("expected a command name");
    }

    // `[n]`?, 0 when absent
    private static int parseArity(TokenCursor cursor) {
        cursor.skipSpaces();
        if (!cursor.peekIs('[')) {
            return 0;
        }
        cursor.next();
        int arity = cursor.readNumber().orElse(0);
        cursor.skipUntilChar(']');
        if (arity > 9) {
            throw fail("argument count " + arity + " is more than 9");
        }
        return arity;
    }

    // `[default]`?
    private static Optional<TokenList> parseDefault(TokenCursor cursor) {
        cursor.skipSpaces();
        if (!cursor.peekIs('[')) {
            return Optional.empty();
        }
        cursor.next();
        return Optional.of(cursor.readUntilChar(']'));
    }

    // `{...}`
    private static TokenList parseGroup(TokenCursor cursor, String what) {
        cursor.skipSpaces();
        if (!cursor.peekIsBeginGroup()) {
            throw fail("expected '{' to open the " + what);
        }
        cursor.next();
        return cursor.readBalancedGroup();
    }

    /*
     * Forms
     */

    // \newcommand*{\name}[n][default]{body}
    private static Definition parseCommandStyle(Definition.CommandKind kind, TokenCursor cursor) {
        parseStar(cursor);
        var name = parseMacroName(cursor);
        var numArgs = parseArity(cursor);
        var defaultArg = parseDefault(cursor);
        var body = parseGroup(cursor, "body");
        return new Definition.CommandDef(kind, name, numArgs, defaultArg, body);
    }

    // \NewDocumentCommand{\name}{spec}{body}, the arity is the number of
    // mandatory `m` arguments in spec
    private static Definition parseDocumentCommand(Definition.CommandKind kind, TokenCursor cursor) {
        var name = parseMacroName(cursor);
        var spec = parseGroup(cursor, "argument spec");
        var body = parseGroup(cursor, "body");
        return new Definition.CommandDef(kind, name, countMandatoryArgs(spec), Optional.empty(), body);
    }

    // Only top-level letters count, `O{mm}` has no mandatory arguments
    static int countMandatoryArgs(TokenList spec) {
        int depth = 0;
        int count = 0;
        for (var token : spec) {
            if (token instanceof TexToken.BeginGroup) {
                depth++;
            } else if (token instanceof TexToken.EndGroup) {
                depth = Math.max(depth - 1, 0);
            } else if (depth == 0 && (token.isChar('m') || token.isChar('M'))) {
                count++;
            }
        }
        if (count > 9) {
            throw fail("argument spec declares " + count + " mandatory arguments");
        }
        return count;
    }

    // \DeclareMathOperator*{\name}{text}
    private static Definition parseMathOperator(TokenCursor cursor) {
        var starred = parseStar(cursor);
        var name = parseMacroName(cursor);
        var body = parseGroup(cursor, "operator text");
        return new Definition.MathOperatorDef(name, body, starred);
    }

    // \newenvironment*{name}[n][default]{begin}{end}
    private static Definition parseEnvironment(boolean renew, TokenCursor cursor) {
        parseStar(cursor);
        var nameTokens = parseGroup(cursor, "environment name");
        var name = new StringBuilder();
        for (var token : nameTokens) {
            if (token instanceof TexToken.Char ch) {
                name.append(ch.c());
            }
        }
        if (name.length() == 0) {
            throw fail("empty environment name");
        }

        var numArgs = parseArity(cursor);
        var defaultArg = parseDefault(cursor);
        var beginBody = parseGroup(cursor, "begin code");
        var endBody = parseGroup(cursor, "end code");
        return new Definition.EnvironmentDef(renew, name.toString(), numArgs, defaultArg, beginBody, endBody);
    }

    // \def\name<parameter text>{body}
    //
    // The parameter text alternates literal runs and #n placeholders, up to
    // the `{` that opens the body
    private Definition parseDef(boolean expanded, boolean global, TokenCursor cursor) {
        cursor.skipSpaces();
        if (!(cursor.next() instanceof TexToken.ControlSeq cs)) {
            throw fail("expected a control sequence to define");
        }

        var parts = new ArrayList<MacroSignature.PatternPart>();
        var literal = new ArrayList<TexToken>();
        int scanned = 0;
        while (cursor.hasNext() && !cursor.peekIsBeginGroup()) {
            if (++scanned > maxArgTokens) {
                throw fail("parameter text of \\" + cs.name() + " is too long");
            }
            var token = cursor.next();
            if (token instanceof TexToken.Param param) {
                if (!literal.isEmpty()) {
                    parts.add(new MacroSignature.PatternPart.Literal(new TokenList(literal)));
                    literal.clear();
                }
                parts.add(new MacroSignature.PatternPart.Argument(param.n()));
            } else {
                // spaces included, they have to match exactly
                literal.add(token);
            }
        }
        if (!literal.isEmpty()) {
            parts.add(new MacroSignature.PatternPart.Literal(new TokenList(literal)));
        }

        if (!cursor.peekIsBeginGroup()) {
            throw fail("no body for \\" + cs.name());
        }
        cursor.next();
        var body = cursor.readBalancedGroup();

        return new Definition.PrimitiveDef(cs.name(), MacroSignature.of(parts), body, expanded, global);
    }

    // \let\name=\target or \let\name\target
    private static Definition parseLet(TokenCursor cursor) {
        cursor.skipSpaces();
        if (!(cursor.next() instanceof TexToken.ControlSeq name)) {
            throw fail("expected a control sequence to assign");
        }

        cursor.skipSpaces();
        if (cursor.peekIs('=')) {
            cursor.next();
            cursor.skipSpaces();
        }

        if (!(cursor.next() instanceof TexToken.ControlSeq target)) {
            throw fail("\\let target of \\" + name.name() + " is not a control sequence");
        }
        return new Definition.LetDef(name.name(), target.name());
    }

    // \newif\iffoo
    private static Definition parseNewIf(TokenCursor cursor) {
        cursor.skipSpaces();
        if (!(cursor.next() instanceof TexToken.ControlSeq cs)) {
            throw fail("expected a conditional name");
        }
        if (!cs.name().startsWith("if") || cs.name().length() == 2) {
            throw fail("conditional name \\" + cs.name() + " must be \\if<name>");
        }
        return new Definition.NewIfDef(cs.name().substring(2));
    }
}
