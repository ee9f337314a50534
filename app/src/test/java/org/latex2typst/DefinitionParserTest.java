package org.latex2typst;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.*;

import org.latex2typst.Definition.CommandKind;
import org.latex2typst.MacroSignature.PatternPart;

class CommandDefinitionTest {
    private static TokenList tex(String source) {
        return Lexer.tokenize(source);
    }

    private static ParsedDefinitions parse(String source) {
        return new DefinitionParser().parseDefinitions(tex(source));
    }

    @Test
    void newcommandWithArityAndDefault() {
        var parsed = parse("\\newcommand{\\foo}[2][x]{#1+#2} rest");

        var expected = new Definition.CommandDef(
            CommandKind.NEW, "foo", 2, Optional.of(tex("x")), tex("#1+#2")
        );
        assertEquals(List.of(expected), parsed.definitions());
        assertEquals(tex(" rest"), parsed.remaining());
    }

    @Test
    void starredBareName() {
        var parsed = parse("\\newcommand*\\R{\\mathbb{R}}");

        var expected = new Definition.CommandDef(
            CommandKind.NEW, "R", 0, Optional.empty(), tex("\\mathbb{R}")
        );
        assertEquals(List.of(expected), parsed.definitions());
        assertTrue(parsed.remaining().isEmpty());
    }

    @Test
    void commandKinds() {
        var parsed = parse(
            "\\renewcommand{\\a}{1}\\providecommand{\\b}{2}\\DeclareRobustCommand{\\c}{3}"
        );

        var kinds = parsed.definitions().stream()
            .map(d -> ((Definition.CommandDef) d).kind())
            .toList();
        assertEquals(List.of(CommandKind.RENEW, CommandKind.PROVIDE, CommandKind.NEW), kinds);
    }

    @Test
    void spacesAndCommentsBetweenParts() {
        var parsed = parse("\\newcommand {\\foo} % name\n [1] {#1}");

        assertEquals(1, parsed.definitions().size());
        var def = (Definition.CommandDef) parsed.definitions().get(0);
        assertEquals("foo", def.name());
        assertEquals(1, def.numArgs());
    }

    @Test
    void arityAboveNineIsRejected() {
        var log = new DegradationLog();
        var input = tex("\\newcommand{\\foo}[10]{x}");
        var parsed = new DefinitionParser(log).parseDefinitions(input);

        assertTrue(parsed.definitions().isEmpty());
        assertEquals(input, parsed.remaining());
        assertEquals(1, log.ofKind(DegradationKind.MACRO_DEFINITION).size());
        assertEquals("newcommand", log.entries().get(0).name());
    }

    @Test
    void missingBodyKeepsEverything() {
        var input = tex("\\newcommand{\\foo} text");
        var parsed = new DefinitionParser().parseDefinitions(input);

        assertTrue(parsed.definitions().isEmpty());
        assertEquals(input, parsed.remaining());
    }

    @Test
    void documentCommandCountsMandatoryArguments() {
        var parsed = parse("\\NewDocumentCommand{\\foo}{m O{m} m}{#1#2}");

        var def = (Definition.CommandDef) parsed.definitions().get(0);
        assertEquals(CommandKind.NEW, def.kind());
        assertEquals(2, def.numArgs());
        assertEquals(tex("#1#2"), def.body());

        var renew = (Definition.CommandDef) parse("\\RenewDocumentCommand\\bar{}{x}").definitions().get(0);
        assertEquals(CommandKind.RENEW, renew.kind());
        assertEquals(0, renew.numArgs());
    }

    @Test
    void mathOperator() {
        var parsed = parse("\\DeclareMathOperator*{\\argmax}{arg\\,max}\\DeclareMathOperator{\\Tr}{Tr}");

        assertEquals(
            List.of(
                new Definition.MathOperatorDef("argmax", tex("arg\\,max"), true),
                new Definition.MathOperatorDef("Tr", tex("Tr"), false)
            ),
            parsed.definitions()
        );
    }
}

class EnvironmentDefinitionTest {
    private static TokenList tex(String source) {
        return Lexer.tokenize(source);
    }

    @Test
    void newenvironment() {
        var parsed = new DefinitionParser().parseDefinitions(
            tex("\\newenvironment{proof-sketch}[1][Idea]{\\textbf{#1}}{\\qed}")
        );

        var expected = new Definition.EnvironmentDef(
            false, "proof-sketch", 1, Optional.of(tex("Idea")), tex("\\textbf{#1}"), tex("\\qed")
        );
        assertEquals(List.of(expected), parsed.definitions());
    }

    @Test
    void renewenvironment() {
        var parsed = new DefinitionParser().parseDefinitions(tex("\\renewenvironment*{abstract}{a}{b}"));

        var def = (Definition.EnvironmentDef) parsed.definitions().get(0);
        assertTrue(def.renew());
        assertEquals("abstract", def.name());
        assertEquals(0, def.numArgs());
    }

    @Test
    void emptyNameIsRejected() {
        var input = tex("\\newenvironment{}{a}{b}");
        var parsed = new DefinitionParser().parseDefinitions(input);

        assertTrue(parsed.definitions().isEmpty());
        assertEquals(input, parsed.remaining());
    }

    @Test
    void missingEndBodyIsRejected() {
        var input = tex("\\newenvironment{box}{a} b");
        var parsed = new DefinitionParser().parseDefinitions(input);

        assertTrue(parsed.definitions().isEmpty());
        assertEquals(input, parsed.remaining());
    }
}

class PrimitiveDefinitionTest {
    private static TokenList tex(String source) {
        return Lexer.tokenize(source);
    }

    private static Definition.PrimitiveDef parseOne(String source) {
        var parsed = new DefinitionParser().parseDefinitions(tex(source));
        assertEquals(1, parsed.definitions().size(), source);
        return (Definition.PrimitiveDef) parsed.definitions().get(0);
    }

    @Test
    void contiguousParametersAreSimple() {
        var def = parseOne("\\def\\foo#1#2{#1 and #2}");

        assertEquals("foo", def.name());
        assertEquals(new MacroSignature.Simple(2), def.signature());
        assertEquals(tex("#1 and #2"), def.body());
        assertFalse(def.expanded());
        assertFalse(def.global());
    }

    @Test
    void noParameters() {
        assertEquals(new MacroSignature.Simple(0), parseOne("\\def\\foo{x}").signature());
    }

    @Test
    void delimitedParametersArePattern() {
        var def = parseOne("\\def\\foo#1=#2.{#1/#2}");

        var expected = new MacroSignature.Pattern(List.of(
            new PatternPart.Argument(1),
            new PatternPart.Literal(TokenList.of(new TexToken.Char('='))),
            new PatternPart.Argument(2),
            new PatternPart.Literal(TokenList.of(new TexToken.Char('.')))
        ));
        assertEquals(expected, def.signature());
        assertEquals(2, def.signature().numArgs());
    }

    @Test
    void leadingLiteralIsPattern() {
        var def = parseOne("\\def\\pt(#1,#2){x}");

        var signature = (MacroSignature.Pattern) def.signature();
        assertEquals(5, signature.parts().size());
        assertEquals(new PatternPart.Literal(TokenList.of(new TexToken.Char('('))), signature.parts().get(0));
    }

    @Test
    void outOfOrderParametersArePattern() {
        var def = parseOne("\\def\\swap#2#1{#1#2}");

        assertEquals(
            new MacroSignature.Pattern(List.of(new PatternPart.Argument(2), new PatternPart.Argument(1))),
            def.signature()
        );
    }

    @Test
    void variants() {
        var gdef = parseOne("\\gdef\\a{1}");
        var edef = parseOne("\\edef\\b{2}");
        var xdef = parseOne("\\xdef\\c{3}");

        assertTrue(gdef.global());
        assertFalse(gdef.expanded());
        assertTrue(edef.expanded());
        assertFalse(edef.global());
        assertTrue(xdef.expanded());
        assertTrue(xdef.global());
    }

    @Test
    void deferredParametersStayInBody() {
        var def = parseOne("\\def\\outer#1{\\def\\inner##1{##1 #1}}");

        assertEquals(tex("\\def\\inner##1{##1 #1}"), def.body());
        assertEquals(tex("\\def\\inner#1{#1 #1}"), def.body().promoteDeferredParams());
    }

    @Test
    void missingBodyIsRejected() {
        var input = tex("\\def\\foo#1");
        var parsed = new DefinitionParser().parseDefinitions(input);

        assertTrue(parsed.definitions().isEmpty());
        assertEquals(input, parsed.remaining());
    }

    @Test
    void nameMustBeControlSequence() {
        var input = tex("\\def x{y}");
        var parsed = new DefinitionParser().parseDefinitions(input);

        assertTrue(parsed.definitions().isEmpty());
        assertEquals(input, parsed.remaining());
    }
}

class AliasAndConditionalTest {
    private static TokenList tex(String source) {
        return Lexer.tokenize(source);
    }

    private static List<Definition> definitions(String source) {
        return new DefinitionParser().parseDefinitions(tex(source)).definitions();
    }

    @Test
    void letForms() {
        var expected = List.<Definition>of(new Definition.LetDef("foo", "bar"));

        assertEquals(expected, definitions("\\let\\foo=\\bar"));
        assertEquals(expected, definitions("\\let\\foo\\bar"));
        assertEquals(expected, definitions("\\let\\foo = \\bar"));
    }

    @Test
    void letTargetMustBeControlSequence() {
        var input = tex("\\let\\foo=x");
        var parsed = new DefinitionParser().parseDefinitions(input);

        assertTrue(parsed.definitions().isEmpty());
        assertEquals(input, parsed.remaining());
    }

    @Test
    void newif() {
        var defs = definitions("\\newif\\ifdraft");

        assertEquals(List.of(new Definition.NewIfDef("draft")), defs);
        assertEquals("ifdraft", defs.get(0).name());
    }

    @Test
    void newifNeedsIfPrefix() {
        assertTrue(definitions("\\newif\\draft").isEmpty());
        assertTrue(definitions("\\newif\\if").isEmpty());
        assertTrue(definitions("\\newif x").isEmpty());
    }
}

class DefinitionScanTest {
    private static TokenList tex(String source) {
        return Lexer.tokenize(source);
    }

    @Test
    void failedDefinitionIsKeptAndScanningContinues() {
        var parsed = new DefinitionParser().parseDefinitions(tex("\\newcommand 5 \\def\\x{y}"));

        assertEquals(
            List.of(new Definition.PrimitiveDef("x", new MacroSignature.Simple(0), tex("y"), false, false)),
            parsed.definitions()
        );
        assertEquals(tex("\\newcommand 5 "), parsed.remaining());
    }

    @Test
    void definitionsAndTextInterleave() {
        var parsed = new DefinitionParser().parseDefinitions(
            tex("A\\newcommand{\\x}{1}B\\let\\y\\x C\\newif\\ifz D")
        );

        assertEquals(List.of("x", "y", "ifz"), parsed.definitions().stream().map(Definition::name).toList());
        assertEquals("ABCD", parsed.remaining().display().replace(" ", ""));
    }

    @Test
    void nonDefinitionCommandsPassThrough() {
        var input = tex("\\section{Intro} \\emph{x}");
        var parsed = new DefinitionParser().parseDefinitions(input);

        assertTrue(parsed.definitions().isEmpty());
        assertEquals(input, parsed.remaining());
    }

    @Test
    void singleDefinitionApi() {
        var parser = new DefinitionParser();

        var ok = parser.parseDefinition("newcommand", tex("{\\foo}{bar} tail"));
        assertTrue(ok.definition().isPresent());
        assertEquals(tex(" tail"), ok.rest());

        var input = tex("{\\foo}");
        var failed = parser.parseDefinition("newcommand", input);
        assertTrue(failed.definition().isEmpty());
        assertEquals(input, failed.rest());
    }

    @Test
    void cursorIsRewoundAfterMismatch() {
        var cursor = new TokenCursor(tex("{\\foo}[3]"));
        var definition = new DefinitionParser().parseDefinition("newcommand", cursor);

        assertTrue(definition.isEmpty());
        assertEquals(0, cursor.position());
    }

    @Test
    void recognizedCommands() {
        for (var name : List.of("newcommand", "renewcommand", "providecommand", "DeclareRobustCommand",
            "NewDocumentCommand", "RenewDocumentCommand", "DeclareMathOperator", "newenvironment",
            "renewenvironment", "def", "gdef", "edef", "xdef", "let", "newif")) {
            assertTrue(DefinitionParser.isDefinitionCommand(name), name);
        }
        assertFalse(DefinitionParser.isDefinitionCommand("section"));
    }

    @Test
    void jsonView() {
        var parsed = new DefinitionParser().parseDefinitions(tex("\\newcommand{\\foo}{bar} baz"));
        var json = parsed.toString();

        assertTrue(json.contains("\"name\": \"foo\""), json);
        assertTrue(json.contains("\"remaining\": \" baz\""), json);
    }
}

class TokenCapTest {
    private static TokenList tex(String source) {
        return Lexer.tokenize(source);
    }

    @Test
    void unclosedBodyIsTruncatedAtCap() {
        var log = new DegradationLog();
        var parser = new DefinitionParser(5, log);
        var parsed = parser.parseDefinitions(tex("\\newcommand{\\foo}{abcdefghij"));

        assertEquals(1, parsed.definitions().size());
        var def = (Definition.CommandDef) parsed.definitions().get(0);
        assertEquals(tex("abcde"), def.body());
        assertEquals(tex("fghij"), parsed.remaining());
        assertEquals(1, log.ofKind(DegradationKind.PARSE_ERROR).size());
    }

    @Test
    void unclosedBodyWithDefaultCapReadsToEnd() {
        var log = new DegradationLog();
        var parsed = new DefinitionParser(log).parseDefinitions(tex("\\newcommand{\\foo}{abc"));

        var def = (Definition.CommandDef) parsed.definitions().get(0);
        assertEquals(tex("abc"), def.body());
        assertTrue(parsed.remaining().isEmpty());
        assertEquals(1, log.ofKind(DegradationKind.PARSE_ERROR).size());
    }

    @Test
    void longParameterTextIsRejected() {
        var input = tex("\\def\\foo abcdefgh{x}");
        var parsed = new DefinitionParser(4, DegradationSink.IGNORE).parseDefinitions(input);

        assertTrue(parsed.definitions().isEmpty());
        assertEquals(input, parsed.remaining());
    }

    @Test
    void bracketReadStopsAtCap() {
        var cursor = new TokenCursor(tex("abcdef]"), 3);

        assertEquals(tex("abc"), cursor.readUntilChar(']'));
        assertFalse(cursor.lastReadClosed());
    }

    @Test
    void capMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new TokenCursor(TokenList.EMPTY, 0));
    }
}

class ReadArgumentTest {
    private static TokenList tex(String source) {
        return Lexer.tokenize(source);
    }

    @Test
    void bracedGroup() {
        var cursor = new TokenCursor(tex("{a{b}c}d"));

        assertEquals(tex("a{b}c"), cursor.readArgument());
        assertTrue(cursor.lastReadClosed());
        assertEquals(TexToken.Char.class, cursor.peek().getClass());
    }

    @Test
    void singleTokenAfterSpaces() {
        var cursor = new TokenCursor(tex("  \\foo bar"));

        assertEquals(TokenList.of(new TexToken.ControlSeq("foo")), cursor.readArgument());
        assertEquals(tex("b"), cursor.readArgument());
    }

    @Test
    void endOfInput() {
        var cursor = new TokenCursor(TokenList.EMPTY);

        assertEquals(TokenList.EMPTY, cursor.readArgument());
        assertFalse(cursor.hasNext());
    }

    @Test
    void unclosedGroupIsFlagged() {
        var cursor = new TokenCursor(tex("{abc"));

        assertEquals(tex("abc"), cursor.readArgument());
        assertFalse(cursor.lastReadClosed());
    }
}
