package org.latex2typst;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.*;

import com.google.gson.GsonBuilder;

class SimpleLexTest {
    private static Pair<Integer, Integer> span(int from, int to) {
        return new Pair<>(from, to);
    }

    @Test void simple() {
        var input = "\\frac{a^2}{b_1}";
        var lexer = new Lexer(input);
        lexer.lex();

        Map<Pair<Integer, Integer>, Object> expectedTokens = new LinkedHashMap<>();
        expectedTokens.put(span(1, 5), Map.of("name", "frac"));
        expectedTokens.put(span(6, 6), Map.of());
        expectedTokens.put(span(7, 7), Map.of("c", "a"));
        expectedTokens.put(span(8, 8), Map.of());
        expectedTokens.put(span(9, 9), Map.of("c", "2"));
        expectedTokens.put(span(10, 10), Map.of());
        expectedTokens.put(span(11, 11), Map.of());
        expectedTokens.put(span(12, 12), Map.of("c", "b"));
        expectedTokens.put(span(13, 13), Map.of());
        expectedTokens.put(span(14, 14), Map.of("c", "1"));
        expectedTokens.put(span(15, 15), Map.of());

        var gson = new GsonBuilder().setPrettyPrinting().create();

        String actualJson = gson.toJson(lexer.tokenTable);
        String expectedJson = gson.toJson(expectedTokens);

        assertEquals(expectedJson, actualJson);
    }

    @Test
    void spacesAfterControlWordAreNotInAnySpan() {
        var input = "\\alpha   x";
        var lexer = new Lexer(input);
        lexer.lex();

        Map<Pair<Integer, Integer>, Object> expectedTokens = new LinkedHashMap<>();
        expectedTokens.put(span(1, 6), Map.of("name", "alpha"));
        expectedTokens.put(span(10, 10), Map.of("c", "x"));

        var gson = new GsonBuilder().setPrettyPrinting().create();
        assertEquals(gson.toJson(expectedTokens), gson.toJson(lexer.tokenTable));
    }

    @Test
    void lineIndexTest() {
        var lexer = new Lexer("ab\ncd\r\nef");
        lexer.lex();

        assertEquals(List.of(0, 3, 7), lexer.lineIndex);
        assertEquals(new Pair<>(2, 1), SpanUtils.locate(4, lexer.lineIndex));
        assertEquals(new Pair<>(3, 2), SpanUtils.locate(9, lexer.lineIndex));
        assertEquals("1,1..2,2", SpanUtils.formatSpan(span(1, 5), lexer.lineIndex));
    }
}

class LexerRulesTest {
    private static List<TexToken> lex(String input) {
        return Lexer.tokenize(input).tokens();
    }

    private static TexToken cs(String name) {
        return new TexToken.ControlSeq(name);
    }

    private static TexToken ch(char c) {
        return new TexToken.Char(c);
    }

    @Test
    void spaceSwallowedAfterControlWord() {
        var tokens = lex("\\frac  {a}");
        assertEquals(cs("frac"), tokens.get(0));
        assertEquals(TexToken.BEGIN_GROUP, tokens.get(1));
    }

    @Test
    void newlineSwallowedAfterControlWord() {
        assertEquals(List.of(cs("item"), ch('a')), lex("\\item\n   a"));
    }

    @Test
    void controlSymbolKeepsFollowingSpace() {
        assertEquals(List.of(cs(","), TexToken.SPACE, ch('x')), lex("\\, x"));
    }

    @Test
    void controlWordStopsAtNonLetter() {
        assertEquals(List.of(cs("alpha"), ch('1')), lex("\\alpha1"));
        assertEquals(List.of(cs("a"), TexToken.SUBSCRIPT, ch('b')), lex("\\a_b"));
    }

    @Test
    void loneBackslashAtEnd() {
        assertEquals(List.of(ch('a'), ch('\\')), lex("a\\"));
    }

    @Test
    void commentConsumesLineTerminator() {
        assertEquals(List.of(ch('a'), new TexToken.Comment(" note"), ch('b')), lex("a% note\nb"));
        assertEquals(List.of(ch('a'), new TexToken.Comment("x"), ch('b')), lex("a%x\r\nb"));
        assertEquals(List.of(new TexToken.Comment("end")), lex("%end"));
    }

    @Test
    void blankLineIsParagraph() {
        assertEquals(List.of(ch('a'), cs("par"), ch('b')), lex("a\n\nb"));
        assertEquals(List.of(ch('a'), cs("par"), ch('b')), lex("a\n  \t\n\nb"));
        assertEquals(List.of(ch('a'), cs("par"), ch('b')), lex("a\r\n\r\nb"));
    }

    @Test
    void singleLineBreakIsSpace() {
        assertEquals(List.of(ch('a'), TexToken.SPACE, ch('b')), lex("a\nb"));
        assertEquals(List.of(ch('a'), TexToken.SPACE, ch('b')), lex("a\r\nb"));
    }

    @Test
    void blanksCollapse() {
        assertEquals(List.of(ch('a'), TexToken.SPACE, ch('b')), lex("a \t  b"));
    }

    @Test
    void parameters() {
        assertEquals(List.of(new TexToken.Param(1)), lex("#1"));
        assertEquals(
            List.of(new TexToken.DeferredParam(1), TexToken.SPACE, new TexToken.DeferredParam(2)),
            lex("##1 ##2")
        );
    }

    @Test
    void hashWithoutDigit() {
        assertEquals(List.of(ch('#')), lex("##"));
        assertEquals(List.of(ch('#'), ch('x')), lex("##x"));
        assertEquals(List.of(ch('#'), ch('a')), lex("#a"));
        assertEquals(List.of(ch('#'), ch('0')), lex("#0"));
        assertEquals(List.of(ch('#')), lex("#"));
    }

    @Test
    void specialCharacters() {
        assertEquals(
            List.of(TexToken.MATH_SHIFT, ch('x'), TexToken.SUPERSCRIPT, ch('2'), TexToken.MATH_SHIFT,
                TexToken.ALIGN_TAB, new TexToken.ActiveChar('~')),
            lex("$x^2$&~")
        );
    }

    @Test
    void emptyInput() {
        assertTrue(lex("").isEmpty());
    }

    @Test
    void paramNumberOutOfRangeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TexToken.Param(0));
        assertThrows(IllegalArgumentException.class, () -> new TexToken.DeferredParam(10));
    }
}

class TokenListTest {
    @Test
    void roundTrip() {
        var inputs = List.of(
            "\\frac{a^2}{b_1}",
            "\\alpha x",
            "\\alpha \\beta",
            "a & b \\\\ c",
            "$x_1^2$ and ~text",
            "% comment\nx",
            "\\def \\foo#1##2{#1}",
            "\\{ \\} \\%"
        );
        for (var input : inputs) {
            assertEquals(input, Lexer.tokenize(input).detokenize(), input);
        }
    }

    @Test
    void detokenizeSeparatesControlWordFromLetters() {
        var tokens = TokenList.of(new TexToken.ControlSeq("alpha"), new TexToken.Char('x'));
        assertEquals("\\alphax", tokens.display());
        assertEquals("\\alpha x", tokens.detokenize());
    }

    @Test
    void detokenizeKeepsControlSymbolTight() {
        var tokens = TokenList.of(new TexToken.ControlSeq(","), new TexToken.Char('x'));
        assertEquals("\\,x", tokens.detokenize());
    }

    @Test
    void promoteDeferredParams() {
        var body = Lexer.tokenize("\\def\\inner##1{##1 #1}");
        var promoted = body.promoteDeferredParams();

        assertEquals(Lexer.tokenize("\\def\\inner#1{#1 #1}"), promoted);
        assertTrue(body.tokens().contains(new TexToken.DeferredParam(1)));
    }

    @Test
    void isControlSeq() {
        assertTrue(new TexToken.ControlSeq("par").isControlSeq("par"));
        assertFalse(new TexToken.Char('p').isControlSeq("p"));
    }
}
