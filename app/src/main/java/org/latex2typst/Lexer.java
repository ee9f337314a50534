package org.latex2typst;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

// Category of a single input character, close to TeX's catcodes
enum CharClass {
    // `\`
    ESCAPE,
    // `{` and `}`
    BEGIN_GROUP, END_GROUP,
    // `$`, `&`, `#`, `^`, `_`
    MATH_SHIFT, ALIGN_TAB, PARAMETER, SUPERSCRIPT, SUBSCRIPT,
    // `\n`, `\r`
    EOL,
    // ` `, `\t`
    SPACE,
    // ASCII letters only, they make up control words
    LETTER,
    // `~`
    ACTIVE,
    // `%`
    COMMENT,
    // everything else
    OTHER;

    static CharClass classOfChar(char c) {
        if (isLetter(c)) return LETTER;

        return switch (c) {
            case '\\' -> ESCAPE;
            case '{' -> BEGIN_GROUP;
            case '}' -> END_GROUP;
            case '$' -> MATH_SHIFT;
            case '&' -> ALIGN_TAB;
            case '#' -> PARAMETER;
            case '^' -> SUPERSCRIPT;
            case '_' -> SUBSCRIPT;
            case '\n', '\r' -> EOL;
            case ' ', '\t' -> SPACE;
            case '~' -> ACTIVE;
            case '%' -> COMMENT;
            default -> OTHER;
        };
    }

    static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    static boolean isParamDigit(Character c) {
        return c != null && c >= '1' && c <= '9';
    }
}


/**
 * TeX tokenizer.
 *
 * Reads the source exactly once, with at most one character of lookahead
 * (two for `##n` and for a CRLF line terminator). Never fails: every
 * input has a defined token sequence.
 */
public class Lexer {
    /*
     * Globals
     */
    private static final Logger log = LogManager.getLogger("lexer");

    /*
     * Lexer state
     */
    int numChar = 0;
    int lexemeStartChar = 0;
    // set right after a control word, TeX drops the whitespace that follows
    boolean swallowSpaces = false;

    /*
     * Output
     */
    // 0-based offsets of line starts
    public ArrayList<Integer> lineIndex = new ArrayList<>(List.of(0));
    // 1-based inclusive spans of every token
    public TreeMap<Pair<Integer, Integer>, TexToken> tokenTable = new TreeMap<>();
    private final ArrayList<TexToken> tokens = new ArrayList<>();

    /*
     * Lexer data
     */
    // Preferably access this thing via nextChar() and peekChar() only
    private final String _sourceCode;

    public Lexer(String sourceCode) {
        this._sourceCode = sourceCode;
    }

    public static TokenList tokenize(String sourceCode) {
        var lexer = new Lexer(sourceCode);
        lexer.lex();
        return lexer.tokens();
    }

    public TokenList tokens() {
        return new TokenList(tokens);
    }

    // Get the next char and manage the lexer inner state
    //
    // Will return null if source code ends
    Character nextChar() {
        if (this.numChar >= this._sourceCode.length()) {
            return null;
        }
        var ch = this._sourceCode.charAt(numChar);
        this.numChar++;
        if (ch == '\n' || (ch == '\r' && !Objects.equals(peekChar(), '\n'))) {
            this.lineIndex.add(this.numChar);
        }
        return ch;
    }

    Character peekChar() {
        if (this.numChar >= this._sourceCode.length()) {
            return null;
        }
        return this._sourceCode.charAt(numChar);
    }

    // Does the thing
    //
    // Populates tokens and tokenTable
    public void lex() {
        while (true) {
            if (this.swallowSpaces) {
                skipWhitespace();
                this.swallowSpaces = false;
            }

            this.lexemeStartChar = this.numChar;
            var ch = nextChar();
            if (ch == null) {
                log.debug("the end, {} tokens", this.tokens.size());
                return;
            }

            var cls = CharClass.classOfChar(ch);
            TexToken token = switch (cls) {
                case ESCAPE -> readControlSeq();
                case BEGIN_GROUP -> TexToken.BEGIN_GROUP;
                case END_GROUP -> TexToken.END_GROUP;
                case MATH_SHIFT -> TexToken.MATH_SHIFT;
                case ALIGN_TAB -> TexToken.ALIGN_TAB;
                case SUPERSCRIPT -> TexToken.SUPERSCRIPT;
                case SUBSCRIPT -> TexToken.SUBSCRIPT;
                case PARAMETER -> readParameter();
                case COMMENT -> new TexToken.Comment(readComment());
                case SPACE -> {
                    skipBlanks();
                    yield TexToken.SPACE;
                }
                case EOL -> readLineBreak(ch);
                case ACTIVE -> new TexToken.ActiveChar(ch);
                case LETTER, OTHER -> new TexToken.Char(ch);
            };

            emit(token);
        }
    }

    void emit(TexToken token) {
        var span = new Pair<>(this.lexemeStartChar + 1, this.numChar);
        if (log.isDebugEnabled()) {
            log.debug("{} {} at {}", cls(token), token.display(), SpanUtils.formatSpan(span, this.lineIndex));
        }
        this.tokenTable.put(span, token);
        this.tokens.add(token);
    }

    private static String cls(TexToken token) {
        return token.getClass().getSimpleName();
    }

    // Control word (letters only) or control symbol (single non-letter)
    TexToken readControlSeq() {
        var first = peekChar();
        if (first == null) {
            // Lone backslash at the very end
            return new TexToken.Char('\\');
        }

        if (CharClass.isLetter(first)) {
            var name = new StringBuilder();
            while (peekChar() != null && CharClass.isLetter(peekChar())) {
                name.append(nextChar());
            }
            this.swallowSpaces = true;
            return new TexToken.ControlSeq(name.toString());
        }

        nextChar();
        return new TexToken.ControlSeq(String.valueOf(first));
    }

    // `#n`, `##n`, or a literal `#`
    TexToken readParameter() {
        var next = peekChar();
        if (CharClass.isParamDigit(next)) {
            nextChar();
            return new TexToken.Param(next - '0');
        }
        if (Objects.equals(next, '#')) {
            nextChar();
            var digit = peekChar();
            if (CharClass.isParamDigit(digit)) {
                nextChar();
                return new TexToken.DeferredParam(digit - '0');
            }
            // `##` not followed by a digit produces a single `#`
            return new TexToken.Char('#');
        }
        return new TexToken.Char('#');
    }

    // Everything up to the line terminator, the terminator is consumed
    String readComment() {
        var comment = new StringBuilder();
        while (peekChar() != null && peekChar() != '\n' && peekChar() != '\r') {
            comment.append(nextChar());
        }
        if (Objects.equals(peekChar(), '\r')) {
            nextChar();
        }
        if (Objects.equals(peekChar(), '\n')) {
            nextChar();
        }
        return comment.toString();
    }

    // A line break is a space, unless a blank line follows: then it's \par
    TexToken readLineBreak(char first) {
        if (first == '\r' && Objects.equals(peekChar(), '\n')) {
            nextChar();
        }

        boolean blankLine = false;
        while (peekChar() != null) {
            var next = peekChar();
            if (next == ' ' || next == '\t') {
                nextChar();
            } else if (next == '\n' || next == '\r') {
                nextChar();
                if (next == '\r' && Objects.equals(peekChar(), '\n')) {
                    nextChar();
                }
                blankLine = true;
            } else {
                break;
            }
        }

        if (blankLine) {
            return new TexToken.ControlSeq("par");
        }
        return TexToken.SPACE;
    }

    void skipBlanks() {
        while (peekChar() != null && (peekChar() == ' ' || peekChar() == '\t')) {
            nextChar();
        }
    }

    void skipWhitespace() {
        while (peekChar() != null && Character.isWhitespace(peekChar()) && peekChar() < 128) {
            nextChar();
        }
    }
}
