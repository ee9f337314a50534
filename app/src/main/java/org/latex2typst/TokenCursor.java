package org.latex2typst;

import java.util.*;

/**
 * Position in a token sequence plus the reading primitives the definition
 * grammars are built from.
 *
 * Group and bracket reads stop after {@code maxArgTokens} tokens and return
 * what they have, so an unclosed brace can't make a read run away with the
 * rest of the document.
 */
public class TokenCursor {
    public static final int DEFAULT_MAX_ARG_TOKENS = 10000;

    private final List<TexToken> tokens;
    private final int maxArgTokens;
    private int position;
    private boolean lastReadClosed = true;

    public TokenCursor(TokenList tokens) {
        this(tokens, DEFAULT_MAX_ARG_TOKENS);
    }

    public TokenCursor(TokenList tokens, int maxArgTokens) {
        if (maxArgTokens < 1) {
            throw new IllegalArgumentException("token cap must be positive: " + maxArgTokens);
        }
        this.tokens = tokens.tokens();
        this.maxArgTokens = maxArgTokens;
        this.position = 0;
    }

    public int position() {
        return position;
    }

    public void rewind(int checkpoint) {
        this.position = checkpoint;
    }

    public int maxArgTokens() {
        return maxArgTokens;
    }

    public boolean hasNext() {
        return position < tokens.size();
    }

    // null at the end
    public TexToken peek() {
        return hasNext() ? tokens.get(position) : null;
    }

    // null at the end
    public TexToken next() {
        return hasNext() ? tokens.get(position++) : null;
    }

    public boolean peekIs(char c) {
        var token = peek();
        return token != null && token.isChar(c);
    }

    public boolean peekIsBeginGroup() {
        return peek() instanceof TexToken.BeginGroup;
    }

    // Whether the last readBalancedGroup/readUntilChar found its terminator
    public boolean lastReadClosed() {
        return lastReadClosed;
    }

    // Forget the outcome of earlier reads
    public void resetLastRead() {
        this.lastReadClosed = true;
    }

    // Everything from the current position on
    public TokenList remaining() {
        return new TokenList(tokens.subList(position, tokens.size()));
    }

    // Tokens between two positions
    public TokenList between(int from, int to) {
        return new TokenList(tokens.subList(Math.max(from, 0), Math.min(to, tokens.size())));
    }

    public void skipSpaces() {
        while (hasNext() && peek().isSpaceOrComment()) {
            position++;
        }
    }

    public Optional<String> readControlSeqName() {
        skipSpaces();
        if (peek() instanceof TexToken.ControlSeq cs) {
            position++;
            return Optional.of(cs.name());
        }
        return Optional.empty();
    }

    // Decimal digits as Char tokens, saturates instead of overflowing
    public OptionalInt readNumber() {
        skipSpaces();
        int value = 0;
        boolean any = false;
        while (peek() instanceof TexToken.Char ch && ch.c() >= '0' && ch.c() <= '9') {
            value = Math.min(value * 10 + (ch.c() - '0'), 1_000_000);
            any = true;
            position++;
        }
        return any ? OptionalInt.of(value) : OptionalInt.empty();
    }

    // Drops tokens up to and including the first `endChar`
    public void skipUntilChar(char endChar) {
        while (hasNext()) {
            var token = next();
            if (token.isChar(endChar)) {
                return;
            }
        }
    }

    // Reads up to `endChar` at brace depth zero, the terminator is consumed
    // but not returned
    public TokenList readUntilChar(char endChar) {
        var result = new ArrayList<TexToken>();
        int depth = 0;
        this.lastReadClosed = false;

        while (hasNext()) {
            if (result.size() >= maxArgTokens) {
                return new TokenList(result);
            }
            var token = next();
            if (token instanceof TexToken.BeginGroup) {
                depth++;
            } else if (token instanceof TexToken.EndGroup) {
                if (depth > 0) {
                    depth--;
                }
            } else if (depth == 0 && token.isChar(endChar)) {
                this.lastReadClosed = true;
                return new TokenList(result);
            }
            result.add(token);
        }
        return new TokenList(result);
    }

    // Reads the inside of a `{...}` group whose `{` was already consumed,
    // the closing `}` is consumed but not returned
    public TokenList readBalancedGroup() {
        var result = new ArrayList<TexToken>();
        int depth = 1;
        this.lastReadClosed = false;

        while (hasNext()) {
            if (result.size() >= maxArgTokens) {
                return new TokenList(result);
            }
            var token = next();
            if (token instanceof TexToken.BeginGroup) {
                depth++;
            } else if (token instanceof TexToken.EndGroup) {
                depth--;
                if (depth == 0) {
                    this.lastReadClosed = true;
                    return new TokenList(result);
                }
            }
            result.add(token);
        }
        return new TokenList(result);
    }

    // A braced group or a single token
    public TokenList readArgument() {
        skipSpaces();
        if (!hasNext()) {
            return TokenList.EMPTY;
        }
        var token = next();
        if (token instanceof TexToken.BeginGroup) {
            return readBalancedGroup();
        }
        return TokenList.of(token);
    }
}
