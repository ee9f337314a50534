package org.latex2typst;

import java.util.*;

/**
 * Immutable, ordered sequence of {@link TexToken}s.
 *
 * Used for whole documents as well as for macro bodies, default values
 * and literal runs of a parameter pattern.
 */
public record TokenList(List<TexToken> tokens) implements Iterable<TexToken> {
    public static final TokenList EMPTY = new TokenList(List.of());

    public TokenList {
        tokens = List.copyOf(tokens);
    }

    public static TokenList of(TexToken... tokens) {
        return new TokenList(Arrays.asList(tokens));
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public TexToken get(int index) {
        return tokens.get(index);
    }

    public TokenList slice(int from, int to) {
        return new TokenList(tokens.subList(from, to));
    }

    @Override
    public Iterator<TexToken> iterator() {
        return tokens.iterator();
    }

    /**
     * Plain concatenation of every token's text form.
     */
    public String display() {
        var sb = new StringBuilder();
        for (var token : tokens) {
            sb.append(token.display());
        }
        return sb.toString();
    }

    /**
     * Renders the tokens back to TeX source.
     *
     * A control word is followed by a separating space when the next token
     * is a letter or another control sequence, otherwise `\foo bar` would
     * read back as `\foobar`. Comments get their line terminator back.
     */
    public String detokenize() {
        var sb = new StringBuilder();
        for (int i = 0; i < tokens.size(); i++) {
            var token = tokens.get(i);
            if (token instanceof TexToken.ControlSeq cs) {
                sb.append('\\').append(cs.name());
                if (cs.isControlWord() && i + 1 < tokens.size()) {
                    var next = tokens.get(i + 1);
                    if (next instanceof TexToken.ControlSeq
                        || (next instanceof TexToken.Char ch && CharClass.isLetter(ch.c()))) {
                        sb.append(' ');
                    }
                }
            } else if (token instanceof TexToken.Comment comment) {
                sb.append('%').append(comment.text()).append('\n');
            } else {
                sb.append(token.display());
            }
        }
        return sb.toString();
    }

    /**
     * Rewrites every DeferredParam(n) into Param(n).
     *
     * Applied to the body of a macro when the macro that defined it is
     * expanded, so the inner definition sees ordinary parameters.
     */
    public TokenList promoteDeferredParams() {
        var promoted = new ArrayList<TexToken>(tokens.size());
        for (var token : tokens) {
            if (token instanceof TexToken.DeferredParam dp) {
                promoted.add(new TexToken.Param(dp.n()));
            } else {
                promoted.add(token);
            }
        }
        return new TokenList(promoted);
    }

    @Override
    public String toString() {
        return display();
    }
}
