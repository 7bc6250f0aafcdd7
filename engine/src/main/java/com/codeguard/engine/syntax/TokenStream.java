package com.codeguard.engine.syntax;

import java.util.List;

/**
 * Ordered tokens of one snippet. Joining every token's text gives back the
 * source exactly.
 */
public record TokenStream(String source, List<Token> tokens) {

    public TokenStream {
        tokens = List.copyOf(tokens);
    }

    public String detokenize() {
        StringBuilder sb = new StringBuilder(source.length());
        for (Token t : tokens) {
            sb.append(t.text());
        }
        return sb.toString();
    }

    /** Everything except whitespace and comments. */
    public List<Token> significant() {
        return tokens.stream().filter(t -> !t.kind().isTrivia()).toList();
    }

    /** True when {@code offset} falls strictly inside a string literal or a comment. */
    public boolean inStringOrComment(int offset) {
        for (Token t : tokens) {
            if ((t.kind() == TokenKind.STRING || t.kind() == TokenKind.COMMENT)
                    && t.startOffset() < offset && offset < t.endOffset()) {
                return true;
            }
        }
        return false;
    }

    public int size() { return tokens.size(); }

    public Token get(int index) { return tokens.get(index); }
}
