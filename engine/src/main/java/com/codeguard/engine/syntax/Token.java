package com.codeguard.engine.syntax;

/**
 * One lexical unit with its position in the source.
 *
 * @param kind        lexical category
 * @param text        exact source text
 * @param startOffset inclusive char offset into the source
 * @param endOffset   exclusive char offset into the source
 * @param line        1-based line of the first character
 * @param column      0-based column of the first character
 */
public record Token(
        TokenKind kind,
        String    text,
        int       startOffset,
        int       endOffset,
        int       line,
        int       column) {

    public boolean is(TokenKind k, String value) {
        return kind == k && text.equals(value);
    }

    public boolean isOp(String value) {
        return is(TokenKind.OP, value);
    }

    public boolean isKeyword(String value) {
        return is(TokenKind.KEYWORD, value);
    }
}
