package com.codeguard.engine.syntax;

/**
 * Lexical categories produced by {@link PythonTokenizer}.
 *
 * Whitespace and comments are real tokens so that the stream can be joined
 * back into the exact source text.
 */
public enum TokenKind {
    /** Identifiers, soft keywords used as names included. */
    NAME,
    /** Reserved words, {@code True}/{@code False}/{@code None} and soft keywords in keyword position. */
    KEYWORD,
    NUMBER,
    /** A whole literal, or one literal piece around the replacement fields of an f-string. */
    STRING,
    OP,
    COMMENT,
    /** Spaces, tabs, line breaks and backslash continuations. */
    WHITESPACE,
    /** Text the parser could not place, only seen in snippets that do not parse. */
    ERRORTOKEN;

    /** True for tokens that carry no syntax. */
    public boolean isTrivia() {
        return this == WHITESPACE || this == COMMENT;
    }
}
