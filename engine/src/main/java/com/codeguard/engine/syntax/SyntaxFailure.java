package com.codeguard.engine.syntax;

import com.codeguard.engine.GuardException;

/**
 * Thrown when source text cannot be tokenized or parsed.
 *
 * Line is 1-based, column is 0-based (the same convention as the token
 * positions).
 */
public class SyntaxFailure extends GuardException {

    private final int line;
    private final int column;
    private final String detail;

    public SyntaxFailure(int line, int column, String detail) {
        super(Kind.SYNTAX, "%s (line %d, column %d)".formatted(detail, line, column));
        this.line   = line;
        this.column = column;
        this.detail = detail;
    }

    public int    getLine()   { return line; }
    public int    getColumn() { return column; }
    public String getDetail() { return detail; }
}
