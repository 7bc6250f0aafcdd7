package com.codeguard.engine.validate;

/**
 * A statically detectable runtime error.
 *
 * @param line   1-based line of the offending expression
 * @param column 0-based start column of the offending binary operation
 */
public record RuntimeIssue(String issueType, String message, int line, int column) {

    public String format() {
        return "[runtime_error] %s at line %d, column %d - %s".formatted(issueType, line, column, message);
    }
}
