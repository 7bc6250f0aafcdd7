package com.codeguard.engine.validate;

/**
 * One static-validation problem.
 *
 * @param rule   short rule id: {@code sentinel-none}, {@code arity}, {@code undefined-return}
 * @param line   1-based
 * @param column 0-based
 */
public record Finding(String rule, String message, int line, int column) {

    @Override
    public String toString() {
        return "[" + rule + "] line " + line + ": " + message;
    }
}
