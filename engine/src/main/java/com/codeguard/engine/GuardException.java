package com.codeguard.engine;

/**
 * Base of every failure an editor, validator or the guard can report.
 *
 * Unchecked, in the same way as the skill layer's exceptions: callers only
 * catch it where they turn it into a typed result for the orchestrator
 * ({@link com.codeguard.engine.guard.EditResult}). The {@link Kind} lets the
 * caller tell the four failure families apart without instanceof chains.
 */
public abstract class GuardException extends RuntimeException {

    public enum Kind { SYNTAX, VALIDATION, PROTECTED_IDENTIFIER, OPERATION }

    private final Kind kind;

    protected GuardException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected GuardException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
