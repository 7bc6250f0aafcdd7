package com.codeguard.engine.skill;

/**
 * Thrown when a skill call fails for a reason that is not a verdict on the
 * snippet: bad arguments, a policy limit, or a bug inside the skill.
 *
 * Unchecked so callers only catch it when they have a specific recovery
 * strategy; the HTTP layer maps it to a 4xx/5xx response.
 */
public class SkillException extends RuntimeException {

    public enum Kind { POLICY_VIOLATION, EXECUTION_ERROR, PARSE_ERROR }

    private final Kind kind;

    public SkillException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public SkillException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
