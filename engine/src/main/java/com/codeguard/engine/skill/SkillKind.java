package com.codeguard.engine.skill;

/**
 * What a skill does to the snippet, which decides how the session treats its
 * output.
 */
public enum SkillKind {

    /** Returns a rewritten snippet; checked against the protected identifiers. */
    EDITOR,

    /** Reports on the snippet and leaves it unchanged. */
    VALIDATOR
}
