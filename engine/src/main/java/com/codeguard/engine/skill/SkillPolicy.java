package com.codeguard.engine.skill;

/**
 * Execution constraints enforced by the registry and the session before
 * execute() is called.
 *
 * @param guarded         true when the output must survive the protected-identifier
 *                        diff before it is released to the caller.
 * @param maxSnippetChars Largest snippet accepted; 0 means the registry default
 *                        ({@code codeguard.skill.max-snippet-chars}).
 */
public record SkillPolicy(
        boolean guarded,
        int     maxSnippetChars) {

    /** Convenience factory for editors. */
    public static SkillPolicy guardedEdit() {
        return new SkillPolicy(true, 0);
    }

    /** Convenience factory for validators. */
    public static SkillPolicy readOnly() {
        return new SkillPolicy(false, 0);
    }

    /** Same policy with an explicit snippet limit. */
    public SkillPolicy limitedTo(int chars) {
        return new SkillPolicy(guarded, chars);
    }
}
