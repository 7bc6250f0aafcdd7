package com.codeguard.engine.skill;

/**
 * Every editor and validator an agent can call is registered as a Skill.
 *
 * A Skill is a named, versioned, observable execution unit with a fixed
 * argument record. The registry decodes the agent's JSON arguments into
 * {@link #inputType()}, enforces the {@link SkillPolicy}, and times and counts
 * every call, so implementations stay plain functions over the snippet.
 *
 * <p>Routing:
 * <ul>
 *   <li>{@link SkillKind#EDITOR} skills return a new snippet. Their output is
 *       diffed against the session baseline before it is released.</li>
 *   <li>{@link SkillKind#VALIDATOR} skills return a report and never change the
 *       snippet; they bypass the protected-identifier diff.</li>
 * </ul>
 *
 * @param <I> Argument record
 * @param <O> Output type (the edited snippet for editors, a report for validators)
 */
public interface Skill<I extends SkillInput, O> {

    /** Identity, documentation, and routing metadata. */
    SkillManifest manifest();

    /** Constraints enforced before execute() is called. */
    SkillPolicy policy();

    /** Record the JSON arguments are decoded into. */
    Class<I> inputType();

    /**
     * Execute the skill.
     *
     * Editors and validators report expected failures with a
     * {@link com.codeguard.engine.GuardException}; the registry passes those
     * through untouched.
     *
     * @throws SkillException on policy violation or execution error
     */
    O execute(I input, SkillExecutionContext ctx) throws SkillException;
}
