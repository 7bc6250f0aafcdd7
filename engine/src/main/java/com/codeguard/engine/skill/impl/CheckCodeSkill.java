package com.codeguard.engine.skill.impl;

import com.codeguard.engine.skill.*;
import com.codeguard.engine.validate.StaticValidator;
import org.springframework.stereotype.Component;

/**
 * Runs the static rules. A clean snippet yields a one-line report; findings
 * come back as a VALIDATION rejection listing each of them.
 */
@Component
public class CheckCodeSkill implements Skill<CheckCodeSkill.Input, String> {

    public record Input(String snippet) implements SkillInput {}

    private static final SkillManifest MANIFEST = new SkillManifest(
            "check_code", "1.0.0",
            "check_code(snippet: str) -> str",
            "Check sentinel initialisation, call arity and returned names; rejected with the findings when any rule fails.",
            SkillKind.VALIDATOR);

    private static final SkillPolicy POLICY = SkillPolicy.readOnly();

    @Override public SkillManifest manifest()  { return MANIFEST; }
    @Override public SkillPolicy   policy()    { return POLICY; }
    @Override public Class<Input>  inputType() { return Input.class; }

    @Override
    public String execute(Input input, SkillExecutionContext ctx) {
        StaticValidator.validate(input.snippet());
        return "ok: no findings";
    }
}
