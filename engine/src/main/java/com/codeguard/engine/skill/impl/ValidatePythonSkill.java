package com.codeguard.engine.skill.impl;

import com.codeguard.engine.skill.*;
import com.codeguard.engine.syntax.PythonSyntax;
import org.springframework.stereotype.Component;

@Component
public class ValidatePythonSkill implements Skill<ValidatePythonSkill.Input, String> {

    public record Input(String snippet) implements SkillInput {}

    private static final SkillManifest MANIFEST = new SkillManifest(
            "validate_python", "1.0.0",
            "validate_python(snippet: str) -> str",
            "Parse the snippet; returns 'ok: ...' or 'syntax_error: line L, column C: message'.",
            SkillKind.VALIDATOR);

    private static final SkillPolicy POLICY = SkillPolicy.readOnly();

    @Override public SkillManifest manifest()  { return MANIFEST; }
    @Override public SkillPolicy   policy()    { return POLICY; }
    @Override public Class<Input>  inputType() { return Input.class; }

    @Override
    public String execute(Input input, SkillExecutionContext ctx) {
        return PythonSyntax.check(input.snippet());
    }
}
