package com.codeguard.engine.skill.impl;

import com.codeguard.engine.skill.*;
import com.codeguard.engine.validate.ZeroDivisionScanner;
import org.springframework.stereotype.Component;

@Component
public class LogRuntimeIssuesSkill implements Skill<LogRuntimeIssuesSkill.Input, String> {

    public record Input(String snippet) implements SkillInput {}

    private static final SkillManifest MANIFEST = new SkillManifest(
            "log_runtime_issues", "1.0.0",
            "log_runtime_issues(snippet: str) -> str",
            "Report divisions, floor divisions and modulos by a constant zero, one '[runtime_error] ...' line each.",
            SkillKind.VALIDATOR);

    private static final SkillPolicy POLICY = SkillPolicy.readOnly();

    @Override public SkillManifest manifest()  { return MANIFEST; }
    @Override public SkillPolicy   policy()    { return POLICY; }
    @Override public Class<Input>  inputType() { return Input.class; }

    @Override
    public String execute(Input input, SkillExecutionContext ctx) {
        return ZeroDivisionScanner.report(input.snippet());
    }
}
