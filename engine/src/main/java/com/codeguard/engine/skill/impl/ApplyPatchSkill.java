package com.codeguard.engine.skill.impl;

import com.codeguard.engine.edit.UnifiedDiffApplier;
import com.codeguard.engine.skill.*;
import org.springframework.stereotype.Component;

@Component
public class ApplyPatchSkill implements Skill<ApplyPatchSkill.Input, String> {

    public record Input(String snippet, String diff) implements SkillInput {}

    private static final SkillManifest MANIFEST = new SkillManifest(
            "apply_patch", "1.0.0",
            "apply_patch(snippet: str, diff: str) -> str",
            "Apply the hunks of a unified diff; every context and removed line must match the snippet.",
            SkillKind.EDITOR);

    private static final SkillPolicy POLICY = SkillPolicy.guardedEdit();

    @Override public SkillManifest manifest()  { return MANIFEST; }
    @Override public SkillPolicy   policy()    { return POLICY; }
    @Override public Class<Input>  inputType() { return Input.class; }

    @Override
    public String execute(Input input, SkillExecutionContext ctx) {
        return UnifiedDiffApplier.apply(input.snippet(), input.diff());
    }
}
