package com.codeguard.engine.skill.impl;

import com.codeguard.engine.edit.FunctionColonRepair;
import com.codeguard.engine.skill.*;
import org.springframework.stereotype.Component;

@Component
public class RepairFunctionColonsSkill implements Skill<RepairFunctionColonsSkill.Input, String> {

    public record Input(String snippet) implements SkillInput {}

    private static final SkillManifest MANIFEST = new SkillManifest(
            "repair_function_colons", "1.0.0",
            "repair_function_colons(snippet: str) -> str",
            "Insert the ':' missing after def signatures; returns the snippet unchanged when none is missing.",
            SkillKind.EDITOR);

    private static final SkillPolicy POLICY = SkillPolicy.guardedEdit();

    @Override public SkillManifest manifest()  { return MANIFEST; }
    @Override public SkillPolicy   policy()    { return POLICY; }
    @Override public Class<Input>  inputType() { return Input.class; }

    @Override
    public String execute(Input input, SkillExecutionContext ctx) {
        return FunctionColonRepair.repairOrSame(input.snippet());
    }
}
