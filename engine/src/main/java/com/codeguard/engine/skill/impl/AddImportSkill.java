package com.codeguard.engine.skill.impl;

import com.codeguard.engine.edit.ImportInserter;
import com.codeguard.engine.skill.*;
import org.springframework.stereotype.Component;

/**
 * Adds {@code import module} or {@code from module import symbol [as alias]}
 * unless the snippet already imports it.
 */
@Component
public class AddImportSkill implements Skill<AddImportSkill.Input, String> {

    public record Input(String snippet, String module, String symbol, String alias) implements SkillInput {}

    private static final SkillManifest MANIFEST = new SkillManifest(
            "add_import", "1.0.0",
            "add_import(snippet: str, module: str, symbol: str = None, alias: str = None) -> str",
            "Insert one import line after the docstring and existing imports; a no-op when the import is already present.",
            SkillKind.EDITOR);

    private static final SkillPolicy POLICY = SkillPolicy.guardedEdit();

    @Override public SkillManifest manifest()  { return MANIFEST; }
    @Override public SkillPolicy   policy()    { return POLICY; }
    @Override public Class<Input>  inputType() { return Input.class; }

    @Override
    public String execute(Input input, SkillExecutionContext ctx) {
        return ImportInserter.ensureImport(input.snippet(), input.module(), input.symbol(), input.alias());
    }
}
