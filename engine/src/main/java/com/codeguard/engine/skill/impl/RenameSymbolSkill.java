package com.codeguard.engine.skill.impl;

import com.codeguard.engine.edit.RenameOptions;
import com.codeguard.engine.edit.SymbolRenamer;
import com.codeguard.engine.skill.*;
import org.springframework.stereotype.Component;

/**
 * Token-aware rename: only NAME tokens (and, on request, whole words inside
 * string literals) change, never attribute names after a dot.
 */
@Component
public class RenameSymbolSkill implements Skill<RenameSymbolSkill.Input, String> {

    public record Input(
            String  snippet,
            String  oldName,
            String  newName,
            Boolean includeStrings,
            Integer occurrence,
            Boolean all,
            Boolean allowProtected) implements SkillInput {}

    private static final SkillManifest MANIFEST = new SkillManifest(
            "rename_symbol", "1.0.0",
            "rename_symbol(snippet: str, oldName: str, newName: str, includeStrings: bool = False, "
                    + "occurrence: int = None, all: bool = False, allowProtected: bool = False) -> str",
            "Rename the first (or the given, or every) occurrence of an identifier; protected names are refused.",
            SkillKind.EDITOR);

    private static final SkillPolicy POLICY = SkillPolicy.guardedEdit();

    @Override public SkillManifest manifest()  { return MANIFEST; }
    @Override public SkillPolicy   policy()    { return POLICY; }
    @Override public Class<Input>  inputType() { return Input.class; }

    @Override
    public String execute(Input input, SkillExecutionContext ctx) {
        RenameOptions options = new RenameOptions(
                Boolean.TRUE.equals(input.includeStrings()),
                input.occurrence(),
                Boolean.TRUE.equals(input.all()),
                Boolean.TRUE.equals(input.allowProtected()));
        return SymbolRenamer.rename(input.snippet(), input.oldName(), input.newName(), options, ctx.baseline());
    }
}
