package com.codeguard.engine.skill.impl;

import com.codeguard.engine.edit.IndexAdjuster;
import com.codeguard.engine.edit.IndexAdjustment;
import com.codeguard.engine.skill.*;
import org.springframework.stereotype.Component;

/**
 * Changes one integer subscript, e.g. {@code items[1]} to {@code items[0]}.
 */
@Component
public class FixIndexingSkill implements Skill<FixIndexingSkill.Input, String> {

    public record Input(
            String  snippet,
            Integer originalValue,
            Integer newValue,
            Integer delta,
            Integer occurrence,
            Boolean legacyShiftAll) implements SkillInput {}

    private static final SkillManifest MANIFEST = new SkillManifest(
            "fix_indexing", "1.0.0",
            "fix_indexing(snippet: str, originalValue: int = None, newValue: int = None, "
                    + "delta: int = None, occurrence: int = 1) -> str",
            "Set (newValue) or shift (delta) the integer index of one subscript, chosen by value and occurrence.",
            SkillKind.EDITOR);

    private static final SkillPolicy POLICY = SkillPolicy.guardedEdit();

    @Override public SkillManifest manifest()  { return MANIFEST; }
    @Override public SkillPolicy   policy()    { return POLICY; }
    @Override public Class<Input>  inputType() { return Input.class; }

    @Override
    public String execute(Input input, SkillExecutionContext ctx) {
        IndexAdjustment request = new IndexAdjustment(
                input.originalValue(),
                input.newValue(),
                input.delta(),
                input.occurrence() == null ? 1 : input.occurrence(),
                Boolean.TRUE.equals(input.legacyShiftAll()));
        return IndexAdjuster.adjust(input.snippet(), request);
    }
}
