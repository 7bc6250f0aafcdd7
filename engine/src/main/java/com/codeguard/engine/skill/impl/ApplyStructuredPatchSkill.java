package com.codeguard.engine.skill.impl;

import com.codeguard.engine.edit.OperationFailure;
import com.codeguard.engine.edit.PatchOperation;
import com.codeguard.engine.edit.StructuredPatchApplier;
import com.codeguard.engine.skill.*;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Substring-anchored edits applied as one batch. {@code operations} may be a
 * JSON array, a single object, or either of those encoded as a string (agents
 * often double-encode).
 */
@Component
public class ApplyStructuredPatchSkill implements Skill<ApplyStructuredPatchSkill.Input, String> {

    public record Input(String snippet, JsonNode operations) implements SkillInput {}

    private static final SkillManifest MANIFEST = new SkillManifest(
            "apply_structured_patch", "1.0.0",
            "apply_structured_patch(snippet: str, operations: list[dict] | dict) -> str",
            "Apply replace/delete/insert_before/insert_after/append/prepend operations anchored on exact text; "
                    + "all or nothing.",
            SkillKind.EDITOR);

    private static final SkillPolicy POLICY = SkillPolicy.guardedEdit();

    private final ObjectMapper objectMapper;

    public ApplyStructuredPatchSkill(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override public SkillManifest manifest()  { return MANIFEST; }
    @Override public SkillPolicy   policy()    { return POLICY; }
    @Override public Class<Input>  inputType() { return Input.class; }

    @Override
    public String execute(Input input, SkillExecutionContext ctx) {
        JsonNode raw = input.operations();
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            throw new OperationFailure("structured patch has no operations");
        }
        List<PatchOperation> operations = raw.isTextual()
                ? StructuredPatchApplier.parse(objectMapper, raw.asText())
                : StructuredPatchApplier.parse(raw);
        return StructuredPatchApplier.apply(input.snippet(), operations);
    }
}
