package com.codeguard.engine.skill.impl;

import com.codeguard.engine.edit.FunctionStubber;
import com.codeguard.engine.edit.OperationFailure;
import com.codeguard.engine.edit.StubPolicy;
import com.codeguard.engine.skill.*;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Replaces the bare {@code pass} body of a function with a placeholder.
 *
 * Policies: {@code raise} (default, optional message in {@code value}),
 * {@code return} ({@code value} is the returned expression) and {@code body}
 * ({@code value} is the code to insert).
 */
@Component
public class StubFunctionSkill implements Skill<StubFunctionSkill.Input, String> {

    public record Input(String snippet, String functionName, String policy, String value) implements SkillInput {}

    private static final SkillManifest MANIFEST = new SkillManifest(
            "stub_function", "1.0.0",
            "stub_function(snippet: str, functionName: str, policy: str = 'raise', value: str = None) -> str",
            "Replace a function body that is only 'pass' with raise NotImplementedError, a return value, or custom code.",
            SkillKind.EDITOR);

    private static final SkillPolicy POLICY = SkillPolicy.guardedEdit();

    @Override public SkillManifest manifest()  { return MANIFEST; }
    @Override public SkillPolicy   policy()    { return POLICY; }
    @Override public Class<Input>  inputType() { return Input.class; }

    @Override
    public String execute(Input input, SkillExecutionContext ctx) {
        return FunctionStubber.stub(input.snippet(), input.functionName(), policyOf(input));
    }

    static StubPolicy policyOf(Input input) {
        String name = input.policy() == null ? "raise" : input.policy().strip().toLowerCase(Locale.ROOT);
        switch (name) {
            case "raise":
                return input.value() == null
                        ? StubPolicy.raiseNotImplemented()
                        : StubPolicy.raiseNotImplemented(input.value());
            case "return":
                return StubPolicy.returning(input.value());
            case "body":
                return StubPolicy.body(input.value());
            default:
                throw new OperationFailure("unsupported stub policy: '" + input.policy()
                        + "' (expected raise, return or body)");
        }
    }
}
