package com.codeguard.engine.skill;

import com.codeguard.engine.edit.OperationFailure;
import com.codeguard.engine.protect.IdentifierCollector;
import com.codeguard.engine.protect.ProtectedIdentifierViolation;
import com.codeguard.engine.skill.impl.*;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Skill registry and skills without a Spring context; all wiring is manual.
 */
class SkillLayerTest {

    ObjectMapper          mapper = new ObjectMapper();
    SimpleMeterRegistry   meters;
    SkillRegistry         registry;
    SkillExecutionContext ctx = SkillExecutionContext.detached();

    @BeforeEach
    void setUp() {
        meters = new SimpleMeterRegistry();
        registry = new SkillRegistry(allSkills(), meters, mapper, 200_000);
    }

    private List<Skill<?, ?>> allSkills() {
        return List.of(
                new AddImportSkill(),
                new RenameSymbolSkill(),
                new FixIndexingSkill(),
                new StubFunctionSkill(),
                new ApplyPatchSkill(),
                new ApplyStructuredPatchSkill(mapper),
                new RepairFunctionColonsSkill(),
                new ValidatePythonSkill(),
                new CheckCodeSkill(),
                new LogRuntimeIssuesSkill());
    }

    // ------------------------------------------------------------------
    // Registration and lookup
    // ------------------------------------------------------------------

    @Test
    void registry_registersAllSkillsSorted() {
        assertThat(registry.skillNames()).containsExactly(
                "add_import", "apply_patch", "apply_structured_patch", "check_code", "fix_indexing",
                "log_runtime_issues", "rename_symbol", "repair_function_colons", "stub_function",
                "validate_python");
    }

    @Test
    void registry_get_unknownSkill_throwsNotFoundException() {
        assertThatThrownBy(() -> registry.get("no_such_skill"))
                .isInstanceOf(SkillNotFoundException.class)
                .hasMessageContaining("no_such_skill");
    }

    @Test
    void registry_duplicateName_rejected() {
        assertThatThrownBy(() -> new SkillRegistry(
                List.of(new CheckCodeSkill(), new CheckCodeSkill()), meters, mapper, 100))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("check_code");
    }

    @Test
    void policies_editorsGuardedValidatorsReadOnly() {
        for (String name : registry.skillNames()) {
            Skill<?, ?> skill = registry.get(name);
            assertThat(skill.policy().guarded())
                    .as(name)
                    .isEqualTo(skill.manifest().kind() == SkillKind.EDITOR);
        }
    }

    // ------------------------------------------------------------------
    // Tool documentation
    // ------------------------------------------------------------------

    @Test
    void buildToolDocumentation_listsEditorsBeforeValidators() {
        String docs = registry.buildToolDocumentation();

        assertThat(docs).contains("AVAILABLE TOOLS:");
        assertThat(docs).contains("rename_symbol(snippet: str, oldName: str, newName: str");
        assertThat(docs).contains("check_code(snippet: str) -> str");
        assertThat(docs.indexOf("stub_function(")).isLessThan(docs.indexOf("check_code("));
    }

    @Test
    void buildToolDocumentation_containsRulesSection() {
        String docs = registry.buildToolDocumentation();

        assertThat(docs).contains("RULES:");
        assertThat(docs).contains("Run validate_python and check_code before giving your final answer.");
    }

    // ------------------------------------------------------------------
    // Argument decoding
    // ------------------------------------------------------------------

    @Test
    void parseInput_objectArguments_decodedIntoSkillInput() throws Exception {
        SkillInput input = registry.parseInput("rename_symbol", mapper.readTree("""
                {"snippet": "x = 1\\n", "oldName": "x", "newName": "y", "all": true}
                """));

        assertThat(input).isEqualTo(new RenameSymbolSkill.Input("x = 1\n", "x", "y", null, null, true, null));
    }

    @Test
    void parseInput_nonObjectArguments_parseError() {
        assertThatThrownBy(() -> registry.parseInput("check_code", new TextNode("x = 1")))
                .isInstanceOfSatisfying(SkillException.class, e ->
                        assertThat(e.getKind()).isEqualTo(SkillException.Kind.PARSE_ERROR));
    }

    @Test
    void parseInput_wrongFieldType_parseError() throws Exception {
        assertThatThrownBy(() -> registry.parseInput("fix_indexing",
                mapper.readTree("{\"snippet\": \"x[0]\\n\", \"delta\": \"one\"}")))
                .isInstanceOfSatisfying(SkillException.class, e ->
                        assertThat(e.getKind()).isEqualTo(SkillException.Kind.PARSE_ERROR));
    }

    @Test
    void parseInput_nullArguments_missingSnippet() {
        assertThatThrownBy(() -> registry.parseInput("validate_python", null))
                .isInstanceOf(SkillException.class)
                .hasMessageContaining("requires a 'snippet' argument");
    }

    @Test
    void parseInput_oversizedSnippet_policyViolation() {
        SkillRegistry small = new SkillRegistry(allSkills(), meters, mapper, 10);

        assertThatThrownBy(() -> small.parseInput("check_code",
                mapper.createObjectNode().put("snippet", "x = 1234567890\n")))
                .isInstanceOfSatisfying(SkillException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(SkillException.Kind.POLICY_VIOLATION);
                    assertThat(e.getMessage()).startsWith("[POLICY_VIOLATION]");
                });
    }

    // ------------------------------------------------------------------
    // Skills
    // ------------------------------------------------------------------

    @Test
    void renameSymbol_usesBaselineFromContext() {
        String snippet = "def helper():\n    pass\n";
        SkillExecutionContext armed = new SkillExecutionContext("s", "c", IdentifierCollector.collect(snippet));

        assertThatThrownBy(() -> new RenameSymbolSkill().execute(
                new RenameSymbolSkill.Input(snippet, "helper", "aid", null, null, null, null), armed))
                .isInstanceOf(ProtectedIdentifierViolation.class);
    }

    @Test
    void fixIndexing_defaultsToFirstOccurrence() {
        String result = new FixIndexingSkill().execute(
                new FixIndexingSkill.Input("a = xs[1] + xs[1]\n", 1, 0, null, null, null), ctx);

        assertThat(result).isEqualTo("a = xs[0] + xs[1]\n");
    }

    @Test
    void stubFunction_unknownPolicy_operationFailure() {
        assertThatThrownBy(() -> new StubFunctionSkill().execute(
                new StubFunctionSkill.Input("def f():\n    pass\n", "f", "explode", null), ctx))
                .isInstanceOf(OperationFailure.class)
                .hasMessageContaining("unsupported stub policy");
    }

    @Test
    void stubFunction_returnPolicy() {
        String result = new StubFunctionSkill().execute(
                new StubFunctionSkill.Input("def f():\n    pass\n", "f", "return", "[]"), ctx);

        assertThat(result).isEqualTo("def f():\n    return []\n");
    }

    @Test
    void applyStructuredPatch_doubleEncodedOperations() {
        String result = new ApplyStructuredPatchSkill(mapper).execute(new ApplyStructuredPatchSkill.Input(
                "x = 1\n", new TextNode("[{\"action\": \"append\", \"content\": \"y = 2\"}]")), ctx);

        assertThat(result).isEqualTo("x = 1\ny = 2\n");
    }

    @Test
    void validatePython_reportsSyntaxErrorAsText() {
        String report = new ValidatePythonSkill().execute(new ValidatePythonSkill.Input("def f()\n    pass\n"), ctx);

        assertThat(report).startsWith("syntax_error: line 1");
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented execution
    // ------------------------------------------------------------------

    @Test
    void execute_success_incrementsCallCounterAndTimer() {
        registry.execute("validate_python", new ValidatePythonSkill.Input("x = 1\n"), ctx);

        assertThat(meters.counter("codeguard.skill.calls",
                "skill", "validate_python", "status", "success").count()).isEqualTo(1.0);
        assertThat(meters.timer("codeguard.skill.duration",
                "skill", "validate_python", "kind", "validator").count()).isEqualTo(1);
    }

    @Test
    void execute_guardException_rethrownAndCountedAsRejected() {
        assertThatThrownBy(() -> registry.execute("check_code", new CheckCodeSkill.Input("SENTINEL = None\n"), ctx))
                .isInstanceOf(com.codeguard.engine.validate.ValidationFailure.class);

        assertThat(meters.counter("codeguard.skill.calls",
                "skill", "check_code", "status", "rejected").count()).isEqualTo(1.0);
    }

    @Test
    void execute_unexpectedException_wrappedAsExecutionError() {
        SkillRegistry failing = new SkillRegistry(List.of(new ExplodingSkill()), meters, mapper, 100);

        assertThatThrownBy(() -> failing.execute("explode", new CheckCodeSkill.Input("x"), ctx))
                .isInstanceOfSatisfying(SkillException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(SkillException.Kind.EXECUTION_ERROR);
                    assertThat(e.getCause()).isInstanceOf(IllegalStateException.class);
                });
        assertThat(meters.counter("codeguard.skill.calls",
                "skill", "explode", "status", "error").count()).isEqualTo(1.0);
    }

    private static class ExplodingSkill implements Skill<CheckCodeSkill.Input, String> {

        @Override
        public SkillManifest manifest() {
            return new SkillManifest("explode", "0.0.1", "explode(snippet: str) -> str", "Always fails.",
                    SkillKind.VALIDATOR);
        }

        @Override public SkillPolicy policy() { return SkillPolicy.readOnly(); }

        @Override public Class<CheckCodeSkill.Input> inputType() { return CheckCodeSkill.Input.class; }

        @Override
        public String execute(CheckCodeSkill.Input input, SkillExecutionContext ctx) {
            throw new IllegalStateException("boom");
        }
    }
}
