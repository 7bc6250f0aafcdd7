package com.codeguard.engine.skill;

import com.codeguard.engine.GuardException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process registry of every editor and validator.
 *
 * All {@link Skill} beans declared as Spring {@code @Component}s are
 * collected at startup via constructor injection.
 *
 * <p>Key responsibilities:
 * <ol>
 *   <li>Lookup by name ({@link #get}).</li>
 *   <li>Argument decoding and policy enforcement ({@link #parseInput}).</li>
 *   <li>Metrics-instrumented execution ({@link #execute}): every call is
 *       timed and counted, with no per-skill boilerplate.</li>
 *   <li>Tool documentation generation ({@link #buildToolDocumentation}) for
 *       the orchestrator's prompt, always in sync with the registered skills.</li>
 * </ol>
 */
@Component
public class SkillRegistry {

    private static final Logger log = LoggerFactory.getLogger(SkillRegistry.class);

    private final Map<String, Skill<?, ?>> skills = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;
    private final ObjectMapper  objectMapper;
    private final int           maxSnippetChars;

    /**
     * Spring collects every {@code Skill<?,?>} bean and passes the list here.
     * Adding a new skill only requires declaring it as {@code @Component}.
     */
    public SkillRegistry(List<Skill<?, ?>> allSkills,
                         MeterRegistry meterRegistry,
                         ObjectMapper objectMapper,
                         @Value("${codeguard.skill.max-snippet-chars:200000}") int maxSnippetChars) {
        this.meterRegistry   = meterRegistry;
        this.objectMapper    = objectMapper;
        this.maxSnippetChars = maxSnippetChars;
        for (Skill<?, ?> skill : allSkills) {
            Skill<?, ?> previous = skills.put(skill.manifest().name(), skill);
            if (previous != null) {
                throw new IllegalStateException("Duplicate skill name: '" + skill.manifest().name() + "'");
            }
            log.info("Registered skill '{}' v{} [{}]",
                    skill.manifest().name(),
                    skill.manifest().version(),
                    skill.manifest().kind());
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Skill<?, ?> get(String name) {
        Skill<?, ?> skill = skills.get(name);
        if (skill == null) {
            throw new SkillNotFoundException(name);
        }
        return skill;
    }

    /** Returns all registered skill names (sorted). */
    public List<String> skillNames() {
        return skills.keySet().stream().sorted().toList();
    }

    // ------------------------------------------------------------------
    // Argument decoding
    // ------------------------------------------------------------------

    /**
     * Decode {@code arguments} into the skill's input record and check it
     * against the skill's policy.
     *
     * @throws SkillNotFoundException if no skill has that name
     * @throws SkillException         PARSE_ERROR for malformed arguments or a
     *                                missing snippet; POLICY_VIOLATION for an
     *                                oversized snippet
     */
    public SkillInput parseInput(String skillName, JsonNode arguments) {
        Skill<?, ?> skill = get(skillName);
        JsonNode args = arguments == null || arguments.isNull() ? objectMapper.createObjectNode() : arguments;
        if (!args.isObject()) {
            throw new SkillException(SkillException.Kind.PARSE_ERROR,
                    "Arguments for skill '" + skillName + "' must be a JSON object");
        }

        SkillInput input;
        try {
            input = objectMapper.treeToValue(args, skill.inputType());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SkillException(SkillException.Kind.PARSE_ERROR,
                    "Invalid arguments for skill '" + skillName + "': " + e.getMessage(), e);
        }
        if (input.snippet() == null) {
            throw new SkillException(SkillException.Kind.PARSE_ERROR,
                    "Skill '" + skillName + "' requires a 'snippet' argument");
        }

        int limit = skill.policy().maxSnippetChars() > 0 ? skill.policy().maxSnippetChars() : maxSnippetChars;
        if (input.snippet().length() > limit) {
            throw new SkillException(SkillException.Kind.POLICY_VIOLATION,
                    "Snippet of " + input.snippet().length() + " chars exceeds the limit of "
                            + limit + " for skill '" + skillName + "'");
        }
        return input;
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented execution
    // ------------------------------------------------------------------

    /**
     * Execute a named skill with full observability.
     *
     * Every call is timed and counted:
     * <pre>
     *   codeguard.skill.calls{skill, status="success|rejected|error|policy_violation|parse_error"}
     *   codeguard.skill.duration{skill, kind="editor|validator"}
     * </pre>
     *
     * A {@link GuardException} is the skill's verdict on the snippet and is
     * rethrown as is; any other unexpected exception becomes an
     * EXECUTION_ERROR.
     *
     * @throws SkillException     on controlled execution failure
     * @throws ClassCastException if the caller passes the wrong input type
     */
    @SuppressWarnings("unchecked")
    public <I extends SkillInput, O> O execute(String skillName, I input, SkillExecutionContext ctx) {
        Skill<I, O> skill = (Skill<I, O>) get(skillName);
        String kindTag = skill.manifest().kind().name().toLowerCase(Locale.ROOT);

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return skill.execute(input, ctx);
        } catch (GuardException e) {
            status = "rejected";
            throw e;
        } catch (SkillException e) {
            status = e.getKind().name().toLowerCase(Locale.ROOT);
            throw e;
        } catch (Exception e) {
            status = "error";
            throw new SkillException(SkillException.Kind.EXECUTION_ERROR,
                    "Unexpected error in skill '" + skillName + "': " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("codeguard.skill.duration",
                    "skill", skillName, "kind", kindTag));
            meterRegistry.counter("codeguard.skill.calls",
                    "skill", skillName, "status", status).increment();
        }
    }

    // ------------------------------------------------------------------
    // Tool documentation generation
    // ------------------------------------------------------------------

    /**
     * Generate the AVAILABLE TOOLS block an orchestrator injects into its
     * agent's prompt. Derived from the live manifests, so a new skill shows
     * up without touching any prompt text.
     */
    public String buildToolDocumentation() {
        StringBuilder sb = new StringBuilder();
        sb.append("""
                You can change the snippet only through the following tools. Each call
                takes the current snippet and returns either the edited snippet or a
                rejection explaining why the edit was refused.

                AVAILABLE TOOLS:
                """);

        // Editors first, then validators.
        skills.values().stream()
                .map(Skill::manifest)
                .sorted(Comparator
                        .comparing((SkillManifest m) -> m.kind() == SkillKind.VALIDATOR ? 1 : 0)
                        .thenComparing(SkillManifest::name))
                .forEach(m -> {
                    sb.append("  ").append(m.signature()).append("\n");
                    sb.append("      ").append(m.description()).append("\n\n");
                });

        sb.append("""
                RULES:
                  - Functions, classes, calls and __main__ entry points present in the first
                    snippet of the session are protected. An edit that removes or renames
                    one of them is rejected and the snippet stays as it was.
                  - Prefer the narrowest tool: rename_symbol over apply_patch, stub_function
                    over rewriting a body by hand.
                  - Run validate_python and check_code before giving your final answer.
                """);

        return sb.toString();
    }
}
