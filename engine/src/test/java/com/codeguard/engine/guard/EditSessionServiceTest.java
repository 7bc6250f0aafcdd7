package com.codeguard.engine.guard;

import com.codeguard.engine.GuardException;
import com.codeguard.engine.protect.ProtectedSymbolRegistry;
import com.codeguard.engine.protect.RegistryState;
import com.codeguard.engine.protect.Violation;
import com.codeguard.engine.skill.SkillException;
import com.codeguard.engine.skill.SkillNotFoundException;
import com.codeguard.engine.skill.SkillRegistry;
import com.codeguard.engine.skill.impl.*;
import com.codeguard.engine.trace.TraceEvent;
import com.codeguard.engine.trace.TraceSink;
import com.codeguard.engine.validate.Finding;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * Sessions driven through the real skills; only the trace sink is mocked.
 */
@ExtendWith(MockitoExtension.class)
class EditSessionServiceTest {

    private static final String HELPERS = """
            def a():
                return 1

            def b():
                return a()
            """;

    @Mock TraceSink traceSink;

    ObjectMapper         mapper = new ObjectMapper();
    InMemorySessionStore store  = new InMemorySessionStore();
    SkillRegistry        skills;
    EditSessionService   service;

    @BeforeEach
    void setUp() {
        skills = new SkillRegistry(List.of(
                new AddImportSkill(), new RenameSymbolSkill(), new FixIndexingSkill(),
                new StubFunctionSkill(), new ApplyPatchSkill(), new ApplyStructuredPatchSkill(mapper),
                new RepairFunctionColonsSkill(), new ValidatePythonSkill(), new CheckCodeSkill(),
                new LogRuntimeIssuesSkill()),
                new SimpleMeterRegistry(), mapper, 200_000);
        service = new EditSessionService(skills, store, traceSink, 120, 1000, Duration.ofMinutes(30));
    }

    private ObjectNode args(String snippet) {
        return mapper.createObjectNode().put("snippet", snippet);
    }

    // ------------------------------------------------------------------
    // Editors
    // ------------------------------------------------------------------

    @Test
    void invoke_addImport_appliedAndSessionArmed() {
        EditResult result = service.invoke("s1", "add_import", "c1",
                args("def foo():\n    return 1\n").put("module", "math"));

        assertThat(result).isEqualTo(new EditResult.Applied("import math\ndef foo():\n    return 1\n", null));
        assertThat(service.describe("s1").state()).isEqualTo(RegistryState.ARMED);
        assertThat(store.get("s1")).isPresent();
    }

    @Test
    void invoke_stubFunction_replacesPass() {
        EditResult result = service.invoke("s1", "stub_function", null,
                args("def compute():\n    pass\n").put("functionName", "compute"));

        assertThat(result.applied()).isTrue();
        assertThat(((EditResult.Applied) result).snippet())
                .isEqualTo("def compute():\n    raise NotImplementedError()\n");
    }

    @Test
    void invoke_patchDeletingProtectedFunction_rejected() {
        service.register("s1", HELPERS, false);

        EditResult result = service.invoke("s1", "apply_patch", "c2",
                args(HELPERS).put("diff", "@@ -1,3 +0,0 @@\n-def a():\n-    return 1\n-\n"));

        assertThat(result).isInstanceOf(EditResult.Rejected.class);
        EditResult.Rejected rejected = (EditResult.Rejected) result;
        assertThat(rejected.kind()).isEqualTo(GuardException.Kind.PROTECTED_IDENTIFIER);
        assertThat(rejected.violations()).containsExactly(new Violation(Violation.Category.FUNCTION, "a"));
    }

    @Test
    void invoke_renameOfProtectedName_rejectedBeforeAnyEdit() {
        service.register("s1", HELPERS, false);

        EditResult result = service.invoke("s1", "rename_symbol", "c3",
                args(HELPERS).put("oldName", "a").put("newName", "alpha").put("all", true));

        assertThat(result.applied()).isFalse();
        assertThat(((EditResult.Rejected) result).kind()).isEqualTo(GuardException.Kind.PROTECTED_IDENTIFIER);
    }

    @Test
    void invoke_editProducingInvalidCode_rejectedAsSyntax() {
        service.register("s1", HELPERS, false);
        ObjectNode arguments = args(HELPERS);
        arguments.putArray("operations").addObject()
                .put("action", "replace").put("target", "def b():").put("replacement", "def b(:");

        EditResult result = service.invoke("s1", "apply_structured_patch", "c4", arguments);

        EditResult.Rejected rejected = (EditResult.Rejected) result;
        assertThat(rejected.kind()).isEqualTo(GuardException.Kind.SYNTAX);
        assertThat(rejected.findings()).extracting(Finding::rule).containsExactly("syntax");
    }

    @Test
    void invoke_operationFailure_rejectedAsOperation() {
        EditResult result = service.invoke("s1", "apply_patch", "c5",
                args("a = 1\n").put("diff", "@@ -1 +1 @@\n-a = 9\n+a = 2\n"));

        assertThat(((EditResult.Rejected) result).kind()).isEqualTo(GuardException.Kind.OPERATION);
    }

    @Test
    void invoke_unparsableFirstSnippet_armsFromRepairedOutput() {
        EditResult result = service.invoke("s1", "repair_function_colons", "c6", args("def bad()\n    pass\n"));

        assertThat(result).isEqualTo(new EditResult.Applied("def bad():\n    pass\n", null));
        assertThat(service.describe("s1").protectedIdentifiers().functions()).containsExactly("bad");
    }

    // ------------------------------------------------------------------
    // Validators
    // ------------------------------------------------------------------

    @Test
    void invoke_validator_returnsReportWithoutArming() {
        EditResult result = service.invoke("s2", "log_runtime_issues", "v1", args("result = 10 / 0\n"));

        assertThat(result).isEqualTo(new EditResult.Applied("result = 10 / 0\n",
                "[runtime_error] ZeroDivisionError at line 1, column 9 - Detected division by zero."));
        assertThat(service.describe("s2").state()).isEqualTo(RegistryState.UNINITIALIZED);
    }

    @Test
    void invoke_checkCodeWithFindings_rejectedAsValidation() {
        EditResult result = service.invoke("s2", "check_code", "v2", args("MY_SENTINEL = None\n"));

        EditResult.Rejected rejected = (EditResult.Rejected) result;
        assertThat(rejected.kind()).isEqualTo(GuardException.Kind.VALIDATION);
        assertThat(rejected.findings()).extracting(Finding::rule).containsExactly("sentinel-none");
    }

    // ------------------------------------------------------------------
    // Errors outside the guard
    // ------------------------------------------------------------------

    @Test
    void invoke_unknownTool_throwsSkillNotFound() {
        assertThatThrownBy(() -> service.invoke("s1", "format_code", null, args("x = 1\n")))
                .isInstanceOf(SkillNotFoundException.class);
        verifyNoInteractions(traceSink);
    }

    @Test
    void invoke_missingSnippet_throwsParseError() {
        assertThatThrownBy(() -> service.invoke("s1", "validate_python", null, mapper.createObjectNode()))
                .isInstanceOfSatisfying(SkillException.class, e ->
                        assertThat(e.getKind()).isEqualTo(SkillException.Kind.PARSE_ERROR));
    }

    @Test
    void invoke_blankSessionId_rejected() {
        assertThatThrownBy(() -> service.invoke(" ", "validate_python", null, args("x = 1\n")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Session lifecycle
    // ------------------------------------------------------------------

    @Test
    void sessions_areIndependent() {
        service.register("s1", HELPERS, false);

        EditResult other = service.invoke("s2", "add_import", null,
                args("def z():\n    pass\n").put("module", "os"));

        assertThat(other.applied()).isTrue();
        assertThat(service.describe("s2").protectedIdentifiers().functions()).containsExactly("z");
        assertThat(service.describe("s1").protectedIdentifiers().functions()).containsExactly("a", "b");
    }

    @Test
    void register_withoutForce_keepsFirstBaseline() {
        service.register("s1", HELPERS, false);

        SessionSnapshot snapshot = service.register("s1", "def z():\n    pass\n", false);

        assertThat(snapshot.protectedIdentifiers().functions()).containsExactly("a", "b");
    }

    @Test
    void reset_clearsBaselineAndStore() {
        service.register("s1", HELPERS, false);

        service.reset("s1");

        assertThat(service.describe("s1").state()).isEqualTo(RegistryState.UNINITIALIZED);
        assertThat(service.describe("s1").protectedIdentifiers()).isNull();
        assertThat(store.get("s1")).isEmpty();
    }

    @Test
    void reset_closesTheSession() {
        service.register("s1", HELPERS, false);
        service.describe("s2");

        service.reset("s1");

        assertThat(service.isOpen("s1")).isFalse();
        assertThat(service.openSessions()).isEqualTo(1);
    }

    @Test
    void evictIdle_closesIdleSessions_armedBaselineReopensFromStore() {
        EditSessionService eager = new EditSessionService(skills, store, traceSink, 120, 1000, Duration.ZERO);
        eager.register("s1", HELPERS, false);
        eager.describe("s2");

        eager.evictIdle();

        assertThat(eager.openSessions()).isZero();
        assertThat(eager.describe("s1").protectedIdentifiers().functions()).containsExactly("a", "b");
        assertThat(eager.describe("s2").state()).isEqualTo(RegistryState.UNINITIALIZED);
    }

    @Test
    void evictIdle_recentSessionsStayOpen() {
        service.describe("s1");

        service.evictIdle();

        assertThat(service.isOpen("s1")).isTrue();
    }

    @Test
    void maxOpen_closesLeastRecentlyUsed() {
        EditSessionService bounded = new EditSessionService(skills, store, traceSink, 120, 2, Duration.ofMinutes(30));
        bounded.describe("s1");
        bounded.describe("s2");
        bounded.describe("s1");

        bounded.describe("s3");

        assertThat(bounded.openSessions()).isEqualTo(2);
        assertThat(bounded.isOpen("s1")).isTrue();
        assertThat(bounded.isOpen("s2")).isFalse();
        assertThat(bounded.isOpen("s3")).isTrue();
    }

    @Test
    void session_slowStoreLoad_doesNotBlockOtherSessions() throws Exception {
        CountDownLatch loading = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        InMemorySessionStore slowStore = new InMemorySessionStore() {
            @Override
            public Optional<ProtectedSymbolRegistry> get(String sessionId) {
                if (sessionId.equals("slow")) {
                    loading.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IllegalStateException(e);
                    }
                }
                return super.get(sessionId);
            }
        };
        EditSessionService slow = new EditSessionService(skills, slowStore, traceSink, 120, 1000, Duration.ofMinutes(30));

        CompletableFuture<SessionSnapshot> blocked = CompletableFuture.supplyAsync(() -> slow.describe("slow"));
        assertThat(loading.await(5, TimeUnit.SECONDS)).isTrue();

        SessionSnapshot other = CompletableFuture.supplyAsync(() -> slow.describe("fast")).get(5, TimeUnit.SECONDS);
        assertThat(other.state()).isEqualTo(RegistryState.UNINITIALIZED);
        assertThat(blocked).isNotDone();

        release.countDown();
        assertThat(blocked.get(5, TimeUnit.SECONDS).state()).isEqualTo(RegistryState.UNINITIALIZED);
    }

    @Test
    void session_restoredFromStore() {
        store.put("s7", ProtectedSymbolRegistry.armedWith(HELPERS));

        assertThat(service.describe("s7").state()).isEqualTo(RegistryState.ARMED);
    }

    // ------------------------------------------------------------------
    // Tracing
    // ------------------------------------------------------------------

    @Test
    void invoke_recordsStartAndEndEvents() {
        service.invoke("s1", "validate_python", "t1", args("x = 1\n"));

        ArgumentCaptor<TraceEvent> events = ArgumentCaptor.forClass(TraceEvent.class);
        verify(traceSink, times(2)).record(events.capture());
        assertThat(events.getAllValues()).extracting(TraceEvent::event).containsExactly("tool_start", "tool_end");
        assertThat(events.getAllValues()).extracting(TraceEvent::callId).containsOnly("t1");
        assertThat(events.getAllValues().get(1).status()).isEqualTo("applied");
    }

    @Test
    void invoke_rejection_tracedWithKind() {
        service.invoke("s1", "check_code", "t2", args("SENTINEL = None\n"));

        ArgumentCaptor<TraceEvent> events = ArgumentCaptor.forClass(TraceEvent.class);
        verify(traceSink, times(2)).record(events.capture());
        assertThat(events.getAllValues().get(1).status()).isEqualTo("rejected:validation");
    }
}
