package com.codeguard.engine.api;

import com.codeguard.engine.GuardException;
import com.codeguard.engine.guard.EditResult;
import com.codeguard.engine.guard.EditSessionService;
import com.codeguard.engine.guard.SessionSnapshot;
import com.codeguard.engine.protect.IdentifierCollector;
import com.codeguard.engine.protect.RegistryState;
import com.codeguard.engine.protect.Violation;
import com.codeguard.engine.skill.SkillException;
import com.codeguard.engine.skill.SkillNotFoundException;
import com.codeguard.engine.syntax.SyntaxFailure;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for SessionController: only the web layer, with the session
 * service mocked.
 */
@WebMvcTest(SessionController.class)
class SessionControllerTest {

    @Autowired   MockMvc            mockMvc;
    @MockitoBean EditSessionService sessionService;

    // ------------------------------------------------------------------
    // POST /sessions/{id}/tools/{tool}
    // ------------------------------------------------------------------

    @Test
    void callTool_applied_returns200WithSnippet() throws Exception {
        when(sessionService.invoke(eq("s-1"), eq("add_import"), eq("c-1"), any()))
                .thenReturn(new EditResult.Applied("import math\nx = 1\n", null));

        mockMvc.perform(post("/sessions/s-1/tools/add_import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"callId":"c-1","arguments":{"snippet":"x = 1\\n","module":"math"}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("applied"))
                .andExpect(jsonPath("$.snippet").value("import math\nx = 1\n"))
                .andExpect(jsonPath("$.kind").doesNotExist());
    }

    @Test
    void callTool_rejected_returns422WithViolations() throws Exception {
        when(sessionService.invoke(any(), any(), any(), any())).thenReturn(new EditResult.Rejected(
                GuardException.Kind.PROTECTED_IDENTIFIER, "edit removes protected identifiers: function 'a'",
                List.of(new Violation(Violation.Category.FUNCTION, "a")), null));

        mockMvc.perform(post("/sessions/s-1/tools/apply_patch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"arguments":{"snippet":"def a():\\n    pass\\n","diff":"@@ -1,2 +0,0 @@"}}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.status").value("rejected"))
                .andExpect(jsonPath("$.kind").value("PROTECTED_IDENTIFIER"))
                .andExpect(jsonPath("$.violations[0].category").value("function"))
                .andExpect(jsonPath("$.violations[0].name").value("a"))
                .andExpect(jsonPath("$.snippet").doesNotExist());
    }

    @Test
    void callTool_unknownTool_returns404() throws Exception {
        when(sessionService.invoke(any(), eq("format_code"), any(), any()))
                .thenThrow(new SkillNotFoundException("format_code"));

        mockMvc.perform(post("/sessions/s-1/tools/format_code")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"arguments\":{\"snippet\":\"x\"}}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title").value("Unknown tool"));
    }

    @Test
    void callTool_badArguments_returns400() throws Exception {
        when(sessionService.invoke(any(), any(), any(), any()))
                .thenThrow(new SkillException(SkillException.Kind.PARSE_ERROR, "requires a 'snippet' argument"));

        mockMvc.perform(post("/sessions/s-1/tools/check_code")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"arguments\":{}}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void callTool_snippetTooLarge_returns413() throws Exception {
        when(sessionService.invoke(any(), any(), any(), any()))
                .thenThrow(new SkillException(SkillException.Kind.POLICY_VIOLATION, "exceeds the limit"));

        mockMvc.perform(post("/sessions/s-1/tools/check_code")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"arguments\":{\"snippet\":\"x\"}}"))
                .andExpect(status().isPayloadTooLarge());
    }

    // ------------------------------------------------------------------
    // Session lifecycle
    // ------------------------------------------------------------------

    @Test
    void registerBaseline_returnsArmedSnapshot() throws Exception {
        when(sessionService.register("s-1", "def a():\n    pass\n", true)).thenReturn(new SessionSnapshot(
                "s-1", RegistryState.ARMED, IdentifierCollector.collect("def a():\n    pass\n")));

        mockMvc.perform(post("/sessions/s-1/baseline")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"snippet":"def a():\\n    pass\\n","force":true}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("ARMED"))
                .andExpect(jsonPath("$.protectedIdentifiers.functions[0]").value("a"));
    }

    @Test
    void registerBaseline_missingSnippet_returns400() throws Exception {
        mockMvc.perform(post("/sessions/s-1/baseline")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(sessionService);
    }

    @Test
    void registerBaseline_unparsableSnippet_returns422() throws Exception {
        when(sessionService.register(any(), any(), anyBoolean()))
                .thenThrow(new SyntaxFailure(1, 8, "expected ':'"));

        mockMvc.perform(post("/sessions/s-1/baseline")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"snippet\":\"def a()\\n    pass\\n\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.kind").value("SYNTAX"))
                .andExpect(jsonPath("$.findings[0].rule").value("syntax"))
                .andExpect(jsonPath("$.findings[0].line").value(1));
    }

    @Test
    void getSession_uninitialized() throws Exception {
        when(sessionService.describe("s-2"))
                .thenReturn(new SessionSnapshot("s-2", RegistryState.UNINITIALIZED, null));

        mockMvc.perform(get("/sessions/s-2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").value("s-2"))
                .andExpect(jsonPath("$.state").value("UNINITIALIZED"))
                .andExpect(jsonPath("$.protectedIdentifiers").value(nullValue()));
    }

    @Test
    void resetSession_returns204() throws Exception {
        mockMvc.perform(delete("/sessions/s-1"))
                .andExpect(status().isNoContent());

        verify(sessionService).reset("s-1");
    }
}
