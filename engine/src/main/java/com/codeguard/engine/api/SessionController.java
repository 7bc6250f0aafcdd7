package com.codeguard.engine.api;

import com.codeguard.engine.api.dto.BaselineRequest;
import com.codeguard.engine.api.dto.SessionResponse;
import com.codeguard.engine.api.dto.ToolCallRequest;
import com.codeguard.engine.api.dto.ToolCallResponse;
import com.codeguard.engine.guard.EditResult;
import com.codeguard.engine.guard.EditSessionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST API for guarded editing sessions.
 *
 * POST   /sessions/{id}/tools/{tool}  call an editor or validator
 * POST   /sessions/{id}/baseline      register the protected baseline explicitly
 * GET    /sessions/{id}               current state and protected identifiers
 * DELETE /sessions/{id}               forget the baseline
 */
@RestController
@RequestMapping("/sessions")
public class SessionController {

    private final EditSessionService sessionService;

    public SessionController(EditSessionService sessionService) {
        this.sessionService = sessionService;
    }

    /**
     * Call a tool for a session.
     *
     * Example:
     *   curl -X POST http://localhost:8080/sessions/s-1/tools/add_import \
     *     -H "Content-Type: application/json" \
     *     -d '{"arguments":{"snippet":"def foo():\n    return 1\n","module":"math"}}'
     *
     * HTTP 200: applied
     * HTTP 422: rejected; the body says why and the snippet is unchanged
     * HTTP 404: no such tool
     */
    @PostMapping("/{sessionId}/tools/{tool}")
    public ResponseEntity<ToolCallResponse> callTool(@PathVariable String sessionId,
                                                     @PathVariable String tool,
                                                     @RequestBody ToolCallRequest req) {
        EditResult result = sessionService.invoke(sessionId, tool, req.callId(), req.arguments());
        HttpStatus status = result.applied() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(ToolCallResponse.from(result));
    }

    @PostMapping("/{sessionId}/baseline")
    public SessionResponse registerBaseline(@PathVariable String sessionId, @RequestBody BaselineRequest req) {
        if (req.snippet() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "snippet is required");
        }
        return SessionResponse.from(sessionService.register(sessionId, req.snippet(), req.force()));
    }

    @GetMapping("/{sessionId}")
    public SessionResponse getSession(@PathVariable String sessionId) {
        return SessionResponse.from(sessionService.describe(sessionId));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> resetSession(@PathVariable String sessionId) {
        sessionService.reset(sessionId);
        return ResponseEntity.noContent().build();
    }
}
