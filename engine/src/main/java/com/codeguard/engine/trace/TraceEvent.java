package com.codeguard.engine.trace;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One structured record of a tool call, handed to a {@link TraceSink} as data.
 *
 * @param event          {@code tool_start}, {@code tool_end}, {@code baseline_registered}
 *                       or {@code session_reset}
 * @param status         {@code applied}, {@code rejected:<kind>} or {@code error}; null on start events
 * @param snippetPreview the first characters of the input snippet
 * @param resultPreview  the first characters of the edited snippet, report or rejection message
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TraceEvent(
        String  event,
        String  tool,
        String  callId,
        String  sessionId,
        String  snippetPreview,
        String  resultPreview,
        String  status,
        Instant timestamp) {

    public static TraceEvent start(String tool, String callId, String sessionId, String snippetPreview) {
        return new TraceEvent("tool_start", tool, callId, sessionId, snippetPreview, null, null, Instant.now());
    }

    public static TraceEvent end(String tool, String callId, String sessionId,
                                 String resultPreview, String status) {
        return new TraceEvent("tool_end", tool, callId, sessionId, null, resultPreview, status, Instant.now());
    }

    public static TraceEvent session(String event, String sessionId, String snippetPreview) {
        return new TraceEvent(event, null, null, sessionId, snippetPreview, null, null, Instant.now());
    }

    /** At most {@code max} characters of {@code text}, with an ellipsis when cut. */
    public static String preview(String text, int max) {
        if (text == null) {
            return null;
        }
        if (max <= 0 || text.length() <= max) {
            return text;
        }
        return text.substring(0, max) + "...";
    }
}
