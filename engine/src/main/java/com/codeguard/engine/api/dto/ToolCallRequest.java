package com.codeguard.engine.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request body for POST /sessions/{sessionId}/tools/{tool}.
 *
 * {@code arguments} is decoded into the tool's own argument record; it must
 * at least carry the {@code snippet}.
 */
public record ToolCallRequest(
        String   callId,
        JsonNode arguments
) {}
