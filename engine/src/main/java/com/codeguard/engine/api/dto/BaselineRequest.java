package com.codeguard.engine.api.dto;

/**
 * Request body for POST /sessions/{sessionId}/baseline.
 *
 * {@code force} replaces an existing baseline; without it the first baseline stays.
 */
public record BaselineRequest(
        String  snippet,
        boolean force
) {}
