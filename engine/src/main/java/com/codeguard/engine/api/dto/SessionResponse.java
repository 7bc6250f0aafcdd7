package com.codeguard.engine.api.dto;

import com.codeguard.engine.guard.SessionSnapshot;
import com.codeguard.engine.protect.ProtectedIdentifiers;
import com.codeguard.engine.protect.RegistryState;

/** Response body for GET /sessions/{sessionId} and POST .../baseline. */
public record SessionResponse(
        String               sessionId,
        RegistryState        state,
        ProtectedIdentifiers protectedIdentifiers
) {
    public static SessionResponse from(SessionSnapshot s) {
        return new SessionResponse(s.sessionId(), s.state(), s.protectedIdentifiers());
    }
}
