package com.codeguard.engine.guard;

import com.codeguard.engine.protect.ProtectedIdentifiers;
import com.codeguard.engine.protect.RegistryState;

/**
 * Read-only view of a session for the API.
 *
 * @param protectedIdentifiers the baseline, or null while UNINITIALIZED
 */
public record SessionSnapshot(
        String               sessionId,
        RegistryState        state,
        ProtectedIdentifiers protectedIdentifiers) {}
