package com.codeguard.engine.guard;

import com.codeguard.engine.protect.ProtectedSymbolRegistry;

import java.util.Optional;

/**
 * Where session baselines live between calls. Selected with
 * {@code codeguard.session.store}: {@code memory} (default) or {@code jpa}.
 */
public interface SessionStore {

    Optional<ProtectedSymbolRegistry> get(String sessionId);

    void put(String sessionId, ProtectedSymbolRegistry registry);

    void remove(String sessionId);
}
