package com.codeguard.engine.guard;

import com.codeguard.engine.model.GuardSession;
import com.codeguard.engine.protect.ProtectedSymbolRegistry;
import com.codeguard.engine.repository.GuardSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Keeps session baselines in PostgreSQL so they survive a restart. The
 * registry is rebuilt from the stored baseline snippet on load.
 */
@Component
@ConditionalOnProperty(name = "codeguard.session.store", havingValue = "jpa")
public class JpaSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(JpaSessionStore.class);

    private final GuardSessionRepository repository;

    public JpaSessionStore(GuardSessionRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ProtectedSymbolRegistry> get(String sessionId) {
        return repository.findById(sessionId)
                .map(row -> ProtectedSymbolRegistry.armedWith(row.getBaselineSnippet()));
    }

    @Override
    @Transactional
    public void put(String sessionId, ProtectedSymbolRegistry registry) {
        Optional<String> snippet = registry.originalSnippet();
        if (snippet.isEmpty()) {
            repository.deleteById(sessionId);
            return;
        }
        GuardSession row = repository.findById(sessionId)
                .orElseGet(() -> new GuardSession(sessionId, snippet.get()));
        row.setBaselineSnippet(snippet.get());
        repository.save(row);
        log.debug("Persisted baseline for session {} ({} chars)", sessionId, snippet.get().length());
    }

    @Override
    @Transactional
    public void remove(String sessionId) {
        repository.deleteById(sessionId);
    }
}
