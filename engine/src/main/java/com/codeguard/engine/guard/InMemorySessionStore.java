package com.codeguard.engine.guard;

import com.codeguard.engine.protect.ProtectedSymbolRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(name = "codeguard.session.store", havingValue = "memory", matchIfMissing = true)
public class InMemorySessionStore implements SessionStore {

    private final Map<String, ProtectedSymbolRegistry> registries = new ConcurrentHashMap<>();

    @Override
    public Optional<ProtectedSymbolRegistry> get(String sessionId) {
        return Optional.ofNullable(registries.get(sessionId));
    }

    @Override
    public void put(String sessionId, ProtectedSymbolRegistry registry) {
        registries.put(sessionId, registry);
    }

    @Override
    public void remove(String sessionId) {
        registries.remove(sessionId);
    }
}
