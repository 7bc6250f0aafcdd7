package com.codeguard.engine.protect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Session-scoped holder of the protected-identifier baseline.
 *
 * <p>Starts {@link RegistryState#UNINITIALIZED}. The first non-empty snippet
 * passed to {@link #ensure} or {@link #register} becomes the frozen baseline
 * and the registry is {@link RegistryState#ARMED}; only a forced register or
 * {@link #reset()} replaces it. One instance per editing session, never shared
 * between sessions.
 */
public class ProtectedSymbolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProtectedSymbolRegistry.class);

    private ProtectedIdentifiers baseline;
    private String               originalSnippet;

    /** A registry already armed with {@code snippet} as its baseline. */
    public static ProtectedSymbolRegistry armedWith(String snippet) {
        ProtectedSymbolRegistry registry = new ProtectedSymbolRegistry();
        registry.register(snippet, true);
        return registry;
    }

    public synchronized RegistryState state() {
        return baseline == null ? RegistryState.UNINITIALIZED : RegistryState.ARMED;
    }

    public synchronized boolean isArmed() {
        return baseline != null;
    }

    /**
     * Arm with {@code snippet} unless a baseline exists; returns the baseline
     * (empty when still uninitialised).
     */
    public synchronized ProtectedIdentifiers ensure(String snippet) {
        if (baseline == null && snippet != null && !snippet.isEmpty()) {
            arm(snippet);
        }
        return baseline != null ? baseline : ProtectedIdentifiers.empty();
    }

    /**
     * Arm with {@code snippet}; an existing baseline is only replaced when
     * {@code force} is set. Returns the baseline in effect afterwards.
     */
    public synchronized ProtectedIdentifiers register(String snippet, boolean force) {
        if (force || baseline == null) {
            arm(snippet);
        }
        return baseline;
    }

    public synchronized Optional<ProtectedIdentifiers> baseline() {
        return Optional.ofNullable(baseline);
    }

    public synchronized Optional<String> originalSnippet() {
        return Optional.ofNullable(originalSnippet);
    }

    public synchronized boolean isProtected(String name) {
        return baseline != null && baseline.forbids(name);
    }

    /** Violations of {@code snippet} against the baseline; empty when not armed. */
    public synchronized List<Violation> validate(String snippet) {
        if (baseline == null) {
            return List.of();
        }
        return ProtectedIdentifiers.diff(baseline, IdentifierCollector.collect(snippet));
    }

    public synchronized void reset() {
        baseline        = null;
        originalSnippet = null;
    }

    private void arm(String snippet) {
        ProtectedIdentifiers collected = IdentifierCollector.collect(snippet);
        baseline        = collected;
        originalSnippet = snippet;
        log.debug("Baseline armed: {} function(s), {} class(es), {} call(s), {} entry point(s)",
                collected.functions().size(), collected.classes().size(),
                collected.calls().size(), collected.entryPoints().size());
    }
}
