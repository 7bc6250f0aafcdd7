package com.codeguard.engine.guard;

import com.codeguard.engine.GuardException;
import com.codeguard.engine.protect.ProtectedIdentifiers;
import com.codeguard.engine.protect.ProtectedSymbolRegistry;
import com.codeguard.engine.skill.Skill;
import com.codeguard.engine.skill.SkillException;
import com.codeguard.engine.skill.SkillExecutionContext;
import com.codeguard.engine.skill.SkillInput;
import com.codeguard.engine.skill.SkillRegistry;
import com.codeguard.engine.trace.TraceEvent;
import com.codeguard.engine.trace.TraceSink;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Comparator;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point for every tool call an orchestrator makes on behalf of a
 * conversation.
 *
 * <p>Sessions are created on first use; a baseline kept in the
 * {@link SessionStore} is loaded before the session is published, without any
 * shared lock. Everything a call does afterwards runs under that session's own
 * lock, so calls for one session are strictly sequential while distinct
 * sessions proceed independently.
 *
 * <p>Open sessions are a cache over the store. Reset closes a session, a
 * periodic sweep closes those idle longer than
 * {@code codeguard.session.idle-timeout}, and opening one beyond
 * {@code codeguard.session.max-open} closes the least recently used. A closed
 * session with an armed baseline is reopened from the store on its next call. Editors go through the session's {@link EditGuard};
 * validators do not. Any {@link GuardException} becomes an
 * {@link EditResult.Rejected}, so callers always receive a value.
 */
@Service
@EnableScheduling
public class EditSessionService {

    private static final Logger log = LoggerFactory.getLogger(EditSessionService.class);

    private final SkillRegistry skills;
    private final SessionStore  store;
    private final TraceSink     traceSink;
    private final int           previewChars;
    private final int           maxOpen;
    private final long          idleTimeoutNanos;

    private final Map<String, EditSession> sessions = new ConcurrentHashMap<>();
    private final AtomicLong ticks = new AtomicLong();

    public EditSessionService(SkillRegistry skills,
                              SessionStore store,
                              TraceSink traceSink,
                              @Value("${codeguard.trace.preview-chars:120}") int previewChars,
                              @Value("${codeguard.session.max-open:10000}") int maxOpen,
                              @Value("${codeguard.session.idle-timeout:30m}") Duration idleTimeout) {
        if (maxOpen < 1) {
            throw new IllegalArgumentException("codeguard.session.max-open must be positive: " + maxOpen);
        }
        this.skills           = skills;
        this.store            = store;
        this.traceSink        = traceSink;
        this.previewChars     = previewChars;
        this.maxOpen          = maxOpen;
        this.idleTimeoutNanos = idleTimeout.toNanos();
    }

    // ------------------------------------------------------------------
    // Tool calls
    // ------------------------------------------------------------------

    /**
     * Call {@code tool} with {@code arguments} in session {@code sessionId}.
     *
     * @param callId caller's id for this call, echoed into logs and traces;
     *               generated when null
     * @throws com.codeguard.engine.skill.SkillNotFoundException for an unknown tool
     * @throws SkillException for malformed arguments, a policy limit, or an
     *                        unexpected failure inside the tool
     */
    public EditResult invoke(String sessionId, String tool, String callId, JsonNode arguments) {
        Skill<?, ?> skill = skills.get(tool);
        String call = callId != null && !callId.isBlank() ? callId : UUID.randomUUID().toString();

        MDC.put("sessionId", sessionId);
        MDC.put("tool",      tool);
        MDC.put("callId",    call);
        try {
            SkillInput input = skills.parseInput(tool, arguments);
            EditSession session = session(sessionId);
            return session.locked(() -> run(session, skill, input, call));
        } finally {
            MDC.remove("sessionId");
            MDC.remove("tool");
            MDC.remove("callId");
        }
    }

    private EditResult run(EditSession session, Skill<?, ?> skill, SkillInput input, String callId) {
        String tool = skill.manifest().name();
        traceSink.record(TraceEvent.start(tool, callId, session.id(),
                TraceEvent.preview(input.snippet(), previewChars)));

        EditResult result;
        try {
            if (skill.policy().guarded()) {
                boolean wasArmed = session.registry().isArmed();
                String edited = session.guard().apply(input.snippet(),
                        () -> skills.execute(tool, input, context(session, callId)));
                if (!wasArmed && session.registry().isArmed()) {
                    store.put(session.id(), session.registry());
                }
                result = new EditResult.Applied(edited, null);
            } else {
                String report = skills.execute(tool, input, context(session, callId));
                result = new EditResult.Applied(input.snippet(), report);
            }
        } catch (GuardException e) {
            log.info("Tool '{}' rejected ({}): {}", tool, e.getKind(), e.getMessage());
            result = EditResult.rejected(e);
        } catch (SkillException e) {
            log.error("Tool '{}' failed: {}", tool, e.getMessage(), e);
            traceSink.record(TraceEvent.end(tool, callId, session.id(),
                    TraceEvent.preview(e.getMessage(), previewChars), "error"));
            throw e;
        }

        traceSink.record(TraceEvent.end(tool, callId, session.id(),
                TraceEvent.preview(previewOf(result), previewChars), statusOf(result)));
        return result;
    }

    private static SkillExecutionContext context(EditSession session, String callId) {
        return new SkillExecutionContext(session.id(), callId, session.registry().baseline().orElse(null));
    }

    // ------------------------------------------------------------------
    // Session lifecycle
    // ------------------------------------------------------------------

    /**
     * Arm the session with {@code snippet}; an existing baseline is only
     * replaced when {@code force} is set.
     *
     * @throws com.codeguard.engine.syntax.SyntaxFailure when the snippet does not parse
     */
    public SessionSnapshot register(String sessionId, String snippet, boolean force) {
        EditSession session = session(sessionId);
        return session.locked(() -> {
            boolean wasArmed = session.registry().isArmed();
            session.registry().register(snippet, force);
            if (force || !wasArmed) {
                store.put(sessionId, session.registry());
                traceSink.record(TraceEvent.session("baseline_registered", sessionId,
                        TraceEvent.preview(snippet, previewChars)));
                log.info("Session {} baseline {}", sessionId, wasArmed ? "replaced" : "registered");
            }
            return snapshotOf(session);
        });
    }

    public SessionSnapshot describe(String sessionId) {
        EditSession session = session(sessionId);
        return session.locked(() -> snapshotOf(session));
    }

    /**
     * Drop the baseline and close the session; the next call opens a fresh one
     * that the next snippet seen arms again.
     */
    public void reset(String sessionId) {
        EditSession session = session(sessionId);
        session.locked(() -> {
            session.guard().reset();
            store.remove(sessionId);
            sessions.remove(sessionId, session);
            return null;
        });
        traceSink.record(TraceEvent.session("session_reset", sessionId, null));
        log.info("Session {} reset", sessionId);
    }

    EditSession session(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        EditSession session = sessions.get(sessionId);
        if (session == null) {
            // the store may be a database; load before publishing, outside any shared lock
            ProtectedSymbolRegistry registry = store.get(sessionId).orElseGet(ProtectedSymbolRegistry::new);
            EditSession created = new EditSession(sessionId, registry);
            created.touch(ticks.incrementAndGet());
            session = sessions.putIfAbsent(sessionId, created);
            if (session == null) {
                log.debug("Opened session {} ({})", sessionId, registry.state());
                if (sessions.size() > maxOpen) {
                    makeRoom(created);
                }
                return created;
            }
        }
        session.touch(ticks.incrementAndGet());
        return session;
    }

    /** Close sessions nobody has used for longer than the idle timeout. */
    @Scheduled(fixedDelayString = "${codeguard.session.sweep-interval:60000}")
    public void evictIdle() {
        closeIdle(null);
    }

    private void closeIdle(EditSession keep) {
        long now = System.nanoTime();
        int closed = 0;
        for (EditSession session : sessions.values()) {
            if (session != keep && now - session.lastUsedNanos() >= idleTimeoutNanos && close(session)) {
                closed++;
            }
        }
        if (closed > 0) {
            log.info("Closed {} idle session(s), {} open", closed, sessions.size());
        }
    }

    int openSessions() {
        return sessions.size();
    }

    boolean isOpen(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    private void makeRoom(EditSession keep) {
        closeIdle(keep);
        while (sessions.size() > maxOpen) {
            Optional<EditSession> eldest = sessions.values().stream()
                    .filter(s -> s != keep && !s.isBusy())
                    .min(Comparator.comparingLong(EditSession::lastTick));
            if (eldest.isEmpty()) {
                return;
            }
            if (close(eldest.get())) {
                log.debug("Closed least recently used session {}", eldest.get().id());
            }
        }
    }

    private boolean close(EditSession session) {
        return !session.isBusy() && sessions.remove(session.id(), session);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static SessionSnapshot snapshotOf(EditSession session) {
        ProtectedIdentifiers baseline = session.registry().baseline().orElse(null);
        return new SessionSnapshot(session.id(), session.registry().state(), baseline);
    }

    private static String previewOf(EditResult result) {
        if (result instanceof EditResult.Applied a) {
            return a.result() != null ? a.result() : a.snippet();
        }
        return ((EditResult.Rejected) result).message();
    }

    private static String statusOf(EditResult result) {
        if (result instanceof EditResult.Rejected r) {
            return "rejected:" + r.kind().name().toLowerCase(Locale.ROOT);
        }
        return "applied";
    }
}
