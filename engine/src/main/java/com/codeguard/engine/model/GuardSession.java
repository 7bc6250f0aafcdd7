package com.codeguard.engine.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Persisted baseline of one editing session.
 *
 * Only the snippet the baseline was taken from is stored; the protected
 * identifiers are recomputed from it when the session is loaded.
 *
 * DB table: guard_sessions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "guard_sessions")
public class GuardSession {

    @Id
    @Column(name = "session_id", nullable = false, updatable = false)
    private String sessionId;

    @Column(name = "baseline_snippet", nullable = false, columnDefinition = "TEXT")
    private String baselineSnippet;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    // Called automatically by JPA before every UPDATE.
    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected GuardSession() {}  // required by JPA

    public GuardSession(String sessionId, String baselineSnippet) {
        this.sessionId       = sessionId;
        this.baselineSnippet = baselineSnippet;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String  getSessionId()       { return sessionId; }
    public String  getBaselineSnippet() { return baselineSnippet; }
    public Instant getCreatedAt()       { return createdAt; }
    public Instant getUpdatedAt()       { return updatedAt; }

    public void setBaselineSnippet(String baselineSnippet) { this.baselineSnippet = baselineSnippet; }
}
