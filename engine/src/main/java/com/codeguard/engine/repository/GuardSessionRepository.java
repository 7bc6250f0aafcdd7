package com.codeguard.engine.repository;

import com.codeguard.engine.model.GuardSession;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * CRUD operations for the guard_sessions table.
 *
 * Spring Data JPA generates the implementation at startup.
 */
public interface GuardSessionRepository extends JpaRepository<GuardSession, String> {
}
