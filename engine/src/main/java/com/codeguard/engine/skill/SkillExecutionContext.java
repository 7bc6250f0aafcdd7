package com.codeguard.engine.skill;

import com.codeguard.engine.protect.ProtectedIdentifiers;

/**
 * Runtime context passed to every skill invocation.
 *
 * Skills use it to consult the session's protected identifiers and to tag
 * their logs with the owning session and call.
 *
 * @param baseline the session's armed baseline, or null when the session is
 *                 not armed yet
 */
public record SkillExecutionContext(String sessionId, String callId, ProtectedIdentifiers baseline) {

    /** Context for calls made outside any session (tests, the response gate). */
    public static SkillExecutionContext detached() {
        return new SkillExecutionContext(null, null, null);
    }
}
