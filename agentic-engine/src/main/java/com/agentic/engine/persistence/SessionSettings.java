package com.agentic.engine.persistence;

import java.time.Duration;

/**
 * Limits for the session store.
 *
 * Invariants:
 * - maxSessions >= 1
 * - idleTimeout >= 5 minutes
 */
public record SessionSettings(int maxSessions, Duration idleTimeout) {

    public static final int DEFAULT_MAX_SESSIONS = 1000;
    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofHours(1);
    public static final Duration MIN_IDLE_TIMEOUT = Duration.ofMinutes(5);

    public SessionSettings {
        if (maxSessions < 1) {
            throw new IllegalArgumentException("maxSessions must be >= 1: " + maxSessions);
        }
        idleTimeout = idleTimeout != null ? idleTimeout : DEFAULT_IDLE_TIMEOUT;
        if (idleTimeout.compareTo(MIN_IDLE_TIMEOUT) < 0) {
            throw new IllegalArgumentException("idleTimeout must be at least " + MIN_IDLE_TIMEOUT + ": " + idleTimeout);
        }
    }

    public static SessionSettings defaults() {
        return new SessionSettings(DEFAULT_MAX_SESSIONS, DEFAULT_IDLE_TIMEOUT);
    }
}
