package com.agentic.engine.persistence;

import com.agentic.core.exception.NotFoundException;
import com.agentic.core.model.ConversationMessage;
import com.agentic.core.model.SessionContext;
import com.agentic.core.repository.SessionContextStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of SessionContextStore.
 * Every write goes through {@link ConcurrentHashMap#compute}, which serializes
 * changes per session while leaving other sessions uncontended.
 *
 * Sessions idle for longer than {@link SessionSettings#idleTimeout()} are dropped on
 * {@link #load} and {@link #find}. Creating a session at {@link SessionSettings#maxSessions()}
 * first evicts the least recently active one.
 */
@Repository
public class InMemorySessionContextStore implements SessionContextStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySessionContextStore.class);

    private final Map<String, SessionContext> sessions = new ConcurrentHashMap<>();
    private final Object admission = new Object();
    private final SessionSettings settings;
    private final Clock clock;
    private volatile boolean initialized;
    private volatile boolean closed;

    public InMemorySessionContextStore() {
        this(SessionSettings.defaults());
    }

    @Autowired
    public InMemorySessionContextStore(SessionSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public InMemorySessionContextStore(SessionSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public void initialize() {
        if (closed) {
            throw new IllegalStateException("Session store is closed");
        }
        initialized = true;
        log.info("Session store initialized (max {} sessions, idle timeout {})",
            settings.maxSessions(), settings.idleTimeout());
    }

    @Override
    public SessionContext load(String sessionId, String userId, String projectId) {
        requireOpen();
        evictExpired();
        SessionContext existing = sessions.get(sessionId);
        if (existing != null) {
            return existing;
        }
        synchronized (admission) {
            existing = sessions.get(sessionId);
            if (existing != null) {
                return existing;
            }
            makeRoom();
            log.debug("Creating session {}", sessionId);
            SessionContext created = SessionContext.create(sessionId, userId, projectId);
            sessions.put(sessionId, created);
            return created;
        }
    }

    @Override
    public Optional<SessionContext> find(String sessionId) {
        requireOpen();
        SessionContext session = sessions.get(sessionId);
        if (session != null && isExpired(session)) {
            if (sessions.remove(sessionId, session)) {
                log.info("Session {} expired after {} idle", sessionId, settings.idleTimeout());
            }
            return Optional.empty();
        }
        return Optional.ofNullable(session);
    }

    @Override
    public void save(SessionContext session) {
        requireOpen();
        if (sessions.containsKey(session.sessionId())) {
            sessions.put(session.sessionId(), session);
            return;
        }
        synchronized (admission) {
            if (!sessions.containsKey(session.sessionId())) {
                makeRoom();
            }
            sessions.put(session.sessionId(), session);
        }
    }

    @Override
    public SessionContext appendMessage(String sessionId, ConversationMessage message) {
        return update(sessionId, session -> session.withMessage(message));
    }

    @Override
    public SessionContext update(String sessionId, UnaryOperator<SessionContext> change) {
        requireOpen();
        SessionContext updated = sessions.computeIfPresent(sessionId, (id, current) -> change.apply(current));
        if (updated == null) {
            throw new NotFoundException("Session", sessionId);
        }
        return updated;
    }

    @Override
    public int activeSessionCount() {
        return sessions.size();
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            log.info("Session store closed with {} session(s)", sessions.size());
        }
    }

    // ========== Eviction ==========

    private void evictExpired() {
        int before = sessions.size();
        sessions.values().removeIf(this::isExpired);
        int evicted = before - sessions.size();
        if (evicted > 0) {
            log.info("Evicted {} idle session(s)", evicted);
        }
    }

    // Caller holds the admission lock
    private void makeRoom() {
        while (sessions.size() >= settings.maxSessions()) {
            Optional<SessionContext> oldest = sessions.values().stream()
                .min(Comparator.comparing(SessionContext::lastActivity));
            if (oldest.isEmpty()) {
                return;
            }
            sessions.remove(oldest.get().sessionId());
            log.info("Session limit {} reached, evicted least recently active session {}",
                settings.maxSessions(), oldest.get().sessionId());
        }
    }

    private boolean isExpired(SessionContext session) {
        return session.lastActivity().plus(settings.idleTimeout()).isBefore(clock.instant());
    }

    private void requireOpen() {
        if (!initialized) {
            throw new IllegalStateException("Session store is not initialized");
        }
        if (closed) {
            throw new IllegalStateException("Session store is closed");
        }
    }
}
