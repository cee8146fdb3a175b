package com.agentic.core.repository;

import com.agentic.core.model.ConversationMessage;
import com.agentic.core.model.SessionContext;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Store for per-session conversational state.
 *
 * Implementations serialize writes per session: concurrent updates to the same
 * session never lose each other's changes.
 */
public interface SessionContextStore extends AutoCloseable {

    /**
     * Prepare the store for use. Must be called before any other operation.
     */
    void initialize();

    /**
     * Load an existing session or create it.
     *
     * @param sessionId The session ID
     * @param userId Owner recorded when the session is created
     * @param projectId Project recorded when the session is created
     * @return The current session context
     */
    SessionContext load(String sessionId, String userId, String projectId);

    /**
     * Find a session without creating it.
     */
    Optional<SessionContext> find(String sessionId);

    void save(SessionContext session);

    /**
     * Append a message to a session's history.
     *
     * @throws com.agentic.core.exception.NotFoundException if the session does not exist
     */
    SessionContext appendMessage(String sessionId, ConversationMessage message);

    /**
     * Apply a read-modify-write change atomically for one session.
     *
     * @throws com.agentic.core.exception.NotFoundException if the session does not exist
     */
    SessionContext update(String sessionId, UnaryOperator<SessionContext> change);

    int activeSessionCount();

    /**
     * Release resources. The store rejects operations afterwards.
     */
    @Override
    void close();
}
