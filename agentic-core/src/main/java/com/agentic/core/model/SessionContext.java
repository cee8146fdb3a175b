package com.agentic.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-session state owned by the session store.
 * Immutable; the store replaces the whole value on every change.
 */
public record SessionContext(
    String sessionId,
    String userId,
    String projectId,
    Instant createdAt,
    Instant lastActivity,
    int messageCount,
    Set<CapabilityType> activeCapabilities,
    Map<String, Object> contextData,
    List<ConversationMessage> conversationHistory
) {
    public SessionContext {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        activeCapabilities = activeCapabilities != null
            ? Collections.unmodifiableSet(new LinkedHashSet<>(activeCapabilities)) : Set.of();
        contextData = contextData != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(contextData)) : Map.of();
        conversationHistory = conversationHistory != null ? List.copyOf(conversationHistory) : List.of();
    }

    public static SessionContext create(String sessionId, String userId, String projectId) {
        Instant now = Instant.now();
        return new SessionContext(sessionId, userId, projectId, now, now, 0, Set.of(), Map.of(), List.of());
    }

    /**
     * Record one more interaction: bumps the message counter and the activity timestamp.
     */
    public SessionContext withActivity() {
        return new SessionContext(
            sessionId, userId, projectId, createdAt, Instant.now(), messageCount + 1,
            activeCapabilities, contextData, conversationHistory
        );
    }

    public SessionContext withMessage(ConversationMessage message) {
        List<ConversationMessage> history = new ArrayList<>(conversationHistory);
        history.add(message);
        return new SessionContext(
            sessionId, userId, projectId, createdAt, Instant.now(), messageCount,
            activeCapabilities, contextData, history
        );
    }

    public SessionContext withActiveCapabilities(Set<CapabilityType> capabilities) {
        return new SessionContext(
            sessionId, userId, projectId, createdAt, lastActivity, messageCount,
            capabilities, contextData, conversationHistory
        );
    }

    public SessionContext withContextData(String key, Object value) {
        Map<String, Object> data = new LinkedHashMap<>(contextData);
        data.put(key, value);
        return new SessionContext(
            sessionId, userId, projectId, createdAt, lastActivity, messageCount,
            activeCapabilities, data, conversationHistory
        );
    }

    /**
     * The last {@code limit} messages in chronological order.
     */
    public List<ConversationMessage> recentMessages(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        int from = Math.max(0, conversationHistory.size() - limit);
        return conversationHistory.subList(from, conversationHistory.size());
    }
}
