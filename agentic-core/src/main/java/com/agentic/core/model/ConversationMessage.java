package com.agentic.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * One entry in a session's conversation history.
 */
public record ConversationMessage(
    String id,
    MessageType type,
    String content,
    JsonNode payload,
    String sessionId,
    CapabilityType capabilityType,
    Priority priority,
    Instant timestamp
) {
    public ConversationMessage {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Message content must not be blank");
        }
        id = id != null ? id : UUID.randomUUID().toString();
        priority = priority != null ? priority : Priority.MEDIUM;
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static ConversationMessage userInput(String sessionId, String content) {
        return new ConversationMessage(null, MessageType.USER_INPUT, content, null, sessionId, null, null, null);
    }

    public static ConversationMessage agentResponse(String sessionId, String content, JsonNode payload) {
        return new ConversationMessage(null, MessageType.AGENT_RESPONSE, content, payload, sessionId, null, null, null);
    }

    public static ConversationMessage error(String sessionId, String content) {
        return new ConversationMessage(null, MessageType.ERROR, content, null, sessionId, null, Priority.HIGH, null);
    }
}
