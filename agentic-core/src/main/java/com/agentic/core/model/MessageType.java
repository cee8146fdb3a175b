package com.agentic.core.model;

/**
 * Kinds of messages recorded in a session's conversation history.
 */
public enum MessageType {
    USER_INPUT,
    AGENT_RESPONSE,
    SYSTEM_NOTIFICATION,
    ERROR,
    STATUS_UPDATE
}
