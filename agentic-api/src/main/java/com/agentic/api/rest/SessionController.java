package com.agentic.api.rest;

import com.agentic.core.model.CapabilityType;
import com.agentic.core.model.ConversationMessage;
import com.agentic.core.model.MessageType;
import com.agentic.core.model.SessionContext;
import com.agentic.engine.service.OrchestrationService;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * REST API for session state and conversation history.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private final OrchestrationService orchestrationService;

    public SessionController(OrchestrationService orchestrationService) {
        this.orchestrationService = orchestrationService;
    }

    /**
     * Get a session with its most recent messages.
     */
    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionResponse> getSession(
            @PathVariable String sessionId,
            @RequestParam(defaultValue = "50") int limit) {

        SessionContext session = orchestrationService.getSession(sessionId);
        return ResponseEntity.ok(SessionResponse.from(session, limit));
    }

    // ========== DTOs ==========

    public record SessionResponse(
        String sessionId,
        String userId,
        String projectId,
        Instant createdAt,
        Instant lastActivity,
        int messageCount,
        Set<CapabilityType> activeCapabilities,
        List<MessageResponse> messages
    ) {
        public static SessionResponse from(SessionContext session, int limit) {
            return new SessionResponse(
                session.sessionId(),
                session.userId(),
                session.projectId(),
                session.createdAt(),
                session.lastActivity(),
                session.messageCount(),
                session.activeCapabilities(),
                session.recentMessages(limit).stream().map(MessageResponse::from).toList()
            );
        }
    }

    public record MessageResponse(
        String id,
        MessageType type,
        String content,
        JsonNode payload,
        CapabilityType capabilityType,
        Instant timestamp
    ) {
        public static MessageResponse from(ConversationMessage message) {
            return new MessageResponse(
                message.id(),
                message.type(),
                message.content(),
                message.payload(),
                message.capabilityType(),
                message.timestamp()
            );
        }
    }
}
