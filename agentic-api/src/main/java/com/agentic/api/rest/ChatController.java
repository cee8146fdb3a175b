package com.agentic.api.rest;

import com.agentic.core.exception.ValidationException;
import com.agentic.core.model.IntentType;
import com.agentic.core.model.Priority;
import com.agentic.core.model.TaskStatus;
import com.agentic.engine.service.OrchestrationService;
import com.agentic.engine.service.OrchestrationService.AsyncTaskResponse;
import com.agentic.engine.service.OrchestrationService.OrchestrationOutcome;
import com.agentic.engine.service.OrchestrationService.SubmitRequest;
import com.agentic.engine.service.OrchestrationService.SubmitResponse;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * REST API for submitting user instructions.
 */
@RestController
@RequestMapping("/api/v1/chat")
public class ChatController {

    private final OrchestrationService orchestrationService;

    public ChatController(OrchestrationService orchestrationService) {
        this.orchestrationService = orchestrationService;
    }

    /**
     * Run an instruction to completion.
     * Requests rejected by validation answer 400; every other outcome answers 200.
     */
    @PostMapping
    public ResponseEntity<ChatResponse> chat(@RequestBody ChatRequest request) {
        SubmitResponse response = orchestrationService.submit(request.toSubmitRequest());
        ChatResponse body = ChatResponse.from(response);

        if (ValidationException.ERROR_CODE.equals(response.response().errorCode())) {
            return ResponseEntity.badRequest().body(body);
        }
        return ResponseEntity.ok(body);
    }

    /**
     * Start an instruction and return its task id.
     */
    @PostMapping("/async")
    public ResponseEntity<AsyncChatResponse> chatAsync(@RequestBody ChatRequest request) {
        AsyncTaskResponse response = orchestrationService.submitAsync(request.toSubmitRequest());
        HttpStatus status = response.status() == TaskStatus.FAILED ? HttpStatus.OK : HttpStatus.ACCEPTED;
        return ResponseEntity.status(status).body(AsyncChatResponse.from(response));
    }

    // ========== DTOs ==========

    public record ChatRequest(
        String message,
        String sessionId,
        String userId,
        String projectId,
        String workspacePath,
        Priority priority,
        Long timeoutSeconds,
        Integer maxRetries,
        Map<String, Object> parameters
    ) {
        SubmitRequest toSubmitRequest() {
            return new SubmitRequest(
                message,
                sessionId,
                userId,
                projectId,
                workspacePath,
                priority,
                timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : null,
                maxRetries,
                parameters != null ? parameters : Map.of()
            );
        }
    }

    public record ChatResponse(
        String sessionId,
        String taskId,
        TaskStatus status,
        IntentType intent,
        String planId,
        JsonNode result,
        String error,
        String errorCode,
        int stepCount,
        long tokensUsed,
        double cost,
        double confidence,
        long processingTimeMs,
        Instant timestamp
    ) {
        public static ChatResponse from(SubmitResponse response) {
            OrchestrationOutcome outcome = response.response();
            return new ChatResponse(
                response.sessionId(),
                response.taskId(),
                outcome.status(),
                outcome.intent(),
                outcome.planId(),
                outcome.result(),
                outcome.error(),
                outcome.errorCode(),
                outcome.stepCount(),
                outcome.usage() != null ? outcome.usage().tokensUsed() : 0,
                outcome.usage() != null ? outcome.usage().cost() : 0.0,
                response.confidence(),
                response.processingTime().toMillis(),
                response.timestamp()
            );
        }
    }

    public record AsyncChatResponse(
        String taskId,
        TaskStatus status,
        long estimatedDurationMs,
        String message
    ) {
        public static AsyncChatResponse from(AsyncTaskResponse response) {
            return new AsyncChatResponse(
                response.taskId(),
                response.status(),
                response.estimatedDuration().toMillis(),
                response.message()
            );
        }
    }
}
