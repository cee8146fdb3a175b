package com.agentic.engine.service;

import com.agentic.core.model.CapabilityDescriptor;
import com.agentic.core.model.CapabilityType;
import com.agentic.core.model.IntentType;
import com.agentic.core.model.Priority;
import com.agentic.core.model.ResourceUsage;
import com.agentic.core.model.SessionContext;
import com.agentic.core.model.TaskStatus;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Single entry point of the orchestrator.
 * Classifies a user instruction, plans it, executes the plan and aggregates the outcome.
 */
public interface OrchestrationService {

    /**
     * Run a request to completion.
     * Never throws: internal faults are reported as a FAILED response.
     *
     * @param request The user request
     * @return The aggregated response
     */
    SubmitResponse submit(SubmitRequest request);

    /**
     * Start a request and return immediately.
     * Progress is observable through {@link #getStatus(String)}.
     *
     * @param request The user request
     * @return The task id and its initial status
     */
    AsyncTaskResponse submitAsync(SubmitRequest request);

    /**
     * Get the status of a submitted task. Repeated reads of a terminal task are identical.
     *
     * @param taskId The task id returned on submission
     * @return The task status
     * @throws com.agentic.core.exception.NotFoundException if the task is unknown
     */
    TaskStatusView getStatus(String taskId);

    /**
     * Cancel a running task.
     *
     * @param taskId The task id
     * @return true if the task was running and is now cancelled
     */
    boolean cancel(String taskId);

    /**
     * List registered capabilities, one entry per capability type.
     */
    List<CapabilityView> listCapabilities();

    /**
     * Get a session with its conversation history.
     *
     * @param sessionId The session id
     * @return The session context
     * @throws com.agentic.core.exception.NotFoundException if the session is unknown
     */
    SessionContext getSession(String sessionId);

    /**
     * A user instruction with the context it runs in.
     * Optional fields fall back to the orchestrator defaults when null.
     */
    record SubmitRequest(
        String message,
        String sessionId,
        String userId,
        String projectId,
        String workspacePath,
        Priority priority,
        Duration timeout,
        Integer maxRetries,
        Map<String, Object> parameters
    ) {
        public static SubmitRequest of(String message, String sessionId) {
            return new SubmitRequest(message, sessionId, null, null, null, null, null, null, Map.of());
        }
    }

    /**
     * Result of a synchronous submission.
     */
    record SubmitResponse(
        String sessionId,
        OrchestrationOutcome response,
        Duration processingTime,
        String taskId,
        double confidence,
        Instant timestamp
    ) {}

    /**
     * Aggregated outcome of one plan.
     */
    record OrchestrationOutcome(
        TaskStatus status,
        IntentType intent,
        String planId,
        JsonNode result,
        String error,
        String errorCode,
        Duration executionTime,
        ResourceUsage usage,
        int stepCount
    ) {}

    /**
     * Acknowledgement of an asynchronous submission.
     */
    record AsyncTaskResponse(
        String taskId,
        TaskStatus status,
        Duration estimatedDuration,
        String message
    ) {}

    /**
     * Point-in-time view of a task.
     */
    record TaskStatusView(
        String taskId,
        TaskStatus status,
        double progress,
        JsonNode result,
        String error,
        Instant createdAt,
        Instant updatedAt
    ) {}

    /**
     * Registered capabilities of one type.
     */
    record CapabilityView(
        CapabilityType type,
        List<CapabilityDescriptor> capabilities
    ) {}
}
