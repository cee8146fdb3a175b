package com.agentic.core.model;

import com.agentic.core.exception.InvalidStateTransitionException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of executing one task.
 * Created PENDING, transitioned exactly once to COMPLETED or FAILED,
 * immutable afterwards except for metadata.
 *
 * Invariants:
 * - executionTime >= 0
 * - confidence in [0.0, 1.0]
 * - result set only when COMPLETED, error set only when FAILED or CANCELLED
 */
public record TaskResult(
    String taskId,
    CapabilityType capabilityType,
    TaskStatus status,
    JsonNode result,
    String error,
    String errorCode,
    Duration executionTime,
    ResourceUsage usage,
    double confidence,
    Map<String, String> metadata,
    Instant createdAt,
    Instant completedAt
) {
    public TaskResult {
        if (executionTime == null) {
            executionTime = Duration.ZERO;
        }
        if (executionTime.isNegative()) {
            throw new IllegalArgumentException("Execution time cannot be negative");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be in [0, 1]: " + confidence);
        }
        usage = usage != null ? usage : ResourceUsage.none();
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    /**
     * Create a result in PENDING state, as recorded at submission.
     */
    public static TaskResult pending(String taskId, CapabilityType capabilityType) {
        return new TaskResult(
            taskId, capabilityType, TaskStatus.PENDING,
            null, null, null, Duration.ZERO, ResourceUsage.none(), 1.0,
            Map.of(), Instant.now(), null
        );
    }

    /**
     * Convenience for workers: a completed result in one step.
     */
    public static TaskResult success(String taskId, CapabilityType capabilityType, JsonNode payload,
                                     Duration executionTime, ResourceUsage usage, double confidence) {
        return new TaskResult(
            taskId, capabilityType, TaskStatus.COMPLETED,
            payload, null, null, executionTime, usage, confidence,
            Map.of(), Instant.now(), Instant.now()
        );
    }

    /**
     * Convenience for workers and the engine: a failed result in one step.
     */
    public static TaskResult failure(String taskId, CapabilityType capabilityType,
                                     String errorCode, String error, Duration executionTime) {
        return new TaskResult(
            taskId, capabilityType, TaskStatus.FAILED,
            null, error, errorCode, executionTime, ResourceUsage.none(), 0.0,
            Map.of(), Instant.now(), Instant.now()
        );
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return status == TaskStatus.COMPLETED;
    }

    /**
     * Create a copy completed with the given payload.
     */
    public TaskResult withCompleted(JsonNode payload, Duration elapsed, ResourceUsage resourceUsage, double score) {
        requireTransition(TaskStatus.COMPLETED);
        return new TaskResult(
            taskId, capabilityType, TaskStatus.COMPLETED,
            payload, null, null, elapsed, resourceUsage, score,
            metadata, createdAt, Instant.now()
        );
    }

    /**
     * Create a copy failed with the given error.
     */
    public TaskResult withFailed(String code, String message, Duration elapsed) {
        requireTransition(TaskStatus.FAILED);
        return new TaskResult(
            taskId, capabilityType, TaskStatus.FAILED,
            null, message, code, elapsed, usage, 0.0,
            metadata, createdAt, Instant.now()
        );
    }

    /**
     * Create a copy cancelled before any outcome was recorded.
     */
    public TaskResult withCancelled(String reason) {
        requireTransition(TaskStatus.CANCELLED);
        return new TaskResult(
            taskId, capabilityType, TaskStatus.CANCELLED,
            null, reason, "CANCELLED", executionTime, usage, 0.0,
            metadata, createdAt, Instant.now()
        );
    }

    /**
     * Attach non-semantic metadata. Legal in any state.
     */
    public TaskResult withMetadata(String key, String value) {
        Map<String, String> updated = new LinkedHashMap<>(metadata);
        updated.put(key, value);
        return new TaskResult(
            taskId, capabilityType, status, result, error, errorCode,
            executionTime, usage, confidence, updated, createdAt, completedAt
        );
    }

    private void requireTransition(TaskStatus target) {
        // Results skip IN_PROGRESS: PENDING goes straight to its outcome.
        if (status != TaskStatus.PENDING) {
            throw new InvalidStateTransitionException("TaskResult", status, target);
        }
    }
}
