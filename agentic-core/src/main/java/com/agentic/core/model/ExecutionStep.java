package com.agentic.core.model;

import com.agentic.core.exception.InvalidStateTransitionException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * One unit of execution within a plan, bound to exactly one capability type.
 * Immutable: every state change produces a copy, written only by the execution engine.
 *
 * Invariants:
 * - 0 <= retryCount <= maxRetries
 * - dependencies holds no duplicates and never the step's own id
 * - status transitions follow {@link TaskStatus#canTransitionTo}
 */
public record ExecutionStep(
    // Identity
    String id,
    String name,
    CapabilityType capabilityType,
    TaskRequest request,

    // Graph
    List<String> dependencies,
    boolean mandatory,

    // State
    TaskStatus status,
    int retryCount,
    int maxRetries,
    Duration estimatedDuration,

    // Outcome
    TaskResult result,
    String lastError,

    // Timing
    Instant startedAt,
    Instant completedAt
) {
    public ExecutionStep {
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        estimatedDuration = estimatedDuration != null ? estimatedDuration : CapabilityDescriptor.DEFAULT_ESTIMATE;
        if (retryCount < 0 || retryCount > maxRetries) {
            throw new IllegalArgumentException(
                "retryCount must be in [0, " + maxRetries + "]: " + retryCount);
        }
    }

    /**
     * A step is ready iff it is PENDING and every dependency has completed.
     */
    public boolean isReady(Set<String> completedStepIds) {
        return status == TaskStatus.PENDING && completedStepIds.containsAll(dependencies);
    }

    public boolean dependsOn(String stepId) {
        return dependencies.contains(stepId);
    }

    @JsonIgnore
    public boolean hasRetriesLeft() {
        return retryCount < maxRetries;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Create a copy dispatched to a worker, carrying a PENDING result for this attempt.
     */
    public ExecutionStep withStarted() {
        requireTransition(TaskStatus.IN_PROGRESS);
        return new ExecutionStep(
            id, name, capabilityType, request, dependencies, mandatory,
            TaskStatus.IN_PROGRESS, retryCount, maxRetries, estimatedDuration,
            TaskResult.pending(request.id(), capabilityType), lastError, Instant.now(), null
        );
    }

    /**
     * Create a copy completed with the worker's result.
     */
    public ExecutionStep withCompleted(TaskResult taskResult) {
        requireTransition(TaskStatus.COMPLETED);
        return new ExecutionStep(
            id, name, capabilityType, request, dependencies, mandatory,
            TaskStatus.COMPLETED, retryCount, maxRetries, estimatedDuration,
            taskResult, null, startedAt, Instant.now()
        );
    }

    /**
     * Create a copy returned to PENDING for another attempt, consuming one retry.
     * The failed attempt's result is kept until the next dispatch.
     */
    public ExecutionStep withRetry(TaskResult failedAttempt) {
        requireTransition(TaskStatus.PENDING);
        if (!hasRetriesLeft()) {
            throw new IllegalStateException("Step " + id + " has no retries left");
        }
        return new ExecutionStep(
            id, name, capabilityType, request, dependencies, mandatory,
            TaskStatus.PENDING, retryCount + 1, maxRetries, estimatedDuration,
            failedAttempt, failedAttempt.error(), null, null
        );
    }

    /**
     * Create a copy terminally failed.
     */
    public ExecutionStep withFailed(TaskResult taskResult) {
        requireTransition(TaskStatus.FAILED);
        return new ExecutionStep(
            id, name, capabilityType, request, dependencies, mandatory,
            TaskStatus.FAILED, retryCount, maxRetries, estimatedDuration,
            taskResult, taskResult.error(), startedAt, Instant.now()
        );
    }

    /**
     * Create a copy cancelled, either by the caller or because a dependency failed.
     */
    public ExecutionStep withCancelled(String reason) {
        requireTransition(TaskStatus.CANCELLED);
        TaskResult outcome = result != null && result.status() == TaskStatus.PENDING
            ? result.withCancelled(reason)
            : result;
        return new ExecutionStep(
            id, name, capabilityType, request, dependencies, mandatory,
            TaskStatus.CANCELLED, retryCount, maxRetries, estimatedDuration,
            outcome, reason, startedAt, Instant.now()
        );
    }

    private void requireTransition(TaskStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException("ExecutionStep " + id, status, target);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private String name;
        private CapabilityType capabilityType;
        private TaskRequest request;
        private List<String> dependencies = List.of();
        private boolean mandatory = true;
        private Duration estimatedDuration = CapabilityDescriptor.DEFAULT_ESTIMATE;
        private Integer maxRetries;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder capabilityType(CapabilityType capabilityType) {
            this.capabilityType = capabilityType;
            return this;
        }

        public Builder request(TaskRequest request) {
            this.request = request;
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            this.dependencies = dependencies;
            return this;
        }

        public Builder mandatory(boolean mandatory) {
            this.mandatory = mandatory;
            return this;
        }

        public Builder estimatedDuration(Duration estimatedDuration) {
            this.estimatedDuration = estimatedDuration;
            return this;
        }

        /**
         * Override the retry budget; defaults to the embedded request's.
         */
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public ExecutionStep build() {
            int budget = maxRetries != null ? maxRetries : (request != null ? request.maxRetries() : 0);
            return new ExecutionStep(
                id, name != null ? name : capabilityType.value(), capabilityType, request,
                dependencies, mandatory, TaskStatus.PENDING, 0, budget, estimatedDuration,
                null, null, null, null
            );
        }
    }
}
