package com.agentic.core.model;

import com.agentic.core.exception.InvalidStateTransitionException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * A dependency graph of steps derived from one task request.
 * Immutable snapshot; the engine publishes a new snapshot on every transition.
 *
 * Invariants:
 * - step ids are unique and every dependency references a step of this plan
 * - the dependency relation is acyclic
 * - estimatedDuration is the critical-path sum, not the flat sum
 */
public record ExecutionPlan(
    String id,
    TaskRequest originalRequest,
    List<ExecutionStep> steps,
    Duration estimatedDuration,
    TaskStatus status,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt
) {
    public ExecutionPlan {
        steps = steps != null ? List.copyOf(steps) : List.of();
    }

    public static ExecutionPlan create(TaskRequest originalRequest, List<ExecutionStep> steps, Duration estimatedDuration) {
        return new ExecutionPlan(
            UUID.randomUUID().toString(),
            originalRequest,
            steps,
            estimatedDuration,
            TaskStatus.PENDING,
            Instant.now(),
            null,
            null
        );
    }

    /**
     * Steps that are PENDING with every dependency in the completed set, in plan order.
     */
    public List<ExecutionStep> readySteps(Set<String> completedStepIds) {
        return steps.stream()
            .filter(step -> step.isReady(completedStepIds))
            .collect(Collectors.toList());
    }

    public List<ExecutionStep> readySteps() {
        return readySteps(completedStepIds());
    }

    @JsonIgnore
    public Set<String> completedStepIds() {
        return steps.stream()
            .filter(step -> step.status() == TaskStatus.COMPLETED)
            .map(ExecutionStep::id)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Completed steps as a percentage of all steps, in [0, 100].
     */
    @JsonIgnore
    public double progress() {
        if (steps.isEmpty()) {
            return 0.0;
        }
        long completed = steps.stream()
            .filter(step -> step.status() == TaskStatus.COMPLETED)
            .count();
        return (completed * 100.0) / steps.size();
    }

    public Optional<ExecutionStep> step(String stepId) {
        return steps.stream()
            .filter(step -> step.id().equals(stepId))
            .findFirst();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Wall-clock time between start and completion, zero if either is unknown.
     */
    @JsonIgnore
    public Duration elapsed() {
        if (startedAt == null || completedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, completedAt);
    }

    /**
     * Create a copy with a new status, stamping start and completion times.
     */
    public ExecutionPlan withStatus(TaskStatus newStatus) {
        if (!status.canTransitionTo(newStatus)) {
            throw new InvalidStateTransitionException("ExecutionPlan " + id, status, newStatus);
        }
        Instant now = Instant.now();
        return new ExecutionPlan(
            id, originalRequest, steps, estimatedDuration, newStatus, createdAt,
            newStatus.isActive() && startedAt == null ? now : startedAt,
            newStatus.isTerminal() ? now : completedAt
        );
    }

    /**
     * Create a copy with the given steps, keeping status and timing.
     */
    public ExecutionPlan withSteps(List<ExecutionStep> updatedSteps) {
        return new ExecutionPlan(
            id, originalRequest, updatedSteps, estimatedDuration, status,
            createdAt, startedAt, completedAt
        );
    }
}
