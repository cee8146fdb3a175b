package com.agentic.core.model;

/**
 * Lifecycle states shared by execution steps, plans and task results.
 */
public enum TaskStatus {
    /**
     * Waiting to be scheduled (or waiting for a retry).
     * Transitions: -> IN_PROGRESS, CANCELLED, FAILED
     */
    PENDING,

    /**
     * Dispatched to a worker.
     * Transitions: -> COMPLETED, FAILED, CANCELLED, PENDING (retry)
     */
    IN_PROGRESS,

    /**
     * Finished successfully. Terminal state.
     */
    COMPLETED,

    /**
     * Failed with retries exhausted or a fatal error. Terminal state.
     */
    FAILED,

    /**
     * Cancelled by the caller or made unreachable by a failed dependency. Terminal state.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean isActive() {
        return this == IN_PROGRESS;
    }

    /**
     * Check if this state can transition to the target state.
     */
    public boolean canTransitionTo(TaskStatus target) {
        return switch (this) {
            case PENDING -> target == IN_PROGRESS || target == CANCELLED || target == FAILED;
            case IN_PROGRESS -> target == COMPLETED || target == FAILED
                || target == CANCELLED || target == PENDING;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
