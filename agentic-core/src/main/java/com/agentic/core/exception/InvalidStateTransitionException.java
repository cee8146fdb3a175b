package com.agentic.core.exception;

import com.agentic.core.model.TaskStatus;

/**
 * Thrown when an invalid state transition is attempted.
 */
public class InvalidStateTransitionException extends AgenticException {
    
    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";
    
    public InvalidStateTransitionException(TaskStatus currentStatus, TaskStatus targetStatus) {
        super(ERROR_CODE, String.format(
            "Cannot transition from %s to %s",
            currentStatus, targetStatus
        ));
    }
    
    public InvalidStateTransitionException(String entityType, TaskStatus currentStatus, TaskStatus targetStatus) {
        super(ERROR_CODE, String.format(
            "Cannot transition %s from %s to %s",
            entityType, currentStatus, targetStatus
        ));
    }
}
