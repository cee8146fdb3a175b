package com.agentic.core.exception;

/**
 * Raised for caller-initiated cancellation. Terminal, never retried.
 */
public class TaskCancelledException extends AgenticException {
    
    public static final String ERROR_CODE = "CANCELLED";
    
    public TaskCancelledException(String planId, String reason) {
        super(ERROR_CODE, String.format(
            "Plan %s cancelled: %s",
            planId, reason
        ));
    }
}
