package com.agentic.core.exception;

import java.time.Duration;

/**
 * Thrown when a dispatch exceeds its request timeout.
 * Retryable, sharing the retry budget with worker failures.
 */
public class StepTimeoutException extends AgenticException {
    
    public static final String ERROR_CODE = "TIMEOUT_ERROR";
    
    private final Duration timeout;
    
    public StepTimeoutException(String stepId, Duration timeout) {
        super(ERROR_CODE, String.format(
            "Step %s timed out after %dms",
            stepId, timeout.toMillis()
        ), true);
        this.timeout = timeout;
    }
    
    public Duration getTimeout() {
        return timeout;
    }
}
