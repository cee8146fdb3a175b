package com.agentic.core.exception;

/**
 * Failure reported by a worker.
 * Retryable by default; use {@link #permanent} for failures a retry cannot fix.
 */
public class WorkerException extends AgenticException {
    
    public static final String ERROR_CODE = "WORKER_ERROR";
    
    public WorkerException(String message) {
        super(ERROR_CODE, message, true);
    }
    
    public WorkerException(String errorCode, String message, boolean retryable) {
        super(errorCode, message, retryable);
    }
    
    public WorkerException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause, true);
    }
    
    public WorkerException(String errorCode, String message, Throwable cause, boolean retryable) {
        super(errorCode, message, cause, retryable);
    }
    
    /**
     * Create a non-retryable exception (permanent failure).
     */
    public static WorkerException permanent(String errorCode, String message) {
        return new WorkerException(errorCode, message, false);
    }
    
    /**
     * Create a retryable exception (transient failure).
     */
    public static WorkerException transientFailure(String message) {
        return new WorkerException(ERROR_CODE, message, true);
    }
}
