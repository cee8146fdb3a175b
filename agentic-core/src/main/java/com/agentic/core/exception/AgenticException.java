package com.agentic.core.exception;

/**
 * Base exception for all orchestration errors.
 * Carries a stable error code and whether the engine may retry the failed operation.
 */
public class AgenticException extends RuntimeException {
    
    private final String errorCode;
    private final boolean retryable;
    
    public AgenticException(String errorCode, String message) {
        this(errorCode, message, false);
    }
    
    public AgenticException(String errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }
    
    public AgenticException(String errorCode, String message, Throwable cause) {
        this(errorCode, message, cause, false);
    }
    
    public AgenticException(String errorCode, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
    
    public boolean isRetryable() {
        return retryable;
    }
}
