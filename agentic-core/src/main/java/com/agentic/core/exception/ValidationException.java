package com.agentic.core.exception;

/**
 * Thrown when a request or its execution context is malformed.
 * Raised before planning; never retried.
 */
public class ValidationException extends AgenticException {
    
    public static final String ERROR_CODE = "VALIDATION_ERROR";
    
    private final String field;
    
    public ValidationException(String message) {
        super(ERROR_CODE, message);
        this.field = null;
    }
    
    public ValidationException(String field, String reason) {
        super(ERROR_CODE, String.format("Invalid request: %s - %s", field, reason));
        this.field = field;
    }
    
    public String getField() {
        return field;
    }
}
