package com.agentic.core.exception;

/**
 * Thrown when a task, plan or session is not found.
 */
public class NotFoundException extends AgenticException {
    
    public static final String ERROR_CODE = "NOT_FOUND";
    
    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
