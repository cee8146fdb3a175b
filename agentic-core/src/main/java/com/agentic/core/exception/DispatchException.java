package com.agentic.core.exception;

import com.agentic.core.model.CapabilityType;

/**
 * Thrown when no registered worker can handle a step at schedule time.
 * Fatal for that step.
 */
public class DispatchException extends AgenticException {
    
    public static final String ERROR_CODE = "DISPATCH_ERROR";
    
    public DispatchException(String stepId, CapabilityType capabilityType) {
        super(ERROR_CODE, String.format(
            "No capable worker for step %s (capability %s)",
            stepId, capabilityType
        ));
    }
}
