package com.agentic.core.exception;

/**
 * Thrown when a request cannot be turned into an executable plan:
 * a capability gap, a dependency cycle or a dangling dependency reference.
 * Fatal, never retried.
 */
public class PlanningException extends AgenticException {
    
    public static final String ERROR_CODE = "PLANNING_ERROR";
    
    private final String fromStepId;
    private final String toStepId;
    
    public PlanningException(String message) {
        super(ERROR_CODE, message);
        this.fromStepId = null;
        this.toStepId = null;
    }
    
    public PlanningException(String fromStepId, String toStepId, String reason) {
        super(ERROR_CODE, String.format(
            "Invalid dependency edge %s -> %s: %s",
            fromStepId, toStepId, reason
        ));
        this.fromStepId = fromStepId;
        this.toStepId = toStepId;
    }
    
    /**
     * The dependent step of the offending edge, if the error concerns an edge.
     */
    public String getFromStepId() {
        return fromStepId;
    }
    
    /**
     * The dependency of the offending edge, if the error concerns an edge.
     */
    public String getToStepId() {
        return toStepId;
    }
}
