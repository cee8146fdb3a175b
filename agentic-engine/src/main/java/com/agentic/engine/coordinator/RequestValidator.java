package com.agentic.engine.coordinator;

import com.agentic.core.exception.ValidationException;
import com.agentic.core.model.ExecutionContext;
import com.agentic.core.model.TaskRequest;

/**
 * Rejects malformed requests before any planning happens.
 */
public class RequestValidator {

    static final int MAX_DESCRIPTION_LENGTH = 10_000;

    public void validate(TaskRequest request) {
        if (request == null) {
            throw new ValidationException("request", "cannot be null");
        }
        if (request.description() == null || request.description().isEmpty()) {
            throw new ValidationException("message", "cannot be empty");
        }
        if (request.description().length() > MAX_DESCRIPTION_LENGTH) {
            throw new ValidationException("message", "exceeds " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        if (request.intent() == null) {
            throw new ValidationException("intent", "cannot be null");
        }
        if (request.priority() == null) {
            throw new ValidationException("priority", "cannot be null");
        }
        if (request.timeout() == null
                || request.timeout().compareTo(TaskRequest.MIN_TIMEOUT) < 0
                || request.timeout().compareTo(TaskRequest.MAX_TIMEOUT) > 0) {
            throw new ValidationException("timeout", String.format("must be between %ds and %ds",
                TaskRequest.MIN_TIMEOUT.toSeconds(), TaskRequest.MAX_TIMEOUT.toSeconds()));
        }
        if (request.maxRetries() < 0 || request.maxRetries() > TaskRequest.MAX_RETRIES_LIMIT) {
            throw new ValidationException("maxRetries", "must be between 0 and " + TaskRequest.MAX_RETRIES_LIMIT);
        }
        validateContext(request.context());
    }

    private void validateContext(ExecutionContext context) {
        if (context == null) {
            throw new ValidationException("context", "cannot be null");
        }
        if (context.sessionId() == null || context.sessionId().isBlank()) {
            throw new ValidationException("sessionId", "cannot be empty");
        }
        if (context.workspacePath() == null || context.workspacePath().isEmpty()) {
            throw new ValidationException("workspacePath", "cannot be empty");
        }
    }
}
