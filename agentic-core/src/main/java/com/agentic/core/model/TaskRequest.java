package com.agentic.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A unit of work to be executed by a worker.
 *
 * Invariants (checked by the request validator before planning):
 * - description is non-empty after trim
 * - timeout in [1s, 3600s]
 * - maxRetries in [0, 10]
 * - context is present with a non-blank workspace path
 */
public record TaskRequest(
    String id,
    IntentType intent,
    String description,
    ExecutionContext context,
    Map<String, Object> parameters,
    Priority priority,
    Duration timeout,
    int maxRetries,
    String parentTaskId,
    Instant createdAt
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(300);
    public static final Duration MIN_TIMEOUT = Duration.ofSeconds(1);
    public static final Duration MAX_TIMEOUT = Duration.ofSeconds(3600);
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int MAX_RETRIES_LIMIT = 10;

    public TaskRequest {
        description = description != null ? description.trim() : null;
        parameters = parameters != null ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
    }

    /**
     * Derive a child request for one step of a decomposed plan.
     * The child shares context, priority, timeout and retry budget with this request.
     */
    public TaskRequest narrow(IntentType childIntent, String childDescription) {
        return toBuilder()
            .id(UUID.randomUUID().toString())
            .intent(childIntent)
            .description(childDescription)
            .parentTaskId(id)
            .createdAt(Instant.now())
            .build();
    }

    @JsonIgnore
    public boolean isSubtask() {
        return parentTaskId != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .intent(intent)
            .description(description)
            .context(context)
            .parameters(parameters)
            .priority(priority)
            .timeout(timeout)
            .maxRetries(maxRetries)
            .parentTaskId(parentTaskId)
            .createdAt(createdAt);
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private IntentType intent = IntentType.CODE_GENERATION;
        private String description;
        private ExecutionContext context;
        private Map<String, Object> parameters = Map.of();
        private Priority priority = Priority.MEDIUM;
        private Duration timeout = DEFAULT_TIMEOUT;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private String parentTaskId;
        private Instant createdAt = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder intent(IntentType intent) {
            this.intent = intent;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder context(ExecutionContext context) {
            this.context = context;
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder parentTaskId(String parentTaskId) {
            this.parentTaskId = parentTaskId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public TaskRequest build() {
            return new TaskRequest(
                id, intent, description, context, parameters,
                priority, timeout, maxRetries, parentTaskId, createdAt
            );
        }
    }
}
