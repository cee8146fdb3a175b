package com.agentic.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Where and on whose behalf a task runs.
 * Shared by every step decomposed from the same request.
 */
public record ExecutionContext(
    String sessionId,
    String userId,
    String projectId,
    String workspacePath,
    String environment,
    String language,
    String framework,
    Map<String, Object> metadata
) {
    public static final String DEFAULT_ENVIRONMENT = "development";

    public ExecutionContext {
        workspacePath = workspacePath != null ? workspacePath.trim() : null;
        environment = environment != null ? environment : DEFAULT_ENVIRONMENT;
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public static ExecutionContext of(String sessionId, String userId, String projectId, String workspacePath) {
        return new ExecutionContext(sessionId, userId, projectId, workspacePath, null, null, null, Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String sessionId;
        private String userId = "default_user";
        private String projectId = "default_project";
        private String workspacePath = "/tmp/workspace";
        private String environment = DEFAULT_ENVIRONMENT;
        private String language;
        private String framework;
        private Map<String, Object> metadata = Map.of();

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder workspacePath(String workspacePath) {
            this.workspacePath = workspacePath;
            return this;
        }

        public Builder environment(String environment) {
            this.environment = environment;
            return this;
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public Builder framework(String framework) {
            this.framework = framework;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public ExecutionContext build() {
            return new ExecutionContext(
                sessionId, userId, projectId, workspacePath,
                environment, language, framework, metadata
            );
        }
    }
}
