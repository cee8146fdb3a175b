package com.agentic.engine.test;

import com.agentic.core.model.CapabilityType;
import com.agentic.core.model.ExecutionContext;
import com.agentic.core.model.ExecutionStep;
import com.agentic.core.model.IntentType;
import com.agentic.core.model.Priority;
import com.agentic.core.model.TaskRequest;

import java.time.Duration;
import java.util.List;

/**
 * Builders for requests and steps used across engine tests.
 */
public final class TestRequests {

    public static final String SESSION_ID = "session-1";

    private TestRequests() {
    }

    public static ExecutionContext context() {
        return ExecutionContext.builder()
            .sessionId(SESSION_ID)
            .userId("user-1")
            .projectId("project-1")
            .workspacePath("/tmp/workspace")
            .build();
    }

    public static TaskRequest request(IntentType intent, String description) {
        return TaskRequest.builder()
            .intent(intent)
            .description(description)
            .context(context())
            .build();
    }

    public static TaskRequest.Builder requestBuilder(String description) {
        return TaskRequest.builder()
            .intent(IntentType.CODE_GENERATION)
            .description(description)
            .context(context())
            .priority(Priority.MEDIUM)
            .timeout(Duration.ofSeconds(5))
            .maxRetries(3);
    }

    public static ExecutionStep step(String id, CapabilityType type, String... dependencies) {
        return step(id, type, requestBuilder(id).build(), dependencies);
    }

    public static ExecutionStep step(String id, CapabilityType type, TaskRequest request, String... dependencies) {
        return ExecutionStep.builder()
            .id(id)
            .name(id)
            .capabilityType(type)
            .request(request)
            .dependencies(List.of(dependencies))
            .build();
    }
}
