package com.agentic.worker;

import com.agentic.core.model.ExecutionContext;
import com.agentic.core.model.ResourceUsage;
import com.agentic.core.model.TaskRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;

/**
 * Context provided to {@link AbstractWorker#perform} during execution.
 * Collects the resource usage and confidence reported by the worker body.
 */
public class WorkerContext {

    private final TaskRequest request;
    private final ObjectMapper objectMapper;

    private ResourceUsage usage = ResourceUsage.none();
    private double confidence = 1.0;

    public WorkerContext(TaskRequest request, ObjectMapper objectMapper) {
        this.request = request;
        this.objectMapper = objectMapper;
    }

    /**
     * Get the request being executed.
     */
    public TaskRequest getRequest() {
        return request;
    }

    public String getTaskId() {
        return request.id();
    }

    public String getDescription() {
        return request.description();
    }

    public ExecutionContext getExecutionContext() {
        return request.context();
    }

    public Map<String, Object> getParameters() {
        return request.parameters();
    }

    /**
     * Get a request parameter converted to the given type, or null when absent.
     */
    public <T> T getParameter(String name, Class<T> type) {
        Object value = request.parameters().get(name);
        return value != null ? objectMapper.convertValue(value, type) : null;
    }

    /**
     * Add tokens and cost consumed by this execution.
     */
    public void recordUsage(long tokensUsed, double cost) {
        usage = usage.plus(ResourceUsage.of(tokensUsed, cost));
    }

    public ResourceUsage getUsage() {
        return usage;
    }

    /**
     * Set the self-assessed confidence of the result, in [0, 1].
     */
    public void setConfidence(double confidence) {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be in [0, 1]: " + confidence);
        }
        this.confidence = confidence;
    }

    public double getConfidence() {
        return confidence;
    }

    /**
     * Convert a result object to JsonNode.
     */
    public JsonNode toJsonNode(Object result) {
        return objectMapper.valueToTree(result);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
