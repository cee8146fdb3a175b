package com.agentic.engine.execution;

import com.agentic.core.model.ExecutionPlan;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.UncheckedIOException;

/**
 * JSON form of plan snapshots, with ISO-8601 timestamps and durations.
 */
public class PlanSnapshotSerializer {

    private final ObjectMapper objectMapper;

    public PlanSnapshotSerializer() {
        this(new ObjectMapper());
    }

    public PlanSnapshotSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .registerModule(new JavaTimeModule())
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String toJson(ExecutionPlan plan) {
        try {
            return objectMapper.writeValueAsString(plan);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize plan " + plan.id(), e);
        }
    }

    public JsonNode toTree(ExecutionPlan plan) {
        return objectMapper.valueToTree(plan);
    }

    public ExecutionPlan fromJson(String json) {
        try {
            return objectMapper.readValue(json, ExecutionPlan.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot deserialize plan snapshot", e);
        }
    }
}
