package com.agentic.core.model;

import java.time.Duration;
import java.util.List;

/**
 * Introspection data describing what a worker can do.
 */
public record CapabilityDescriptor(
    String name,
    String description,
    List<String> requiredInputs,
    List<String> outputs,
    Duration estimatedDuration
) {
    public static final Duration DEFAULT_ESTIMATE = Duration.ofSeconds(60);

    public CapabilityDescriptor {
        requiredInputs = requiredInputs != null ? List.copyOf(requiredInputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
        estimatedDuration = estimatedDuration != null ? estimatedDuration : DEFAULT_ESTIMATE;
    }

    public static CapabilityDescriptor of(String name, String description) {
        return new CapabilityDescriptor(name, description, List.of(), List.of(), DEFAULT_ESTIMATE);
    }
}
