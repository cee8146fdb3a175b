package com.agentic.engine.planner;

import com.agentic.core.model.CapabilityType;
import com.agentic.core.model.IntentType;

import java.util.List;

/**
 * One entry of a decomposition: which capability runs, with what narrowed intent,
 * after which other entries of the same template.
 *
 * @param key unique within the template, also used as the step name
 * @param descriptionFormat format applied to the original description, e.g. {@code "Write tests for: %s"}
 * @param after keys of the entries this one depends on
 */
public record StepTemplate(
    String key,
    CapabilityType capabilityType,
    IntentType intent,
    String descriptionFormat,
    List<String> after,
    boolean mandatory
) {
    public StepTemplate {
        after = after != null ? List.copyOf(after) : List.of();
    }

    public static StepTemplate of(String key, CapabilityType type, IntentType intent, String format, String... after) {
        return new StepTemplate(key, type, intent, format, List.of(after), true);
    }

    public static StepTemplate optional(String key, CapabilityType type, IntentType intent, String format, String... after) {
        return new StepTemplate(key, type, intent, format, List.of(after), false);
    }

    public String describe(String originalDescription) {
        return String.format(descriptionFormat, originalDescription);
    }
}
