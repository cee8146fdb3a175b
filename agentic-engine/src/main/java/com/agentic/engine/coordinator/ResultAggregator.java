package com.agentic.engine.coordinator;

import com.agentic.core.exception.TaskCancelledException;
import com.agentic.core.model.ExecutionPlan;
import com.agentic.core.model.ExecutionStep;
import com.agentic.core.model.ResourceUsage;
import com.agentic.core.model.TaskResult;
import com.agentic.core.model.TaskStatus;
import com.agentic.engine.service.OrchestrationService.OrchestrationOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;

/**
 * Folds the per-step results of a terminal plan into one outcome.
 *
 * A single-step plan reports its step's payload as is. A multi-step plan reports an
 * object keyed by step name holding the payload of every completed step.
 */
public class ResultAggregator {

    private final ObjectMapper objectMapper;

    public ResultAggregator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public OrchestrationOutcome aggregate(ExecutionPlan plan) {
        Optional<ExecutionStep> failed = firstMandatoryFailure(plan);
        String error = failed.map(ExecutionStep::lastError).orElse(null);
        String errorCode = failed.map(step -> step.result() != null ? step.result().errorCode() : null).orElse(null);
        if (plan.status() == TaskStatus.CANCELLED && error == null) {
            error = "Plan " + plan.id() + " was cancelled";
            errorCode = TaskCancelledException.ERROR_CODE;
        }

        return new OrchestrationOutcome(
            plan.status(),
            plan.originalRequest().intent(),
            plan.id(),
            consolidatedResult(plan),
            error,
            errorCode,
            plan.elapsed(),
            totalUsage(plan),
            plan.steps().size()
        );
    }

    /**
     * Mean confidence over completed steps; 0 unless the plan completed.
     */
    public double confidence(ExecutionPlan plan) {
        if (plan.status() != TaskStatus.COMPLETED) {
            return 0.0;
        }
        return plan.steps().stream()
            .filter(step -> step.status() == TaskStatus.COMPLETED && step.result() != null)
            .mapToDouble(step -> step.result().confidence())
            .average()
            .orElse(0.0);
    }

    JsonNode consolidatedResult(ExecutionPlan plan) {
        if (plan.steps().size() == 1) {
            ExecutionStep only = plan.steps().get(0);
            return only.status() == TaskStatus.COMPLETED && only.result() != null ? only.result().result() : null;
        }

        ObjectNode combined = objectMapper.createObjectNode();
        for (ExecutionStep step : plan.steps()) {
            if (step.status() != TaskStatus.COMPLETED || step.result() == null) {
                continue;
            }
            String key = combined.has(step.name()) ? step.name() + "_" + step.id() : step.name();
            combined.set(key, step.result().result());
        }
        return combined.isEmpty() ? null : combined;
    }

    private Optional<ExecutionStep> firstMandatoryFailure(ExecutionPlan plan) {
        return plan.steps().stream()
            .filter(ExecutionStep::mandatory)
            .filter(step -> step.status() == TaskStatus.FAILED)
            .findFirst();
    }

    private ResourceUsage totalUsage(ExecutionPlan plan) {
        ResourceUsage total = ResourceUsage.none();
        for (ExecutionStep step : plan.steps()) {
            TaskResult result = step.result();
            if (result != null) {
                total = total.plus(result.usage());
            }
        }
        return total;
    }
}
