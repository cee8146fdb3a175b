package com.agentic.engine.planner;

import com.agentic.core.exception.PlanningException;
import com.agentic.core.model.CapabilityDescriptor;
import com.agentic.core.model.CapabilityType;
import com.agentic.core.model.ExecutionPlan;
import com.agentic.core.model.ExecutionStep;
import com.agentic.core.model.TaskRequest;
import com.agentic.engine.registry.CapabilityRegistry;
import com.agentic.worker.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Turns a classified request into a validated execution plan.
 *
 * Single-capability intents become one step wrapping the original request.
 * Composite intents expand through {@link PlanTemplates} into steps carrying
 * narrowed requests. Every plan is checked for acyclicity and dangling
 * references, and every mandatory step must have at least one registered
 * worker for its capability. Optional steps without a worker are left out.
 */
public class TaskPlanner {

    private static final Logger log = LoggerFactory.getLogger(TaskPlanner.class);

    private final CapabilityRegistry registry;
    private final PlanTemplates templates;

    public TaskPlanner(CapabilityRegistry registry) {
        this(registry, PlanTemplates.defaults());
    }

    public TaskPlanner(CapabilityRegistry registry, PlanTemplates templates) {
        this.registry = registry;
        this.templates = templates;
    }

    /**
     * Create the plan for a request.
     *
     * @throws PlanningException on a capability gap or an invalid graph
     */
    public ExecutionPlan plan(TaskRequest request) {
        List<ExecutionStep> steps = templates.compositeFor(request.intent())
            .map(composite -> expand(request, composite))
            .orElseGet(() -> List.of(singleStep(request)));
        ExecutionPlan plan = assemble(request, steps);
        log.info("Planned {} step(s) for task {} ({}), estimated {}s",
            plan.steps().size(), request.id(), request.intent().value(), plan.estimatedDuration().toSeconds());
        return plan;
    }

    /**
     * Validate a caller-built graph and wrap it into a plan with a critical-path estimate.
     *
     * @throws PlanningException on a capability gap or an invalid graph
     */
    public ExecutionPlan assemble(TaskRequest request, List<ExecutionStep> steps) {
        if (steps.isEmpty()) {
            throw new PlanningException("Plan for task " + request.id() + " has no steps");
        }
        for (ExecutionStep step : steps) {
            requireCapability(step.capabilityType(), step.id());
        }
        DependencyGraph.topologicalOrder(steps);
        return ExecutionPlan.create(request, steps, DependencyGraph.criticalPath(steps));
    }

    /**
     * Estimate for one step of the given type: the first registered worker's descriptor, else the default.
     */
    public Duration estimateFor(CapabilityType type) {
        List<Worker> workers = registry.workers(type);
        if (workers.isEmpty()) {
            return CapabilityDescriptor.DEFAULT_ESTIMATE;
        }
        return workers.get(0).descriptor().estimatedDuration();
    }

    private ExecutionStep singleStep(TaskRequest request) {
        CapabilityType type = templates.capabilityFor(request.intent())
            .orElseThrow(() -> new PlanningException(
                "No capability mapping for intent " + request.intent().value()));
        return ExecutionStep.builder()
            .name(request.intent().value())
            .capabilityType(type)
            .request(request)
            .estimatedDuration(estimateFor(type))
            .build();
    }

    private List<ExecutionStep> expand(TaskRequest request, List<StepTemplate> composite) {
        Map<String, String> stepIds = new HashMap<>();
        List<ExecutionStep> steps = new ArrayList<>();
        for (StepTemplate template : composite) {
            if (!template.mandatory() && !registry.hasCapability(template.capabilityType())) {
                log.info("Skipping optional step {} for task {}: no {} worker registered",
                    template.key(), request.id(), template.capabilityType().value());
                continue;
            }
            List<String> dependencies = new ArrayList<>();
            for (String key : template.after()) {
                String dependencyId = stepIds.get(key);
                if (dependencyId == null) {
                    throw new PlanningException(template.key(), key, "template references an unknown or skipped step");
                }
                dependencies.add(dependencyId);
            }
            String stepId = UUID.randomUUID().toString();
            stepIds.put(template.key(), stepId);
            steps.add(ExecutionStep.builder()
                .id(stepId)
                .name(template.key())
                .capabilityType(template.capabilityType())
                .request(request.narrow(template.intent(), template.describe(request.description())))
                .dependencies(dependencies)
                .mandatory(template.mandatory())
                .estimatedDuration(estimateFor(template.capabilityType()))
                .build());
        }
        return steps;
    }

    private void requireCapability(CapabilityType type, String stepId) {
        if (!registry.hasCapability(type)) {
            throw new PlanningException(String.format(
                "Capability gap: no worker registered for %s (step %s)", type.value(), stepId));
        }
    }
}
