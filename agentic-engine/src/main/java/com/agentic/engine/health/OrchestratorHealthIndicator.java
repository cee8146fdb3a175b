package com.agentic.engine.health;

import com.agentic.core.model.TaskStatus;
import com.agentic.core.repository.PlanRepository;
import com.agentic.core.repository.SessionContextStore;
import com.agentic.engine.execution.ExecutionEngine;
import com.agentic.engine.registry.CapabilityRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Custom health indicator for the orchestrator.
 * Reports health status based on:
 * - Registered workers
 * - Engine state and load
 * - Session store activity
 */
@Component
public class OrchestratorHealthIndicator implements HealthIndicator {

    private final CapabilityRegistry registry;
    private final ExecutionEngine engine;
    private final PlanRepository planRepository;
    private final SessionContextStore sessionStore;

    public OrchestratorHealthIndicator(
            CapabilityRegistry registry,
            ExecutionEngine engine,
            PlanRepository planRepository,
            SessionContextStore sessionStore) {
        this.registry = registry;
        this.engine = engine;
        this.planRepository = planRepository;
        this.sessionStore = sessionStore;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();

        try {
            details.put("workers", registry.size());
            details.put("capabilities", registry.capabilities().keySet());
            details.put("inFlightSteps", engine.inFlightCount());
            details.put("queuedSteps", engine.queueDepth());
            details.put("activePlans", engine.activePlanCount());
            details.put("activeSessions", sessionStore.activeSessionCount());
            checkPlanHealth(details);

            if (engine.isShutdown()) {
                details.put("engine", "shut down");
                return Health.down().withDetails(details).build();
            }
            if (registry.size() == 0) {
                details.put("registry", "no workers registered");
                return Health.down().withDetails(details).build();
            }

            return Health.up()
                .withDetails(details)
                .build();

        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }

    private void checkPlanHealth(Map<String, Object> details) {
        Map<TaskStatus, Long> counts = planRepository.countByStatus();
        details.put("plans", counts);

        long failed = counts.getOrDefault(TaskStatus.FAILED, 0L);
        long completed = counts.getOrDefault(TaskStatus.COMPLETED, 0L);
        if (failed > 10 && failed > completed) {
            details.put("planWarning", "More plans failed than completed");
        }
    }
}
