package com.agentic.engine.persistence;

import com.agentic.core.model.ExecutionPlan;
import com.agentic.core.model.TaskStatus;
import com.agentic.core.repository.PlanRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of PlanRepository.
 * Keeps the latest snapshot per plan and an index from originating task id to plan id.
 */
@Repository
public class InMemoryPlanRepository implements PlanRepository {

    private final Map<String, ExecutionPlan> plans = new ConcurrentHashMap<>();
    private final Map<String, String> planIdsByTaskId = new ConcurrentHashMap<>();

    @Override
    public void save(ExecutionPlan plan) {
        plans.put(plan.id(), plan);
        planIdsByTaskId.put(plan.originalRequest().id(), plan.id());
    }

    @Override
    public Optional<ExecutionPlan> findById(String planId) {
        return Optional.ofNullable(plans.get(planId));
    }

    @Override
    public Optional<ExecutionPlan> findByTaskId(String taskId) {
        String planId = planIdsByTaskId.get(taskId);
        return planId != null ? findById(planId) : Optional.empty();
    }

    @Override
    public List<ExecutionPlan> findByStatus(TaskStatus status, int limit) {
        return plans.values().stream()
            .filter(p -> p.status() == status)
            .sorted(Comparator.comparing(ExecutionPlan::createdAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public Map<TaskStatus, Long> countByStatus() {
        return plans.values().stream()
            .collect(Collectors.groupingBy(ExecutionPlan::status, Collectors.counting()));
    }

    @Override
    public int deleteCompletedBefore(Instant completedBefore) {
        List<ExecutionPlan> toDelete = plans.values().stream()
            .filter(p -> p.status().isTerminal())
            .filter(p -> p.completedAt() != null && p.completedAt().isBefore(completedBefore))
            .collect(Collectors.toList());

        for (ExecutionPlan plan : toDelete) {
            plans.remove(plan.id());
            planIdsByTaskId.remove(plan.originalRequest().id(), plan.id());
        }
        return toDelete.size();
    }
}
