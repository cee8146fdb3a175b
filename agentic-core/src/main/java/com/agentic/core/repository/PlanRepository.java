package com.agentic.core.repository;

import com.agentic.core.model.ExecutionPlan;
import com.agentic.core.model.TaskStatus;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository for execution plan snapshots.
 * Each save replaces the previous snapshot of the same plan.
 */
public interface PlanRepository {

    /**
     * Store the latest snapshot of a plan.
     *
     * @param plan The plan snapshot
     */
    void save(ExecutionPlan plan);

    /**
     * Find a plan by its ID.
     *
     * @param planId The plan ID
     * @return The latest snapshot if found
     */
    Optional<ExecutionPlan> findById(String planId);

    /**
     * Find the plan created for the given originating request.
     *
     * @param taskId ID of the request the plan was derived from
     * @return The latest snapshot if found
     */
    Optional<ExecutionPlan> findByTaskId(String taskId);

    /**
     * Find plans in the given status.
     *
     * @param status The plan status
     * @param limit Maximum number of results
     * @return Plans in the given status, oldest first
     */
    List<ExecutionPlan> findByStatus(TaskStatus status, int limit);

    /**
     * Count plans per status.
     */
    Map<TaskStatus, Long> countByStatus();

    /**
     * Delete terminal plans completed before the given time.
     *
     * @return Number of deleted plans
     */
    int deleteCompletedBefore(Instant completedBefore);
}
