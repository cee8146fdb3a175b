package com.agentic.api.rest;

import com.agentic.core.exception.NotFoundException;
import com.agentic.core.model.ExecutionPlan;
import com.agentic.core.repository.PlanRepository;
import com.agentic.core.model.TaskStatus;
import com.agentic.engine.execution.PlanSnapshotSerializer;
import com.agentic.engine.service.OrchestrationService;
import com.agentic.engine.service.OrchestrationService.TaskStatusView;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

/**
 * REST API for task status and cancellation.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private final OrchestrationService orchestrationService;
    private final PlanRepository planRepository;
    private final PlanSnapshotSerializer snapshotSerializer;

    public TaskController(
            OrchestrationService orchestrationService,
            PlanRepository planRepository,
            PlanSnapshotSerializer snapshotSerializer) {
        this.orchestrationService = orchestrationService;
        this.planRepository = planRepository;
        this.snapshotSerializer = snapshotSerializer;
    }

    /**
     * Get the status of a task.
     */
    @GetMapping("/{taskId}")
    public ResponseEntity<TaskStatusResponse> getTask(@PathVariable String taskId) {
        return ResponseEntity.ok(TaskStatusResponse.from(orchestrationService.getStatus(taskId)));
    }

    /**
     * Get the full plan snapshot of a task, including every step and its result.
     */
    @GetMapping("/{taskId}/plan")
    public ResponseEntity<JsonNode> getPlan(@PathVariable String taskId) {
        ExecutionPlan plan = planRepository.findByTaskId(taskId)
            .orElseThrow(() -> new NotFoundException("Plan for task", taskId));
        return ResponseEntity.ok(snapshotSerializer.toTree(plan));
    }

    /**
     * Cancel a running task.
     */
    @PostMapping("/{taskId}/cancel")
    public ResponseEntity<CancelResponse> cancel(@PathVariable String taskId) {
        boolean cancelled = orchestrationService.cancel(taskId);
        return ResponseEntity.ok(new CancelResponse(
            taskId,
            cancelled,
            cancelled ? "Task cancelled" : "Task is not running"
        ));
    }

    // ========== DTOs ==========

    public record TaskStatusResponse(
        String taskId,
        TaskStatus status,
        double progress,
        JsonNode result,
        String error,
        Instant createdAt,
        Instant updatedAt
    ) {
        public static TaskStatusResponse from(TaskStatusView view) {
            return new TaskStatusResponse(
                view.taskId(),
                view.status(),
                view.progress(),
                view.result(),
                view.error(),
                view.createdAt(),
                view.updatedAt()
            );
        }
    }

    public record CancelResponse(
        String taskId,
        boolean cancelled,
        String message
    ) {}
}
