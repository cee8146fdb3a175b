package com.agentic.engine.coordinator;

import com.agentic.core.exception.AgenticException;
import com.agentic.core.exception.NotFoundException;
import com.agentic.core.exception.ValidationException;
import com.agentic.core.model.CapabilityType;
import com.agentic.core.model.ConversationMessage;
import com.agentic.core.model.ExecutionContext;
import com.agentic.core.model.ExecutionPlan;
import com.agentic.core.model.ExecutionStep;
import com.agentic.core.model.IntentType;
import com.agentic.core.model.ResourceUsage;
import com.agentic.core.model.SessionContext;
import com.agentic.core.model.TaskRequest;
import com.agentic.core.model.TaskStatus;
import com.agentic.core.repository.PlanRepository;
import com.agentic.core.repository.SessionContextStore;
import com.agentic.engine.classifier.IntentClassifier;
import com.agentic.engine.execution.ExecutionEngine;
import com.agentic.engine.logging.LoggingContext;
import com.agentic.engine.planner.TaskPlanner;
import com.agentic.engine.registry.CapabilityRegistry;
import com.agentic.engine.service.OrchestrationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletionException;

/**
 * Orchestration façade: validate, classify, plan, execute, aggregate.
 *
 * Every fault raised along the way is converted into a FAILED outcome carrying the
 * fault's error code. Task ids are the ids of the originating {@link TaskRequest};
 * their status is read back from the {@link PlanRepository}.
 */
public class OrchestrationCoordinator implements OrchestrationService {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationCoordinator.class);

    static final String INTERNAL_ERROR = "INTERNAL_ERROR";
    static final String DEFAULT_USER = "default_user";
    static final String DEFAULT_PROJECT = "default_project";
    static final String DEFAULT_WORKSPACE = "/tmp/workspace";
    static final int MAX_REJECTED_TASKS = 1000;

    private final IntentClassifier classifier;
    private final TaskPlanner planner;
    private final ExecutionEngine engine;
    private final CapabilityRegistry registry;
    private final PlanRepository planRepository;
    private final SessionContextStore sessionStore;
    private final RequestValidator validator;
    private final ResultAggregator aggregator;

    // Async submissions that failed outside the engine, oldest dropped first
    private final Map<String, TaskStatusView> rejected = Collections.synchronizedMap(
        new LinkedHashMap<String, TaskStatusView>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, TaskStatusView> eldest) {
                return size() > MAX_REJECTED_TASKS;
            }
        });

    public OrchestrationCoordinator(
            IntentClassifier classifier,
            TaskPlanner planner,
            ExecutionEngine engine,
            CapabilityRegistry registry,
            PlanRepository planRepository,
            SessionContextStore sessionStore,
            RequestValidator validator,
            ResultAggregator aggregator) {
        this.classifier = classifier;
        this.planner = planner;
        this.engine = engine;
        this.registry = registry;
        this.planRepository = planRepository;
        this.sessionStore = sessionStore;
        this.validator = validator;
        this.aggregator = aggregator;
    }

    @Override
    public SubmitResponse submit(SubmitRequest request) {
        Instant start = Instant.now();
        String sessionId = sessionIdOf(request);
        String taskId = UUID.randomUUID().toString();

        try (var ctx = LoggingContext.forRequest(sessionId, taskId)) {
            OrchestrationOutcome outcome;
            double confidence = 0.0;
            try {
                ExecutionPlan plan = prepare(request, sessionId, taskId);
                ExecutionPlan finished = engine.execute(plan).join();
                outcome = aggregator.aggregate(finished);
                confidence = aggregator.confidence(finished);
            } catch (RuntimeException e) {
                outcome = failedOutcome(unwrap(e), Duration.between(start, Instant.now()));
            }

            recordOutcome(sessionId, taskId, outcome);
            Duration processingTime = Duration.between(start, Instant.now());
            log.info("Request {} finished {} in {}ms", taskId, outcome.status(), processingTime.toMillis());
            return new SubmitResponse(sessionId, outcome, processingTime, taskId, confidence, Instant.now());
        }
    }

    @Override
    public AsyncTaskResponse submitAsync(SubmitRequest request) {
        Instant start = Instant.now();
        String sessionId = sessionIdOf(request);
        String taskId = UUID.randomUUID().toString();

        try (var ctx = LoggingContext.forRequest(sessionId, taskId)) {
            ExecutionPlan plan;
            try {
                plan = prepare(request, sessionId, taskId);
            } catch (RuntimeException e) {
                OrchestrationOutcome outcome = failedOutcome(unwrap(e), Duration.between(start, Instant.now()));
                Instant now = Instant.now();
                rejected.put(taskId, new TaskStatusView(
                    taskId, TaskStatus.FAILED, 0.0, null, outcome.error(), start, now));
                recordOutcome(sessionId, taskId, outcome);
                return new AsyncTaskResponse(taskId, TaskStatus.FAILED, Duration.ZERO, outcome.error());
            }

            engine.execute(plan).whenComplete((finished, error) -> {
                OrchestrationOutcome outcome = error == null
                    ? aggregator.aggregate(finished)
                    : failedOutcome(unwrap(error), Duration.between(start, Instant.now()));
                if (error != null) {
                    rejected.put(taskId, new TaskStatusView(
                        taskId, TaskStatus.FAILED, 0.0, null, outcome.error(), start, Instant.now()));
                }
                recordOutcome(sessionId, taskId, outcome);
            });

            TaskStatus status = engine.snapshot(plan.id()).map(ExecutionPlan::status).orElse(TaskStatus.PENDING);
            log.info("Task {} started asynchronously (plan {}, {} step(s))", taskId, plan.id(), plan.steps().size());
            return new AsyncTaskResponse(taskId, status, plan.estimatedDuration(), "Task started");
        }
    }

    @Override
    public TaskStatusView getStatus(String taskId) {
        Optional<ExecutionPlan> found = planRepository.findByTaskId(taskId);
        if (found.isEmpty()) {
            TaskStatusView view = rejected.get(taskId);
            if (view == null) {
                throw new NotFoundException("Task", taskId);
            }
            return view;
        }

        ExecutionPlan plan = found.get();
        if (!plan.isTerminal()) {
            Instant updatedAt = plan.startedAt() != null ? plan.startedAt() : plan.createdAt();
            return new TaskStatusView(taskId, plan.status(), plan.progress(), null, null, plan.createdAt(), updatedAt);
        }
        OrchestrationOutcome outcome = aggregator.aggregate(plan);
        return new TaskStatusView(taskId, plan.status(), plan.progress(), outcome.result(), outcome.error(),
            plan.createdAt(), plan.completedAt());
    }

    @Override
    public boolean cancel(String taskId) {
        Optional<ExecutionPlan> plan = planRepository.findByTaskId(taskId);
        if (plan.isEmpty()) {
            return false;
        }
        boolean cancelled = engine.cancel(plan.get().id());
        if (cancelled) {
            log.info("Task {} cancelled", taskId);
        }
        return cancelled;
    }

    @Override
    public List<CapabilityView> listCapabilities() {
        List<CapabilityView> views = new ArrayList<>();
        registry.capabilities().forEach((type, descriptors) -> views.add(new CapabilityView(type, descriptors)));
        return views;
    }

    @Override
    public SessionContext getSession(String sessionId) {
        return sessionStore.find(sessionId)
            .orElseThrow(() -> new NotFoundException("Session", sessionId));
    }

    // ========== Pipeline ==========

    private ExecutionPlan prepare(SubmitRequest request, String sessionId, String taskId) {
        if (request == null) {
            throw new ValidationException("request", "cannot be null");
        }
        TaskRequest draft = toTaskRequest(request, sessionId, taskId);
        validator.validate(draft);

        sessionStore.load(sessionId, draft.context().userId(), draft.context().projectId());
        sessionStore.appendMessage(sessionId, ConversationMessage.userInput(sessionId, draft.description()));

        IntentType intent = classifier.classify(draft.description(), draft.context());
        log.info("Classified request {} as {}", taskId, intent.value());

        TaskRequest task = draft.toBuilder().intent(intent).build();
        ExecutionPlan plan = planner.plan(task);
        log.debug("Planned {} step(s) for request {}, estimated {}ms",
            plan.steps().size(), taskId, plan.estimatedDuration().toMillis());
        return plan;
    }

    private TaskRequest toTaskRequest(SubmitRequest request, String sessionId, String taskId) {
        ExecutionContext context = ExecutionContext.builder()
            .sessionId(sessionId)
            .userId(orDefault(request.userId(), DEFAULT_USER))
            .projectId(orDefault(request.projectId(), DEFAULT_PROJECT))
            .workspacePath(orDefault(request.workspacePath(), DEFAULT_WORKSPACE))
            .build();

        TaskRequest.Builder builder = TaskRequest.builder()
            .id(taskId)
            .description(request.message())
            .context(context)
            .parameters(request.parameters());
        if (request.priority() != null) {
            builder.priority(request.priority());
        }
        if (request.timeout() != null) {
            builder.timeout(request.timeout());
        }
        if (request.maxRetries() != null) {
            builder.maxRetries(request.maxRetries());
        }
        return builder.build();
    }

    private void recordOutcome(String sessionId, String taskId, OrchestrationOutcome outcome) {
        try {
            if (sessionStore.find(sessionId).isPresent()) {
                appendOutcome(sessionId, taskId, outcome);
            }
        } catch (RuntimeException e) {
            log.warn("Could not record outcome of task {} in session {}: {}", taskId, sessionId, e.getMessage());
        }
    }

    private void appendOutcome(String sessionId, String taskId, OrchestrationOutcome outcome) {
        ConversationMessage message = outcome.status() == TaskStatus.COMPLETED
            ? ConversationMessage.agentResponse(sessionId, summarize(outcome), outcome.result())
            : ConversationMessage.error(sessionId, summarize(outcome));
        Set<CapabilityType> capabilities = capabilitiesOf(outcome.planId());

        sessionStore.update(sessionId, session -> session
            .withMessage(message)
            .withActivity()
            .withActiveCapabilities(capabilities)
            .withContextData("lastTaskId", taskId));
    }

    private Set<CapabilityType> capabilitiesOf(String planId) {
        Set<CapabilityType> types = EnumSet.noneOf(CapabilityType.class);
        if (planId != null) {
            planRepository.findById(planId).ifPresent(plan ->
                plan.steps().stream().map(ExecutionStep::capabilityType).forEach(types::add));
        }
        return types;
    }

    private static String summarize(OrchestrationOutcome outcome) {
        if (outcome.status() == TaskStatus.COMPLETED) {
            return String.format("Completed %s in %d step(s)",
                outcome.intent() != null ? outcome.intent().value() : "request", outcome.stepCount());
        }
        String error = outcome.error() != null && !outcome.error().isBlank() ? outcome.error() : "no details";
        return String.format("%s: %s", outcome.status(), error);
    }

    private OrchestrationOutcome failedOutcome(Throwable error, Duration elapsed) {
        String code;
        String message;
        if (error instanceof AgenticException agentic) {
            code = agentic.getErrorCode();
            message = agentic.getMessage();
            log.warn("Request failed: {} - {}", code, message);
        } else {
            code = INTERNAL_ERROR;
            message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
            log.error("Unexpected failure while orchestrating request", error);
        }
        return new OrchestrationOutcome(TaskStatus.FAILED, null, null, null, message, code,
            elapsed, ResourceUsage.none(), 0);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String sessionIdOf(SubmitRequest request) {
        if (request == null || request.sessionId() == null || request.sessionId().isBlank()) {
            return UUID.randomUUID().toString();
        }
        return request.sessionId();
    }

    private static String orDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }
}
