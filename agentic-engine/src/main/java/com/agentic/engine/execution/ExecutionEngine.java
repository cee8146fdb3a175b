package com.agentic.engine.execution;

import com.agentic.core.exception.AgenticException;
import com.agentic.core.exception.DispatchException;
import com.agentic.core.exception.StepTimeoutException;
import com.agentic.core.exception.WorkerException;
import com.agentic.core.model.ExecutionPlan;
import com.agentic.core.model.ExecutionStep;
import com.agentic.core.model.Priority;
import com.agentic.core.model.TaskResult;
import com.agentic.core.model.TaskStatus;
import com.agentic.core.repository.PlanRepository;
import com.agentic.engine.logging.LoggingContext;
import com.agentic.engine.metrics.OrchestratorMetrics;
import com.agentic.engine.registry.CapabilityRegistry;
import com.agentic.worker.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives execution plans to a terminal state.
 *
 * Ready steps of all plans share one dispatch queue ordered by request priority
 * (highest first), then request creation time, then enqueue order. The queue drains
 * while fewer than {@code maxConcurrentTasks} dispatches are in flight. Dispatches
 * are asynchronous and bounded by the request timeout; outcomes arrive on worker
 * threads and are applied under a single lock, so every step has exactly one writer.
 *
 * Step lifecycle:
 * PENDING -> IN_PROGRESS -> COMPLETED | FAILED | PENDING (retry) | CANCELLED
 *
 * Plan lifecycle:
 * PENDING -> IN_PROGRESS -> COMPLETED | FAILED | CANCELLED
 *
 * A plan completes when every mandatory step completed. Dependents of a failed step
 * are cancelled. Every transition is published to the {@link PlanRepository}.
 */
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    public static final String ENGINE_SHUTDOWN = "ENGINE_SHUTDOWN";

    private final CapabilityRegistry registry;
    private final PlanRepository planRepository;
    private final EngineSettings settings;
    private final OrchestratorMetrics metrics;
    private final ScheduledExecutorService retryScheduler;

    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock
    private final PriorityQueue<QueuedStep> queue = new PriorityQueue<>(QueuedStep.ORDER);
    private final Map<String, PlanRun> runs = new LinkedHashMap<>();
    private int inFlight;
    private long sequence;
    private volatile boolean shutdown;

    public ExecutionEngine(CapabilityRegistry registry, PlanRepository planRepository,
                           EngineSettings settings, OrchestratorMetrics metrics) {
        this.registry = registry;
        this.planRepository = planRepository;
        this.settings = settings;
        this.metrics = metrics;
        this.retryScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "engine-retry-scheduler");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Start executing a plan.
     *
     * @return a future completed with the terminal snapshot; completed exceptionally
     *         only when the engine is shut down
     */
    public CompletableFuture<ExecutionPlan> execute(ExecutionPlan plan) {
        Actions actions = new Actions();
        PlanRun run;
        lock.lock();
        try {
            if (shutdown) {
                return CompletableFuture.failedFuture(
                    new AgenticException(ENGINE_SHUTDOWN, "Engine is shut down, plan " + plan.id() + " rejected"));
            }
            PlanRun existing = runs.get(plan.id());
            if (existing != null) {
                return existing.completion;
            }
            if (plan.isTerminal()) {
                return CompletableFuture.completedFuture(plan);
            }

            run = new PlanRun(plan.status() == TaskStatus.PENDING ? plan.withStatus(TaskStatus.IN_PROGRESS) : plan);
            runs.put(run.planId(), run);
            try (var ctx = LoggingContext.forPlan(run.planId(), plan.originalRequest().id())) {
                log.info("Executing plan {} with {} step(s)", run.planId(), plan.steps().size());
            }
            metrics.planStarted(plan.originalRequest().intent());
            persist(run);

            enqueueReady(run);
            finishIfDone(run, actions);
            drain(actions);
        } finally {
            lock.unlock();
        }
        actions.run();
        return run.completion;
    }

    /**
     * Cancel a running plan: no further dispatches, in-flight work is cancelled and
     * its late results discarded, every non-terminal step becomes CANCELLED.
     *
     * @return false when the plan is unknown or already terminal
     */
    public boolean cancel(String planId) {
        Actions actions = new Actions();
        lock.lock();
        try {
            PlanRun run = runs.get(planId);
            if (run == null) {
                return false;
            }
            cancelRun(run, "Cancelled by caller", actions);
            drain(actions);
        } finally {
            lock.unlock();
        }
        actions.run();
        return true;
    }

    /**
     * Latest snapshot of a plan, live or persisted.
     */
    public Optional<ExecutionPlan> snapshot(String planId) {
        lock.lock();
        try {
            PlanRun run = runs.get(planId);
            if (run != null) {
                return Optional.of(run.snapshot());
            }
        } finally {
            lock.unlock();
        }
        return planRepository.findById(planId);
    }

    public int inFlightCount() {
        lock.lock();
        try {
            return inFlight;
        } finally {
            lock.unlock();
        }
    }

    public int queueDepth() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public int activePlanCount() {
        lock.lock();
        try {
            return runs.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Refuse new plans, wait for active plans up to the timeout, then cancel the rest.
     *
     * @return true when every active plan finished on its own
     */
    public boolean shutdown(Duration timeout) {
        List<CompletableFuture<ExecutionPlan>> pending = new ArrayList<>();
        lock.lock();
        try {
            if (shutdown && runs.isEmpty()) {
                return true;
            }
            shutdown = true;
            runs.values().forEach(run -> pending.add(run.completion));
        } finally {
            lock.unlock();
        }

        log.info("Shutting down engine, waiting for {} active plan(s) (timeout: {}ms)",
            pending.size(), timeout.toMillis());
        boolean drained = true;
        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            drained = false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            drained = false;
        } catch (ExecutionException e) {
            // Plan futures never complete exceptionally once accepted.
            log.error("Unexpected plan failure during shutdown", e.getCause());
        }

        if (!drained) {
            Actions actions = new Actions();
            lock.lock();
            try {
                log.warn("Shutdown timeout reached, cancelling {} active plan(s)", runs.size());
                for (PlanRun run : new ArrayList<>(runs.values())) {
                    cancelRun(run, "Engine shutdown", actions);
                }
            } finally {
                lock.unlock();
            }
            actions.run();
        }
        retryScheduler.shutdownNow();
        log.info("Engine shut down ({})", drained ? "drained" : "cancelled remaining plans");
        return drained;
    }

    // ========== Scheduling (lock held) ==========

    private void enqueueReady(PlanRun run) {
        for (ExecutionStep step : run.steps.values()) {
            if (step.isReady(run.completed)
                    && !run.scheduled.contains(step.id())
                    && !run.dispatches.containsKey(step.id())) {
                enqueue(run, step);
            }
        }
    }

    private void enqueue(PlanRun run, ExecutionStep step) {
        run.scheduled.add(step.id());
        queue.add(new QueuedStep(run, step.id(), step.request().priority(), step.request().createdAt(), ++sequence));
        log.debug("Enqueued step {} ({}) of plan {}", step.name(), step.id(), run.planId());
        metrics.updateQueueDepth(queue.size());
    }

    private void drain(Actions actions) {
        while (inFlight < settings.maxConcurrentTasks() && !queue.isEmpty()) {
            QueuedStep next = queue.poll();
            PlanRun run = next.run();
            run.scheduled.remove(next.stepId());
            ExecutionStep step = run.steps.get(next.stepId());
            if (run.finished || step.status() != TaskStatus.PENDING) {
                continue;
            }
            dispatch(run, step, actions);
        }
        metrics.updateQueueDepth(queue.size());
        metrics.updateInFlight(inFlight);
    }

    private void dispatch(PlanRun run, ExecutionStep step, Actions actions) {
        int attempt = step.retryCount() + 1;
        try (var ctx = LoggingContext.forStep(run.planId(), step.id(), step.capabilityType().value(), attempt)) {
            List<Worker> candidates = registry.findCapable(step.capabilityType(), step.request());
            if (candidates.isEmpty()) {
                DispatchException error = new DispatchException(step.id(), step.capabilityType());
                log.error("Dispatch failed: {}", error.getMessage());
                metrics.stepFailed(step.capabilityType(), error.getErrorCode(), false);
                failStep(run, step, TaskResult.pending(step.request().id(), step.capabilityType())
                    .withFailed(error.getErrorCode(), error.getMessage(), Duration.ZERO));
                finishIfDone(run, actions);
                return;
            }

            // Round-robin over the candidates by attempt number
            Worker worker = candidates.get(step.retryCount() % candidates.size());
            ExecutionStep started = step.withStarted();
            run.update(started);
            persist(run);

            Dispatch dispatch = new Dispatch(run, started, worker, ++sequence, System.nanoTime());
            run.dispatches.put(step.id(), dispatch);
            inFlight++;
            metrics.stepDispatched(step.capabilityType(), worker.name());
            log.info("Dispatching step {} to worker {} (attempt {})", step.name(), worker.name(), attempt);
            actions.launches.add(dispatch);
        }
    }

    // ========== Dispatch (lock not held) ==========

    private void launch(Dispatch dispatch) {
        CompletableFuture<TaskResult> future;
        try {
            future = dispatch.worker().execute(dispatch.step().request());
            if (future == null) {
                future = CompletableFuture.failedFuture(new WorkerException("Worker returned no future"));
            }
        } catch (Throwable e) {
            // Errors included; the step must still reach an outcome
            future = CompletableFuture.failedFuture(e);
        }

        boolean stale;
        lock.lock();
        try {
            stale = !dispatch.isCurrent();
            if (!stale) {
                dispatch.run().futures.put(dispatch.step().id(), future);
            }
        } finally {
            lock.unlock();
        }
        if (stale) {
            future.cancel(true);
        }

        CompletableFuture<TaskResult> workerFuture = future;
        Duration timeout = dispatch.step().request().timeout();
        future.copy()
            .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .whenComplete((result, error) -> onOutcome(dispatch, workerFuture, result, error));
    }

    private void onOutcome(Dispatch dispatch, CompletableFuture<TaskResult> workerFuture,
                           TaskResult result, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TimeoutException) {
            workerFuture.cancel(true);
        }

        Actions actions = new Actions();
        lock.lock();
        try {
            inFlight--;
            PlanRun run = dispatch.run();
            ExecutionStep step = dispatch.step();
            try (var ctx = LoggingContext.forStep(run.planId(), step.id(), step.capabilityType().value(),
                    step.retryCount() + 1)) {
                if (!dispatch.isCurrent()) {
                    log.warn("Discarding late outcome of step {} from worker {}", step.name(), dispatch.worker().name());
                } else {
                    run.dispatches.remove(step.id());
                    run.futures.remove(step.id());
                    applyOutcome(run, step, dispatch, result, cause);
                    finishIfDone(run, actions);
                }
            }
            drain(actions);
        } finally {
            lock.unlock();
        }
        actions.run();
    }

    // ========== Outcomes (lock held) ==========

    private void applyOutcome(PlanRun run, ExecutionStep step, Dispatch dispatch, TaskResult result, Throwable cause) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - dispatch.startNanos());

        TaskResult attempt = pendingResultOf(step);

        if (cause == null && result != null && result.status() == TaskStatus.COMPLETED) {
            TaskResult recorded = attempt.withCompleted(
                result.result(), result.executionTime(), result.usage(), result.confidence());
            for (Map.Entry<String, String> entry : result.metadata().entrySet()) {
                recorded = recorded.withMetadata(entry.getKey(), entry.getValue());
            }
            ExecutionStep completed = step.withCompleted(recorded.withMetadata("worker", dispatch.worker().name()));
            run.update(completed);
            run.completed.add(step.id());
            metrics.stepCompleted(step.capabilityType(), elapsed);
            log.info("Step {} completed in {}ms", step.name(), elapsed.toMillis());
            persist(run);
            enqueueReady(run);
            return;
        }

        String errorCode;
        String message;
        boolean retryable;
        if (cause instanceof TimeoutException) {
            StepTimeoutException timeout = new StepTimeoutException(step.id(), step.request().timeout());
            errorCode = timeout.getErrorCode();
            message = timeout.getMessage();
            retryable = true;
            metrics.stepTimedOut(step.capabilityType());
        } else if (cause instanceof AgenticException agentic) {
            errorCode = agentic.getErrorCode();
            message = agentic.getMessage();
            retryable = agentic.isRetryable();
        } else if (cause instanceof CancellationException) {
            errorCode = WorkerException.ERROR_CODE;
            message = "Worker cancelled the task";
            retryable = true;
        } else if (cause != null) {
            errorCode = WorkerException.ERROR_CODE;
            message = cause.getClass().getSimpleName() + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
            retryable = true;
        } else if (result == null) {
            errorCode = WorkerException.ERROR_CODE;
            message = "Worker returned no result";
            retryable = true;
        } else {
            errorCode = result.errorCode() != null ? result.errorCode() : WorkerException.ERROR_CODE;
            message = result.error() != null ? result.error() : "Worker reported status " + result.status();
            retryable = true;
        }

        boolean willRetry = retryable && settings.retryPolicy().shouldRetry(errorCode) && step.hasRetriesLeft();
        metrics.stepFailed(step.capabilityType(), errorCode, willRetry);
        TaskResult failure = attempt.withFailed(errorCode, message, elapsed)
            .withMetadata("worker", dispatch.worker().name());

        if (willRetry) {
            ExecutionStep retried = step.withRetry(failure);
            run.update(retried);
            persist(run);
            Duration backoff = settings.retryPolicy().computeBackoff(retried.retryCount());
            metrics.stepRetried(step.capabilityType(), retried.retryCount());
            log.warn("Step {} failed ({}: {}), retry {}/{} in {}ms", step.name(), errorCode, message,
                retried.retryCount(), retried.maxRetries(), backoff.toMillis());
            scheduleRetry(run, retried, backoff);
            return;
        }

        log.error("Step {} failed permanently ({}: {}) after {} retr{}", step.name(), errorCode, message,
            step.retryCount(), step.retryCount() == 1 ? "y" : "ies");
        failStep(run, step, failure);
    }

    /**
     * The PENDING result recorded when the step was dispatched.
     */
    private static TaskResult pendingResultOf(ExecutionStep step) {
        TaskResult result = step.result();
        if (result != null && result.status() == TaskStatus.PENDING) {
            return result;
        }
        return TaskResult.pending(step.request().id(), step.capabilityType());
    }

    private void scheduleRetry(PlanRun run, ExecutionStep step, Duration backoff) {
        if (backoff.isZero()) {
            enqueue(run, step);
            return;
        }
        run.scheduled.add(step.id());
        retryScheduler.schedule(() -> requeue(run, step.id()), backoff.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void requeue(PlanRun run, String stepId) {
        Actions actions = new Actions();
        lock.lock();
        try {
            run.scheduled.remove(stepId);
            ExecutionStep step = run.steps.get(stepId);
            if (!run.finished && step.status() == TaskStatus.PENDING) {
                enqueue(run, step);
            }
            finishIfDone(run, actions);
            drain(actions);
        } finally {
            lock.unlock();
        }
        actions.run();
    }

    /**
     * Fail a step and cancel everything that transitively depends on it.
     */
    private void failStep(PlanRun run, ExecutionStep step, TaskResult failure) {
        run.update(step.withFailed(failure));

        Deque<String> frontier = new ArrayDeque<>();
        frontier.add(step.id());
        Set<String> visited = new HashSet<>();
        while (!frontier.isEmpty()) {
            String failedId = frontier.poll();
            for (ExecutionStep candidate : new ArrayList<>(run.steps.values())) {
                if (candidate.dependsOn(failedId) && visited.add(candidate.id()) && !candidate.isTerminal()) {
                    run.update(candidate.withCancelled("Dependency " + step.name() + " failed"));
                    run.scheduled.remove(candidate.id());
                    log.info("Cancelled step {}: dependency {} failed", candidate.name(), step.name());
                    frontier.add(candidate.id());
                }
            }
        }
        persist(run);
    }

    private void finishIfDone(PlanRun run, Actions actions) {
        if (run.finished || !run.scheduled.isEmpty() || !run.dispatches.isEmpty()) {
            return;
        }
        for (ExecutionStep step : new ArrayList<>(run.steps.values())) {
            if (step.status() == TaskStatus.PENDING) {
                run.update(step.withCancelled("Unreachable"));
            }
        }
        boolean success = run.steps.values().stream()
            .filter(ExecutionStep::mandatory)
            .allMatch(step -> step.status() == TaskStatus.COMPLETED);
        finish(run, success ? TaskStatus.COMPLETED : TaskStatus.FAILED, actions);
    }

    private void cancelRun(PlanRun run, String reason, Actions actions) {
        for (ExecutionStep step : new ArrayList<>(run.steps.values())) {
            if (!step.isTerminal()) {
                run.update(step.withCancelled(reason));
            }
        }
        actions.cancellations.addAll(run.futures.values());
        run.dispatches.clear();
        run.futures.clear();
        run.scheduled.clear();
        queue.removeIf(queued -> queued.run() == run);
        finish(run, TaskStatus.CANCELLED, actions);
    }

    private void finish(PlanRun run, TaskStatus status, Actions actions) {
        run.plan = run.snapshot().withStatus(status);
        run.finished = true;
        runs.remove(run.planId());
        planRepository.save(run.plan);

        ExecutionPlan plan = run.plan;
        try (var ctx = LoggingContext.forPlan(plan.id(), plan.originalRequest().id())) {
            log.info("Plan {} finished {} in {}ms ({}% complete)",
                plan.id(), status, plan.elapsed().toMillis(), Math.round(plan.progress()));
        }
        switch (status) {
            case COMPLETED -> metrics.planCompleted(plan.originalRequest().intent(), plan.elapsed());
            case FAILED -> metrics.planFailed(plan.originalRequest().intent(), plan.elapsed());
            default -> metrics.planCancelled(plan.originalRequest().intent());
        }
        actions.completions.add(() -> run.completion.complete(plan));
    }

    private void persist(PlanRun run) {
        planRepository.save(run.snapshot());
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    // ========== State ==========

    /**
     * Mutable execution state of one plan. Guarded by the engine lock.
     */
    private static final class PlanRun {
        private ExecutionPlan plan;
        private final Map<String, ExecutionStep> steps = new LinkedHashMap<>();
        private final Set<String> completed = new HashSet<>();
        // Queued or waiting for retry backoff
        private final Set<String> scheduled = new HashSet<>();
        private final Map<String, Dispatch> dispatches = new HashMap<>();
        private final Map<String, CompletableFuture<TaskResult>> futures = new HashMap<>();
        private final CompletableFuture<ExecutionPlan> completion = new CompletableFuture<>();
        private boolean finished;

        PlanRun(ExecutionPlan plan) {
            this.plan = plan;
            for (ExecutionStep step : plan.steps()) {
                steps.put(step.id(), step);
                if (step.status() == TaskStatus.COMPLETED) {
                    completed.add(step.id());
                }
            }
        }

        String planId() {
            return plan.id();
        }

        void update(ExecutionStep step) {
            steps.put(step.id(), step);
        }

        ExecutionPlan snapshot() {
            return finished ? plan : plan.withSteps(new ArrayList<>(steps.values()));
        }
    }

    private record Dispatch(PlanRun run, ExecutionStep step, Worker worker, long token, long startNanos) {
        boolean isCurrent() {
            Dispatch current = run.dispatches.get(step.id());
            return current != null && current.token == token;
        }
    }

    private record QueuedStep(PlanRun run, String stepId, Priority priority, Instant createdAt, long sequence) {
        static final Comparator<QueuedStep> ORDER = Comparator
            .comparingInt((QueuedStep q) -> q.priority().weight()).reversed()
            .thenComparing(QueuedStep::createdAt)
            .thenComparingLong(QueuedStep::sequence);
    }

    /**
     * Side effects collected under the lock and performed after releasing it.
     */
    private final class Actions {
        private final List<Dispatch> launches = new ArrayList<>();
        private final List<CompletableFuture<TaskResult>> cancellations = new ArrayList<>();
        private final List<Runnable> completions = new ArrayList<>();

        void run() {
            cancellations.forEach(future -> future.cancel(true));
            completions.forEach(Runnable::run);
            launches.forEach(ExecutionEngine.this::launch);
        }
    }
}
