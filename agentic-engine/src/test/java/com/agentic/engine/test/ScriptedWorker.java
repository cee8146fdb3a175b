package com.agentic.engine.test;

import com.agentic.core.exception.WorkerException;
import com.agentic.core.model.CapabilityDescriptor;
import com.agentic.core.model.CapabilityType;
import com.agentic.core.model.ResourceUsage;
import com.agentic.core.model.TaskRequest;
import com.agentic.core.model.TaskResult;
import com.agentic.worker.Worker;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Worker test double that plays back a script of outcomes, one per dispatch,
 * and records every dispatch it receives.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ScriptedWorker worker = ScriptedWorker.of(CapabilityType.CODE)
 *     .thenFail("boom")
 *     .thenFail("boom again")
 *     .thenSucceed();
 * }</pre>
 *
 * Once the script is exhausted every further dispatch succeeds after the default delay.
 */
public class ScriptedWorker implements Worker {

    /**
     * One observed call to {@link #execute}.
     */
    public record Dispatch(TaskRequest request, Instant startedAt, String thread) {}

    private final String name;
    private final CapabilityType type;
    private final Deque<Behavior> script = new ArrayDeque<>();
    private final List<Dispatch> dispatches = new CopyOnWriteArrayList<>();
    private final List<CompletableFuture<TaskResult>> hanging = new CopyOnWriteArrayList<>();
    private Predicate<TaskRequest> accepts = request -> true;
    private Duration defaultDelay = Duration.ZERO;
    private Duration estimate = CapabilityDescriptor.DEFAULT_ESTIMATE;
    private Consumer<TaskRequest> onDispatch = request -> { };

    private ScriptedWorker(String name, CapabilityType type) {
        this.name = name;
        this.type = type;
    }

    public static ScriptedWorker of(CapabilityType type) {
        return new ScriptedWorker(type.value() + "-worker", type);
    }

    public static ScriptedWorker named(String name, CapabilityType type) {
        return new ScriptedWorker(name, type);
    }

    // ========== Script ==========

    public synchronized ScriptedWorker thenSucceed() {
        return thenSucceedAfter(Duration.ZERO);
    }

    public synchronized ScriptedWorker thenSucceedAfter(Duration delay) {
        script.add(request -> completeAfter(delay, () -> success(request)));
        return this;
    }

    public synchronized ScriptedWorker thenFail(String message) {
        script.add(request -> CompletableFuture.failedFuture(new WorkerException(message)));
        return this;
    }

    public synchronized ScriptedWorker thenFailPermanently(String code, String message) {
        script.add(request -> CompletableFuture.failedFuture(WorkerException.permanent(code, message)));
        return this;
    }

    public synchronized ScriptedWorker thenReportFailure(String code, String message) {
        script.add(request -> CompletableFuture.completedFuture(
            TaskResult.failure(request.id(), type, code, message, Duration.ofMillis(1))));
        return this;
    }

    public synchronized ScriptedWorker thenThrow(Error error) {
        script.add(request -> {
            throw error;
        });
        return this;
    }

    public synchronized ScriptedWorker thenThrow(RuntimeException error) {
        script.add(request -> {
            throw error;
        });
        return this;
    }

    /**
     * Never complete on its own; only cancellation or the engine's timeout ends the dispatch.
     */
    public synchronized ScriptedWorker thenHang() {
        script.add(request -> {
            CompletableFuture<TaskResult> future = new CompletableFuture<>();
            hanging.add(future);
            return future;
        });
        return this;
    }

    public synchronized ScriptedWorker thenRespond(CompletableFuture<TaskResult> future) {
        script.add(request -> future);
        return this;
    }

    // ========== Configuration ==========

    public ScriptedWorker accepting(Predicate<TaskRequest> predicate) {
        this.accepts = predicate;
        return this;
    }

    public ScriptedWorker withDefaultDelay(Duration delay) {
        this.defaultDelay = delay;
        return this;
    }

    public ScriptedWorker withEstimate(Duration estimate) {
        this.estimate = estimate;
        return this;
    }

    public ScriptedWorker onDispatch(Consumer<TaskRequest> listener) {
        this.onDispatch = listener;
        return this;
    }

    // ========== Observation ==========

    public List<Dispatch> dispatches() {
        return List.copyOf(dispatches);
    }

    public int dispatchCount() {
        return dispatches.size();
    }

    public List<CompletableFuture<TaskResult>> hangingFutures() {
        return List.copyOf(hanging);
    }

    // ========== Worker ==========

    @Override
    public String name() {
        return name;
    }

    @Override
    public CapabilityType capabilityType() {
        return type;
    }

    @Override
    public CapabilityDescriptor descriptor() {
        return new CapabilityDescriptor(name, "Scripted " + type.value() + " worker",
            List.of("description"), List.of("result"), estimate);
    }

    @Override
    public boolean canHandle(TaskRequest request) {
        return accepts.test(request);
    }

    @Override
    public CompletableFuture<TaskResult> execute(TaskRequest request) {
        dispatches.add(new Dispatch(request, Instant.now(), Thread.currentThread().getName()));
        onDispatch.accept(request);
        Behavior next;
        synchronized (this) {
            next = script.poll();
        }
        if (next == null) {
            return completeAfter(defaultDelay, () -> success(request));
        }
        return next.run(request);
    }

    private TaskResult success(TaskRequest request) {
        return TaskResult.success(request.id(), type,
            JsonNodeFactory.instance.objectNode().put("worker", name).put("description", request.description()),
            Duration.ofMillis(1), ResourceUsage.of(10, 0.01), 0.9);
    }

    private static CompletableFuture<TaskResult> completeAfter(Duration delay, Supplier<TaskResult> result) {
        if (delay.isZero()) {
            return CompletableFuture.supplyAsync(result);
        }
        return CompletableFuture.supplyAsync(result,
            CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS));
    }

    @FunctionalInterface
    private interface Behavior {
        CompletableFuture<TaskResult> run(TaskRequest request);
    }
}
