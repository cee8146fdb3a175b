package com.agentic.worker;

import com.agentic.core.exception.WorkerException;
import com.agentic.core.model.CapabilityDescriptor;
import com.agentic.core.model.CapabilityType;
import com.agentic.core.model.IntentType;
import com.agentic.core.model.TaskRequest;
import com.agentic.core.model.TaskResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Base class for workers whose body is synchronous.
 * Runs {@link #perform} on an executor and turns its outcome into a {@link TaskResult}.
 *
 * Usage:
 * <pre>
 * Worker docs = new AbstractWorker(CapabilityType.DOCUMENTATION,
 *         CapabilityDescriptor.of("readme", "Writes README files"),
 *         Set.of(IntentType.DOCUMENTATION)) {
 *     protected JsonNode perform(WorkerContext context) {
 *         return context.toJsonNode(Map.of("readme", "# " + context.getDescription()));
 *     }
 * };
 * </pre>
 */
public abstract class AbstractWorker implements Worker {

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private static final ExecutorService SHARED_EXECUTOR = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "worker-" + THREAD_COUNTER.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final CapabilityType capabilityType;
    private final CapabilityDescriptor descriptor;
    private final Set<IntentType> handledIntents;
    private final Executor executor;
    private final ObjectMapper objectMapper;

    protected AbstractWorker(CapabilityType capabilityType, CapabilityDescriptor descriptor,
                             Set<IntentType> handledIntents) {
        this(capabilityType, descriptor, handledIntents, SHARED_EXECUTOR, new ObjectMapper());
    }

    protected AbstractWorker(CapabilityType capabilityType, CapabilityDescriptor descriptor,
                             Set<IntentType> handledIntents, Executor executor, ObjectMapper objectMapper) {
        this.capabilityType = capabilityType;
        this.descriptor = descriptor;
        this.handledIntents = Set.copyOf(handledIntents);
        this.executor = executor;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return descriptor.name();
    }

    @Override
    public CapabilityType capabilityType() {
        return capabilityType;
    }

    @Override
    public CapabilityDescriptor descriptor() {
        return descriptor;
    }

    /**
     * Accepts requests whose intent is in the handled set; an empty set accepts everything.
     */
    @Override
    public boolean canHandle(TaskRequest request) {
        return handledIntents.isEmpty() || handledIntents.contains(request.intent());
    }

    @Override
    public CompletableFuture<TaskResult> execute(TaskRequest request) {
        return CompletableFuture.supplyAsync(() -> run(request), executor);
    }

    /**
     * Execute the task body.
     *
     * @param context Execution context providing input and utilities
     * @return The result payload
     * @throws WorkerException if the task fails
     */
    protected abstract JsonNode perform(WorkerContext context);

    private TaskResult run(TaskRequest request) {
        long startNanos = System.nanoTime();
        WorkerContext context = new WorkerContext(request, objectMapper);

        log.debug("Worker {} executing task {}", name(), request.id());
        try {
            JsonNode payload = perform(context);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            log.debug("Worker {} completed task {} in {}ms", name(), request.id(), elapsed.toMillis());
            return TaskResult.success(
                request.id(), capabilityType, payload, elapsed, context.getUsage(), context.getConfidence());

        } catch (WorkerException e) {
            log.warn("Worker {} failed task {}: {} - {}", name(), request.id(), e.getErrorCode(), e.getMessage());
            throw new CompletionException(e);

        } catch (RuntimeException e) {
            log.error("Worker {} failed task {} with unexpected error", name(), request.id(), e);
            throw new CompletionException(new WorkerException("INTERNAL_ERROR", e.getMessage(), e, true));
        }
    }
}
