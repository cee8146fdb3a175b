package com.agentic.worker;

import com.agentic.core.model.CapabilityDescriptor;
import com.agentic.core.model.CapabilityType;
import com.agentic.core.model.TaskRequest;
import com.agentic.core.model.TaskResult;
import java.util.concurrent.CompletableFuture;

/**
 * Contract for anything that can execute a task for one capability type.
 * Workers are registered with the capability registry and resolved by the
 * execution engine; they never see plans or other steps.
 *
 * Implementations report failure either by completing the future exceptionally
 * (preferably with a {@link com.agentic.core.exception.WorkerException}) or by
 * completing it with a FAILED {@link TaskResult}. Both count against the step's
 * retry budget unless the exception is marked non-retryable.
 */
public interface Worker {

    /**
     * Stable name used in logs and metrics.
     */
    default String name() {
        return getClass().getSimpleName();
    }

    CapabilityType capabilityType();

    /**
     * What this worker does, shown in capability listings and used for estimates.
     */
    CapabilityDescriptor descriptor();

    /**
     * Whether this worker accepts the request. Must be cheap and side-effect free.
     */
    boolean canHandle(TaskRequest request);

    /**
     * Execute the request asynchronously. Must not block the calling thread.
     */
    CompletableFuture<TaskResult> execute(TaskRequest request);
}
