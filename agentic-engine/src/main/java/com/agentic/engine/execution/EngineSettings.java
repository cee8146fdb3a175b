package com.agentic.engine.execution;

import com.agentic.core.model.RetryPolicy;

import java.time.Duration;

/**
 * Tuning for the execution engine.
 *
 * Invariants:
 * - maxConcurrentTasks in [1, 100], global across plans
 * - shutdownTimeout >= 0
 */
public record EngineSettings(
    int maxConcurrentTasks,
    RetryPolicy retryPolicy,
    Duration shutdownTimeout
) {
    public static final int DEFAULT_MAX_CONCURRENT_TASKS = 10;

    public EngineSettings {
        if (maxConcurrentTasks < 1 || maxConcurrentTasks > 100) {
            throw new IllegalArgumentException("maxConcurrentTasks must be in [1, 100]: " + maxConcurrentTasks);
        }
        retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
        shutdownTimeout = shutdownTimeout != null ? shutdownTimeout : Duration.ofSeconds(30);
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must be >= 0");
        }
    }

    public static EngineSettings defaults() {
        return new EngineSettings(DEFAULT_MAX_CONCURRENT_TASKS, RetryPolicy.defaultPolicy(), Duration.ofSeconds(30));
    }

    public EngineSettings withMaxConcurrentTasks(int max) {
        return new EngineSettings(max, retryPolicy, shutdownTimeout);
    }

    public EngineSettings withRetryPolicy(RetryPolicy policy) {
        return new EngineSettings(maxConcurrentTasks, policy, shutdownTimeout);
    }
}
