package com.agentic.core.model;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Backoff behavior between step attempts.
 * The number of attempts is not part of the policy: it is the retry budget of each request.
 *
 * Invariants:
 * - initialBackoff >= 0
 * - maxBackoff >= initialBackoff
 * - backoffMultiplier >= 1.0
 * - jitterFactor in [0.0, 1.0]
 */
public record RetryPolicy(
    Duration initialBackoff,
    Duration maxBackoff,
    double backoffMultiplier,
    double jitterFactor,
    Set<String> nonRetryableErrors
) {
    public RetryPolicy {
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be >= 0");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0.0, 1.0]");
        }
        nonRetryableErrors = nonRetryableErrors != null ? Set.copyOf(nonRetryableErrors) : Set.of();
    }

    /**
     * Default policy: exponential backoff starting at 1s, capped at 30s.
     * Validation, planning and dispatch errors are never retried.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(
            Duration.ofSeconds(1),
            Duration.ofSeconds(30),
            2.0,
            0.1,
            Set.of("VALIDATION_ERROR", "PLANNING_ERROR", "DISPATCH_ERROR")
        );
    }

    /**
     * Retry immediately. Used by tests and the demo.
     */
    public static RetryPolicy noBackoff() {
        return new RetryPolicy(
            Duration.ZERO,
            Duration.ZERO,
            1.0,
            0.0,
            Set.of("VALIDATION_ERROR", "PLANNING_ERROR", "DISPATCH_ERROR")
        );
    }

    /**
     * Compute the delay before the given retry.
     *
     * @param retryNumber 1-indexed retry number
     * @return Duration to wait before re-enqueueing the step
     */
    public Duration computeBackoff(int retryNumber) {
        if (retryNumber < 1) {
            throw new IllegalArgumentException("Retry number must be >= 1");
        }

        // initialBackoff * (multiplier ^ (retry - 1))
        double baseBackoffMs = initialBackoff.toMillis() *
            Math.pow(backoffMultiplier, retryNumber - 1);

        double cappedBackoffMs = Math.min(baseBackoffMs, maxBackoff.toMillis());

        // backoff * (1 - jitter + random(0, 2*jitter))
        double jitterRange = cappedBackoffMs * jitterFactor;
        double jitteredBackoffMs = cappedBackoffMs - jitterRange +
            ThreadLocalRandom.current().nextDouble() * 2 * jitterRange;

        return Duration.ofMillis((long) jitteredBackoffMs);
    }

    /**
     * Check if the given error code may be retried at all.
     */
    public boolean shouldRetry(String errorCode) {
        return errorCode == null || !nonRetryableErrors.contains(errorCode);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(30);
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.1;
        private Set<String> nonRetryableErrors = Set.of("VALIDATION_ERROR", "PLANNING_ERROR", "DISPATCH_ERROR");

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }

        public Builder nonRetryableErrors(Set<String> nonRetryableErrors) {
            this.nonRetryableErrors = nonRetryableErrors;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(
                initialBackoff, maxBackoff, backoffMultiplier, jitterFactor, nonRetryableErrors
            );
        }
    }
}
