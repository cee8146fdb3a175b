package com.agentic.core.model;

/**
 * Opaque resource counters reported by a worker.
 *
 * Invariants:
 * - tokensUsed >= 0
 * - cost >= 0
 */
public record ResourceUsage(long tokensUsed, double cost) {

    private static final ResourceUsage NONE = new ResourceUsage(0, 0.0);

    public ResourceUsage {
        if (tokensUsed < 0) {
            throw new IllegalArgumentException("tokensUsed cannot be negative");
        }
        if (cost < 0) {
            throw new IllegalArgumentException("cost cannot be negative");
        }
    }

    public static ResourceUsage none() {
        return NONE;
    }

    public static ResourceUsage of(long tokensUsed, double cost) {
        return new ResourceUsage(tokensUsed, cost);
    }

    public ResourceUsage plus(ResourceUsage other) {
        if (other == null) {
            return this;
        }
        return new ResourceUsage(tokensUsed + other.tokensUsed, cost + other.cost);
    }
}
