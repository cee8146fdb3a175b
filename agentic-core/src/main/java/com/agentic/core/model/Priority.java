package com.agentic.core.model;

/**
 * Task priority levels, ordered by weight.
 * Used as the first tie-break when several steps are ready at once.
 */
public enum Priority {
    LOW(1),
    MEDIUM(5),
    HIGH(8),
    CRITICAL(10);

    private final int weight;

    Priority(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }
}
