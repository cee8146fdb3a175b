package com.agentic.core.model;

import java.util.Locale;

/**
 * Named categories of work a worker can perform.
 */
public enum CapabilityType {
    CODE,
    INFRASTRUCTURE,
    TESTING,
    DEVOPS,
    DOCUMENTATION,
    SECURITY,
    PLANNING,
    REVIEW;

    /**
     * Lower-case wire value, e.g. {@code infrastructure}.
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
