package com.agentic.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of intents a user instruction can be classified into.
 */
public enum IntentType {
    CODE_GENERATION("code_generation"),
    CODE_REVIEW("code_review"),
    REFACTORING("refactoring"),
    INFRASTRUCTURE_SETUP("infrastructure_setup"),
    TESTING("testing"),
    DEPLOYMENT("deployment"),
    DOCUMENTATION("documentation"),
    DEBUGGING("debugging"),
    SECURITY_SCAN("security_scan"),
    EXPLANATION("explanation"),
    PROJECT_SETUP("project_setup");

    private final String value;

    IntentType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parse an intent from its wire value or enum name, ignoring case and surrounding
     * whitespace. Returns empty for anything outside the closed set.
     */
    public static Optional<IntentType> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (IntentType intent : values()) {
            if (intent.value.equals(normalized) || intent.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(intent);
            }
        }
        return Optional.empty();
    }
}
