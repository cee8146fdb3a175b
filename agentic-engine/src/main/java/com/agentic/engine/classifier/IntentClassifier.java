package com.agentic.engine.classifier;

import com.agentic.core.model.ExecutionContext;
import com.agentic.core.model.IntentType;

/**
 * Maps a user instruction to exactly one intent.
 * Implementations are pure with respect to orchestrator state.
 */
@FunctionalInterface
public interface IntentClassifier {

    /**
     * Classify the instruction. Never throws for non-blank input.
     */
    IntentType classify(String text, ExecutionContext context);
}
