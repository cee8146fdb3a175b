package com.agentic.worker.llm;

import java.util.concurrent.CompletableFuture;

/**
 * Narrow access to a language model.
 * Failures complete the future with a {@link com.agentic.core.exception.LlmException}.
 */
public interface LanguageModelGateway {

    CompletableFuture<LlmResponse> complete(LlmRequest request);

    /**
     * Provider name, e.g. {@code openai} or {@code mock}.
     */
    String provider();
}
