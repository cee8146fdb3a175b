package com.agentic.worker.llm;

/**
 * Text produced by a language model together with its token accounting.
 */
public record LlmResponse(
    String content,
    String model,
    long tokensUsed,
    String finishReason
) {
    public LlmResponse {
        content = content != null ? content : "";
        if (tokensUsed < 0) {
            throw new IllegalArgumentException("tokensUsed must be >= 0");
        }
    }
}
