package com.agentic.worker.llm;

import java.util.List;

/**
 * A chat-completion request. Null sampling fields fall back to the gateway's {@link LlmConfig}.
 */
public record LlmRequest(
    List<LlmMessage> messages,
    Integer maxTokens,
    Double temperature
) {
    public LlmRequest {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("At least one message is required");
        }
        messages = List.copyOf(messages);
    }

    public static LlmRequest of(String systemPrompt, String userPrompt) {
        return new LlmRequest(List.of(LlmMessage.system(systemPrompt), LlmMessage.user(userPrompt)), null, null);
    }

    /**
     * Content of the last user message, or empty when there is none.
     */
    public String lastUserContent() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if ("user".equals(messages.get(i).role())) {
                return messages.get(i).content();
            }
        }
        return "";
    }
}
