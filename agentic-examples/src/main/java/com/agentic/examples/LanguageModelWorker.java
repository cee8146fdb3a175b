package com.agentic.examples;

import com.agentic.core.exception.LlmException;
import com.agentic.core.exception.WorkerException;
import com.agentic.core.model.CapabilityDescriptor;
import com.agentic.core.model.CapabilityType;
import com.agentic.core.model.ExecutionContext;
import com.agentic.worker.AbstractWorker;
import com.agentic.worker.WorkerContext;
import com.agentic.worker.llm.LanguageModelGateway;
import com.agentic.worker.llm.LlmRequest;
import com.agentic.worker.llm.LlmResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Worker that delegates its capability to a language model.
 *
 * The model is asked for a JSON object; anything else is wrapped as
 * {@code {"content": <raw answer>}} with a lower confidence.
 */
public class LanguageModelWorker extends AbstractWorker {

    static final double STRUCTURED_CONFIDENCE = 0.85;
    static final double UNSTRUCTURED_CONFIDENCE = 0.6;
    static final double COST_PER_TOKEN = 0.000002;

    private final LanguageModelGateway gateway;
    private final String systemPrompt;
    private final Duration timeout;

    public LanguageModelWorker(CapabilityType capabilityType, CapabilityDescriptor descriptor,
                               String systemPrompt, LanguageModelGateway gateway, Duration timeout) {
        super(capabilityType, descriptor, Set.of());
        this.gateway = gateway;
        this.systemPrompt = systemPrompt;
        this.timeout = timeout;
    }

    @Override
    protected JsonNode perform(WorkerContext context) {
        LlmResponse response = ask(LlmRequest.of(systemPrompt, userPrompt(context)));
        context.recordUsage(response.tokensUsed(), response.tokensUsed() * COST_PER_TOKEN);

        JsonNode parsed = parse(context, response.content());
        if (parsed != null && parsed.isObject()) {
            context.setConfidence(STRUCTURED_CONFIDENCE);
            return parsed;
        }
        context.setConfidence(UNSTRUCTURED_CONFIDENCE);
        ObjectNode wrapped = context.getObjectMapper().createObjectNode();
        wrapped.put("content", response.content());
        return wrapped;
    }

    private LlmResponse ask(LlmRequest request) {
        try {
            return gateway.complete(request).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerException("Interrupted while waiting for " + gateway.provider(), e);
        } catch (TimeoutException e) {
            throw new WorkerException(String.format("%s did not answer within %dms", gateway.provider(), timeout.toMillis()), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof LlmException llm) {
                throw new WorkerException(llm.getErrorCode(), llm.getMessage(), llm, llm.isRetryable());
            }
            throw new WorkerException("Language model call failed: " + cause.getMessage(), cause);
        }
    }

    private JsonNode parse(WorkerContext context, String content) {
        String trimmed = stripFences(content.trim());
        if (!trimmed.startsWith("{")) {
            return null;
        }
        try {
            return context.getObjectMapper().readTree(trimmed);
        } catch (JsonProcessingException e) {
            log.debug("Answer of {} is not valid JSON, wrapping raw text", name());
            return null;
        }
    }

    // Models often wrap JSON in ```json fences.
    private static String stripFences(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        int closing = text.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return text;
        }
        return text.substring(firstNewline + 1, closing).trim();
    }

    private static String userPrompt(WorkerContext context) {
        StringBuilder prompt = new StringBuilder(context.getDescription());
        ExecutionContext execution = context.getExecutionContext();
        if (execution != null) {
            if (execution.language() != null) {
                prompt.append("\nLanguage: ").append(execution.language());
            }
            if (execution.framework() != null) {
                prompt.append("\nFramework: ").append(execution.framework());
            }
            prompt.append("\nWorkspace: ").append(execution.workspacePath());
        }
        return prompt.toString();
    }
}
