package com.agentic.engine.classifier;

import com.agentic.core.model.ExecutionContext;
import com.agentic.core.model.IntentType;
import com.agentic.worker.llm.LanguageModelGateway;
import com.agentic.worker.llm.LlmRequest;
import com.agentic.worker.llm.LlmResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Asks a language model to name the intent.
 * Any failure, timeout or answer outside the closed set yields no signal.
 */
public class LanguageModelIntentClassifier implements IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(LanguageModelIntentClassifier.class);

    static final String SYSTEM_PROMPT = "You classify software-engineering requests. "
        + "Answer with exactly one of: "
        + Arrays.stream(IntentType.values()).map(IntentType::value).collect(Collectors.joining(", "))
        + ". Answer with the value only.";

    private final LanguageModelGateway gateway;
    private final Duration timeout;
    private final IntentType fallback;

    public LanguageModelIntentClassifier(LanguageModelGateway gateway, Duration timeout) {
        this(gateway, timeout, IntentType.CODE_GENERATION);
    }

    public LanguageModelIntentClassifier(LanguageModelGateway gateway, Duration timeout, IntentType fallback) {
        this.gateway = gateway;
        this.timeout = timeout;
        this.fallback = fallback;
    }

    @Override
    public IntentType classify(String text, ExecutionContext context) {
        return suggest(text, context).orElse(fallback);
    }

    /**
     * The model's intent, or empty when the model gave no usable answer.
     */
    public Optional<IntentType> suggest(String text, ExecutionContext context) {
        try {
            LlmResponse response = gateway.complete(LlmRequest.of(SYSTEM_PROMPT, userPrompt(text, context)))
                .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            Optional<IntentType> intent = parseAnswer(response.content());
            if (intent.isEmpty()) {
                log.warn("Language model answered outside the intent set: '{}'", abbreviate(response.content()));
            }
            return intent;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for intent classification");
            return Optional.empty();
        } catch (TimeoutException e) {
            log.warn("Intent classification timed out after {}ms", timeout.toMillis());
            return Optional.empty();
        } catch (ExecutionException e) {
            log.warn("Intent classification failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Intent classification failed", e);
            return Optional.empty();
        }
    }

    /**
     * Accepts a bare value or name, optionally quoted or followed by punctuation.
     */
    static Optional<IntentType> parseAnswer(String answer) {
        if (answer == null) {
            return Optional.empty();
        }
        String cleaned = answer.trim().replaceAll("^[\"'`]+|[\"'`.!]+$", "");
        Optional<IntentType> exact = IntentType.parse(cleaned);
        if (exact.isPresent()) {
            return exact;
        }
        String firstLine = cleaned.lines().findFirst().orElse("");
        return IntentType.parse(firstLine.replaceAll("[\"'`.!]", ""));
    }

    private static String userPrompt(String text, ExecutionContext context) {
        StringBuilder prompt = new StringBuilder("Request: ").append(text);
        if (context != null && context.language() != null) {
            prompt.append("\nLanguage: ").append(context.language());
        }
        if (context != null && context.framework() != null) {
            prompt.append("\nFramework: ").append(context.framework());
        }
        return prompt.toString();
    }

    private static String abbreviate(String text) {
        return text.length() > 80 ? text.substring(0, 80) + "..." : text;
    }
}
