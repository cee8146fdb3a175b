package com.agentic.worker.llm;

import com.agentic.core.exception.LlmException;
import com.agentic.core.model.RetryPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * Gateway for OpenAI-compatible chat-completion endpoints.
 *
 * Transport failures, HTTP 429 and 5xx responses are retried up to
 * {@link LlmConfig#maxRetries()} times with exponential backoff; other
 * HTTP errors and unparseable bodies fail immediately.
 */
public class HttpLanguageModelGateway implements LanguageModelGateway {

    private static final Logger log = LoggerFactory.getLogger(HttpLanguageModelGateway.class);

    private final LlmConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;

    public HttpLanguageModelGateway(LlmConfig config) {
        this(config, RetryPolicy.builder()
            .initialBackoff(Duration.ofMillis(500))
            .maxBackoff(Duration.ofSeconds(10))
            .build());
    }

    public HttpLanguageModelGateway(LlmConfig config, RetryPolicy retryPolicy) {
        this.config = config;
        this.retryPolicy = retryPolicy;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String provider() {
        return config.provider();
    }

    @Override
    public CompletableFuture<LlmResponse> complete(LlmRequest request) {
        HttpRequest httpRequest;
        try {
            httpRequest = buildRequest(request);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                new LlmException(config.provider(), config.model(), 0, "Cannot encode request", e));
        }
        return attempt(httpRequest, 1);
    }

    private CompletableFuture<LlmResponse> attempt(HttpRequest httpRequest, int attemptNumber) {
        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
            .handle((response, error) -> {
                if (error != null) {
                    return Outcome.retryable(new LlmException(config.provider(), config.model(), 0,
                        "Transport failure: " + rootMessage(error), error));
                }
                int status = response.statusCode();
                if (status == 429 || status >= 500) {
                    return Outcome.retryable(new LlmException(config.provider(), config.model(), 0,
                        "HTTP " + status + ": " + abbreviate(response.body())));
                }
                if (status != 200) {
                    return Outcome.fatal(new LlmException(config.provider(), config.model(), 0,
                        "HTTP " + status + ": " + abbreviate(response.body())));
                }
                try {
                    return Outcome.success(parseResponse(response.body()));
                } catch (LlmException e) {
                    return Outcome.fatal(e);
                }
            })
            .thenCompose(outcome -> {
                if (outcome.response() != null) {
                    return CompletableFuture.completedFuture(outcome.response());
                }
                if (outcome.retryable() && attemptNumber <= config.maxRetries()) {
                    Duration backoff = retryPolicy.computeBackoff(attemptNumber);
                    log.warn("LLM call to {} failed (attempt {}), retrying in {}ms: {}",
                        config.provider(), attemptNumber, backoff.toMillis(), outcome.error().getMessage());
                    return CompletableFuture.supplyAsync(() -> httpRequest,
                            CompletableFuture.delayedExecutor(backoff.toMillis(), TimeUnit.MILLISECONDS))
                        .thenCompose(same -> attempt(same, attemptNumber + 1));
                }
                log.error("LLM call to {} failed after {} attempt(s): {}",
                    config.provider(), attemptNumber, outcome.error().getMessage());
                return CompletableFuture.failedFuture(outcome.error());
            });
    }

    HttpRequest buildRequest(LlmRequest request) throws JsonProcessingException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", config.model());
        body.put("max_tokens", request.maxTokens() != null ? request.maxTokens() : config.maxTokens());
        body.put("temperature", request.temperature() != null ? request.temperature() : config.temperature());
        ArrayNode messages = body.putArray("messages");
        for (LlmMessage message : request.messages()) {
            messages.addObject()
                .put("role", message.role())
                .put("content", message.content());
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(config.baseUrl() + "/chat/completions"))
            .timeout(config.timeout())
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
        if (config.apiKey() != null && !config.apiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + config.apiKey());
        }
        return builder.build();
    }

    LlmResponse parseResponse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new LlmException(config.provider(), config.model(), 0, "Unparseable response body", e);
        }
        long tokens = root.path("usage").path("total_tokens").asLong(0);
        JsonNode choice = root.path("choices").path(0);
        JsonNode content = choice.path("message").path("content");
        if (content.isMissingNode() || content.isNull()) {
            throw new LlmException(config.provider(), config.model(), tokens, "Response has no message content");
        }
        return new LlmResponse(
            content.asText(),
            root.path("model").asText(config.model()),
            tokens,
            choice.path("finish_reason").asText(null)
        );
    }

    private static String rootMessage(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        return cause.getClass().getSimpleName() + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }

    private record Outcome(LlmResponse response, LlmException error, boolean retryable) {
        static Outcome success(LlmResponse response) {
            return new Outcome(response, null, false);
        }

        static Outcome retryable(LlmException error) {
            return new Outcome(null, error, true);
        }

        static Outcome fatal(LlmException error) {
            return new Outcome(null, error, false);
        }
    }
}
