package com.agentic.worker.llm;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * Connection and sampling settings for a language-model provider.
 *
 * Invariants:
 * - provider is one of {@link #PROVIDERS}
 * - temperature in [0.0, 2.0]
 * - timeout in [1s, 300s]
 * - maxRetries in [0, 10]
 */
public record LlmConfig(
    String provider,
    String model,
    String apiKey,
    String baseUrl,
    int maxTokens,
    double temperature,
    Duration timeout,
    int maxRetries
) {
    public static final Set<String> PROVIDERS = Set.of("openai", "anthropic", "claude", "deepseek", "mock");

    public LlmConfig {
        provider = provider != null ? provider.trim().toLowerCase(Locale.ROOT) : "openai";
        if (!PROVIDERS.contains(provider)) {
            throw new IllegalArgumentException("Unsupported provider: " + provider + ", expected one of " + PROVIDERS);
        }
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model must not be blank");
        }
        if (maxTokens < 1) {
            throw new IllegalArgumentException("maxTokens must be >= 1");
        }
        if (temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException("temperature must be in [0.0, 2.0]: " + temperature);
        }
        timeout = timeout != null ? timeout : Duration.ofSeconds(30);
        if (timeout.compareTo(Duration.ofSeconds(1)) < 0 || timeout.compareTo(Duration.ofSeconds(300)) > 0) {
            throw new IllegalArgumentException("timeout must be in [1s, 300s]: " + timeout);
        }
        if (maxRetries < 0 || maxRetries > 10) {
            throw new IllegalArgumentException("maxRetries must be in [0, 10]: " + maxRetries);
        }
        baseUrl = baseUrl != null && !baseUrl.isBlank() ? stripTrailingSlash(baseUrl.trim()) : defaultBaseUrl(provider);
    }

    /**
     * Settings for the offline mock provider.
     */
    public static LlmConfig mock() {
        return new LlmConfig("mock", "mock-model", null, null, 4000, 0.7, Duration.ofSeconds(30), 0);
    }

    public boolean isMock() {
        return "mock".equals(provider);
    }

    private static String defaultBaseUrl(String provider) {
        return switch (provider) {
            case "anthropic", "claude" -> "https://api.anthropic.com/v1";
            case "deepseek" -> "https://api.deepseek.com/v1";
            case "mock" -> "http://localhost";
            default -> "https://api.openai.com/v1";
        };
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public String toString() {
        // Never print the key.
        return "LlmConfig[provider=" + provider + ", model=" + model + ", baseUrl=" + baseUrl
            + ", maxTokens=" + maxTokens + ", temperature=" + temperature
            + ", timeout=" + timeout + ", maxRetries=" + maxRetries + "]";
    }
}
