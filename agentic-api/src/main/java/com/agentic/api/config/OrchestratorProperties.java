package com.agentic.api.config;

import com.agentic.core.model.IntentType;
import com.agentic.core.model.RetryPolicy;
import com.agentic.engine.execution.EngineSettings;
import com.agentic.engine.persistence.SessionSettings;
import com.agentic.worker.llm.LlmConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Orchestrator settings bound from the {@code agentic.*} namespace.
 * Every group may be omitted; missing values take the engine defaults.
 */
@ConfigurationProperties(prefix = "agentic")
public record OrchestratorProperties(
    Engine engine,
    Retry retry,
    Classifier classifier,
    Llm llm,
    Workers workers,
    Sessions sessions
) {
    public OrchestratorProperties {
        engine = engine != null ? engine : new Engine(null, null);
        retry = retry != null ? retry : new Retry(null, null, null, null);
        classifier = classifier != null ? classifier : new Classifier(null, null);
        llm = llm != null ? llm : new Llm(null, null, null, null, null, null, null, null);
        workers = workers != null ? workers : new Workers(null);
        sessions = sessions != null ? sessions : new Sessions(null, null);
    }

    public EngineSettings toEngineSettings() {
        return new EngineSettings(engine.maxConcurrentTasks(), retry.toPolicy(), engine.shutdownTimeout());
    }

    /** Dispatch limits. */
    public record Engine(Integer maxConcurrentTasks, Duration shutdownTimeout) {
        public Engine {
            maxConcurrentTasks = maxConcurrentTasks != null ? maxConcurrentTasks : EngineSettings.DEFAULT_MAX_CONCURRENT_TASKS;
            shutdownTimeout = shutdownTimeout != null ? shutdownTimeout : Duration.ofSeconds(30);
        }
    }

    /** Backoff between step attempts. */
    public record Retry(Duration initialBackoff, Duration maxBackoff, Double multiplier, Double jitter) {
        public Retry {
            RetryPolicy defaults = RetryPolicy.defaultPolicy();
            initialBackoff = initialBackoff != null ? initialBackoff : defaults.initialBackoff();
            maxBackoff = maxBackoff != null ? maxBackoff : defaults.maxBackoff();
            multiplier = multiplier != null ? multiplier : defaults.backoffMultiplier();
            jitter = jitter != null ? jitter : defaults.jitterFactor();
        }

        public RetryPolicy toPolicy() {
            return RetryPolicy.builder()
                .initialBackoff(initialBackoff)
                .maxBackoff(maxBackoff)
                .backoffMultiplier(multiplier)
                .jitterFactor(jitter)
                .build();
        }
    }

    /**
     * Intent classification.
     *
     * @param fallbackIntent wire value or name of the intent used when nothing matches
     * @param useLanguageModel whether inconclusive keyword scores are sent to the language model
     */
    public record Classifier(String fallbackIntent, Boolean useLanguageModel) {
        public Classifier {
            fallbackIntent = fallbackIntent != null ? fallbackIntent : IntentType.CODE_GENERATION.value();
            useLanguageModel = useLanguageModel != null ? useLanguageModel : Boolean.TRUE;
        }

        public IntentType fallback() {
            return IntentType.parse(fallbackIntent)
                .orElseThrow(() -> new IllegalArgumentException("Unknown fallback intent: " + fallbackIntent));
        }
    }

    /** Language-model provider. */
    public record Llm(
        String provider,
        String model,
        String apiKey,
        String baseUrl,
        Integer maxTokens,
        Double temperature,
        Duration timeout,
        Integer maxRetries
    ) {
        public Llm {
            provider = provider != null ? provider : "mock";
            model = model != null ? model : "mock-model";
            maxTokens = maxTokens != null ? maxTokens : 4000;
            temperature = temperature != null ? temperature : 0.7;
            timeout = timeout != null ? timeout : Duration.ofSeconds(30);
            maxRetries = maxRetries != null ? maxRetries : 3;
        }

        public LlmConfig toConfig() {
            return new LlmConfig(provider, model, apiKey, baseUrl, maxTokens, temperature, timeout, maxRetries);
        }

        @Override
        public String toString() {
            return "Llm[provider=" + provider + ", model=" + model + ", baseUrl=" + baseUrl + "]";
        }
    }

    /**
     * Session store limits.
     *
     * @param maxSessions sessions kept before the least recently active one is evicted
     * @param timeout idle time after which a session is dropped, at least five minutes
     */
    public record Sessions(Integer maxSessions, Duration timeout) {
        public Sessions {
            maxSessions = maxSessions != null ? maxSessions : SessionSettings.DEFAULT_MAX_SESSIONS;
            timeout = timeout != null ? timeout : SessionSettings.DEFAULT_IDLE_TIMEOUT;
        }

        public SessionSettings toSettings() {
            return new SessionSettings(maxSessions, timeout);
        }
    }

    /** Built-in demonstration workers. */
    public record Workers(Boolean demoEnabled) {
        public Workers {
            demoEnabled = demoEnabled != null ? demoEnabled : Boolean.TRUE;
        }
    }
}
