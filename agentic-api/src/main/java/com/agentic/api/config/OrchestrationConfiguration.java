package com.agentic.api.config;

import com.agentic.core.repository.PlanRepository;
import com.agentic.core.repository.SessionContextStore;
import com.agentic.engine.classifier.ChainedIntentClassifier;
import com.agentic.engine.classifier.IntentClassifier;
import com.agentic.engine.classifier.KeywordIntentClassifier;
import com.agentic.engine.classifier.LanguageModelIntentClassifier;
import com.agentic.engine.coordinator.OrchestrationCoordinator;
import com.agentic.engine.coordinator.RequestValidator;
import com.agentic.engine.coordinator.ResultAggregator;
import com.agentic.engine.execution.EngineSettings;
import com.agentic.engine.execution.ExecutionEngine;
import com.agentic.engine.execution.PlanSnapshotSerializer;
import com.agentic.engine.metrics.OrchestratorMetrics;
import com.agentic.engine.persistence.SessionSettings;
import com.agentic.engine.planner.TaskPlanner;
import com.agentic.engine.registry.CapabilityRegistry;
import com.agentic.engine.service.OrchestrationService;
import com.agentic.examples.ExampleWorkers;
import com.agentic.examples.MockLanguageModelGateway;
import com.agentic.worker.llm.HttpLanguageModelGateway;
import com.agentic.worker.llm.LanguageModelGateway;
import com.agentic.worker.llm.LlmConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Wires the orchestration stack from {@link OrchestratorProperties}.
 * Repositories, metrics, health and shutdown handling are picked up by component scanning.
 */
@Configuration
@EnableConfigurationProperties(OrchestratorProperties.class)
public class OrchestrationConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationConfiguration.class);

    // ========== Workers ==========

    @Bean
    public LanguageModelGateway languageModelGateway(OrchestratorProperties properties, ObjectMapper objectMapper) {
        LlmConfig config = properties.llm().toConfig();
        log.info("Language model gateway: {}", config);
        if (config.isMock()) {
            return new MockLanguageModelGateway(Duration.ZERO, objectMapper);
        }
        return new HttpLanguageModelGateway(config);
    }

    @Bean
    public CapabilityRegistry capabilityRegistry(OrchestratorProperties properties, LanguageModelGateway gateway) {
        CapabilityRegistry registry = new CapabilityRegistry();
        if (properties.workers().demoEnabled()) {
            ExampleWorkers.registerAll(registry, gateway);
            log.info("Registered {} demonstration workers", registry.size());
        } else {
            log.warn("Demonstration workers disabled, register workers before submitting requests");
        }
        return registry;
    }

    // ========== Engine ==========

    @Bean
    public EngineSettings engineSettings(OrchestratorProperties properties) {
        return properties.toEngineSettings();
    }

    @Bean
    public ExecutionEngine executionEngine(
            CapabilityRegistry registry,
            PlanRepository planRepository,
            EngineSettings settings,
            OrchestratorMetrics metrics) {
        return new ExecutionEngine(registry, planRepository, settings, metrics);
    }

    @Bean
    public PlanSnapshotSerializer planSnapshotSerializer() {
        return new PlanSnapshotSerializer();
    }

    // ========== Classification & Planning ==========

    @Bean
    public IntentClassifier intentClassifier(
            OrchestratorProperties properties,
            LanguageModelGateway gateway,
            OrchestratorMetrics metrics) {
        OrchestratorProperties.Classifier settings = properties.classifier();
        LanguageModelIntentClassifier languageModel = settings.useLanguageModel()
            ? new LanguageModelIntentClassifier(gateway, properties.llm().timeout(), settings.fallback())
            : null;
        return new ChainedIntentClassifier(
            new KeywordIntentClassifier(settings.fallback()), languageModel, settings.fallback(), metrics);
    }

    @Bean
    public TaskPlanner taskPlanner(CapabilityRegistry registry) {
        return new TaskPlanner(registry);
    }

    // ========== Façade ==========

    @Bean
    public OrchestrationService orchestrationService(
            IntentClassifier classifier,
            TaskPlanner planner,
            ExecutionEngine engine,
            CapabilityRegistry registry,
            PlanRepository planRepository,
            SessionContextStore sessionStore,
            ObjectMapper objectMapper) {
        return new OrchestrationCoordinator(
            classifier, planner, engine, registry, planRepository, sessionStore,
            new RequestValidator(), new ResultAggregator(objectMapper));
    }

    // ========== Sessions ==========

    @Bean
    public SessionSettings sessionSettings(OrchestratorProperties properties) {
        return properties.sessions().toSettings();
    }

    /**
     * Open the session store once every singleton exists.
     */
    @Bean
    public SmartInitializingSingleton sessionStoreInitializer(SessionContextStore sessionStore) {
        return sessionStore::initialize;
    }
}
