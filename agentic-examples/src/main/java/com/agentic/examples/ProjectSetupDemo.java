package com.agentic.examples;

import com.agentic.core.model.IntentType;
import com.agentic.core.model.RetryPolicy;
import com.agentic.core.model.TaskStatus;
import com.agentic.engine.classifier.ChainedIntentClassifier;
import com.agentic.engine.classifier.KeywordIntentClassifier;
import com.agentic.engine.classifier.LanguageModelIntentClassifier;
import com.agentic.engine.coordinator.OrchestrationCoordinator;
import com.agentic.engine.coordinator.RequestValidator;
import com.agentic.engine.coordinator.ResultAggregator;
import com.agentic.engine.execution.EngineSettings;
import com.agentic.engine.execution.ExecutionEngine;
import com.agentic.engine.metrics.OrchestratorMetrics;
import com.agentic.engine.persistence.InMemoryPlanRepository;
import com.agentic.engine.persistence.InMemorySessionContextStore;
import com.agentic.engine.planner.TaskPlanner;
import com.agentic.engine.registry.CapabilityRegistry;
import com.agentic.engine.service.OrchestrationService.AsyncTaskResponse;
import com.agentic.engine.service.OrchestrationService.OrchestrationOutcome;
import com.agentic.engine.service.OrchestrationService.SubmitRequest;
import com.agentic.engine.service.OrchestrationService.SubmitResponse;
import com.agentic.engine.service.OrchestrationService.TaskStatusView;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Demonstration runner wiring the whole orchestrator without Spring.
 *
 * Shows:
 * 1. A single-step code request
 * 2. A project setup decomposed into dependent steps
 * 3. An asynchronous request polled to completion
 * 4. A request rejected by validation
 */
public class ProjectSetupDemo {

    private static final Logger log = LoggerFactory.getLogger(ProjectSetupDemo.class);
    private static final String SESSION = "demo-session";

    private final ExecutionEngine engine;
    private final InMemorySessionContextStore sessionStore;
    private final OrchestrationCoordinator coordinator;

    public ProjectSetupDemo(MockLanguageModelGateway gateway) {
        ObjectMapper mapper = new ObjectMapper();
        OrchestratorMetrics metrics = new OrchestratorMetrics();
        CapabilityRegistry registry = new CapabilityRegistry();
        ExampleWorkers.registerAll(registry, gateway);

        InMemoryPlanRepository planRepository = new InMemoryPlanRepository();
        sessionStore = new InMemorySessionContextStore();
        sessionStore.initialize();

        engine = new ExecutionEngine(registry, planRepository,
            new EngineSettings(4, RetryPolicy.defaultPolicy(), Duration.ofSeconds(10)), metrics);
        ChainedIntentClassifier classifier = new ChainedIntentClassifier(
            new KeywordIntentClassifier(),
            new LanguageModelIntentClassifier(gateway, Duration.ofSeconds(5)),
            IntentType.CODE_GENERATION,
            metrics);
        coordinator = new OrchestrationCoordinator(classifier, new TaskPlanner(registry), engine, registry,
            planRepository, sessionStore, new RequestValidator(), new ResultAggregator(mapper));
    }

    public static void main(String[] args) throws Exception {
        ProjectSetupDemo demo = new ProjectSetupDemo(new MockLanguageModelGateway(Duration.ofMillis(200)));

        log.info("╔══════════════════════════════════════════════════════════════════════╗");
        log.info("║        AGENTIC ORCHESTRATOR - PROJECT SETUP DEMONSTRATION            ║");
        log.info("╚══════════════════════════════════════════════════════════════════════╝");

        try {
            demo.runSimpleRequest();
            demo.runProjectSetup();
            demo.runAsyncRequest();
            demo.runRejectedRequest();
        } finally {
            demo.close();
        }

        log.info("╔══════════════════════════════════════════════════════════════════════╗");
        log.info("║                    ALL DEMONSTRATIONS COMPLETE                       ║");
        log.info("╚══════════════════════════════════════════════════════════════════════╝");
    }

    /**
     * SCENARIO 1: one instruction, one capability.
     */
    public SubmitResponse runSimpleRequest() {
        banner("SCENARIO 1: Single-step code generation");
        SubmitResponse response = coordinator.submit(SubmitRequest.of("Create a FastAPI endpoint for items", SESSION));
        report(response.response());
        return response;
    }

    /**
     * SCENARIO 2: infrastructure, then code, then tests and documentation in parallel.
     */
    public SubmitResponse runProjectSetup() {
        banner("SCENARIO 2: Project setup across four capabilities");
        SubmitResponse response = coordinator.submit(
            SubmitRequest.of("Scaffold a new project for a React todo app", SESSION));
        report(response.response());
        return response;
    }

    /**
     * SCENARIO 3: submit, then poll the task until it is terminal.
     */
    public TaskStatusView runAsyncRequest() throws InterruptedException {
        banner("SCENARIO 3: Asynchronous request");
        AsyncTaskResponse ack = coordinator.submitAsync(SubmitRequest.of("Write tests for the todo API", SESSION));
        log.info("Task {} accepted with status {}, estimated {}s",
            ack.taskId(), ack.status(), ack.estimatedDuration().toSeconds());

        TaskStatusView view = coordinator.getStatus(ack.taskId());
        while (!view.status().isTerminal()) {
            log.info("  ... {} ({}%)", view.status(), Math.round(view.progress()));
            Thread.sleep(100);
            view = coordinator.getStatus(ack.taskId());
        }
        log.info("Task {} finished {}", ack.taskId(), view.status());
        return view;
    }

    /**
     * SCENARIO 4: an empty instruction never reaches the planner.
     */
    public SubmitResponse runRejectedRequest() {
        banner("SCENARIO 4: Validation failure");
        SubmitResponse response = coordinator.submit(SubmitRequest.of(" ", SESSION));
        report(response.response());
        return response;
    }

    public void close() {
        engine.shutdown(Duration.ofSeconds(5));
        log.info("Session {} holds {} message(s)", SESSION,
            coordinator.getSession(SESSION).conversationHistory().size());
        sessionStore.close();
    }

    private static void report(OrchestrationOutcome outcome) {
        if (outcome.status() == TaskStatus.COMPLETED) {
            log.info("✓ {} completed in {} step(s), {}ms, {} token(s)",
                outcome.intent().value(), outcome.stepCount(), outcome.executionTime().toMillis(),
                outcome.usage().tokensUsed());
        } else {
            log.info("✗ {} - {}: {}", outcome.status(), outcome.errorCode(), outcome.error());
        }
    }

    private static void banner(String title) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════════════");
        log.info(title);
        log.info("═══════════════════════════════════════════════════════════════════════");
    }
}
