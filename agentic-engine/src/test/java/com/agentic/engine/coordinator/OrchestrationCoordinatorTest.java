package com.agentic.engine.coordinator;

import com.agentic.core.exception.NotFoundException;
import com.agentic.core.exception.PlanningException;
import com.agentic.core.exception.ValidationException;
import com.agentic.core.model.*;
import com.agentic.engine.classifier.ChainedIntentClassifier;
import com.agentic.engine.classifier.KeywordIntentClassifier;
import com.agentic.engine.execution.EngineSettings;
import com.agentic.engine.execution.ExecutionEngine;
import com.agentic.engine.metrics.OrchestratorMetrics;
import com.agentic.engine.persistence.InMemoryPlanRepository;
import com.agentic.engine.persistence.InMemorySessionContextStore;
import com.agentic.engine.planner.TaskPlanner;
import com.agentic.engine.registry.CapabilityRegistry;
import com.agentic.engine.service.OrchestrationService.*;
import com.agentic.engine.test.ScriptedWorker;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class OrchestrationCoordinatorTest {

    private static final String SESSION = "chat-42";

    private CapabilityRegistry registry;
    private InMemoryPlanRepository planRepository;
    private InMemorySessionContextStore sessionStore;
    private ExecutionEngine engine;
    private OrchestrationCoordinator coordinator;

    @BeforeEach
    void setUp() {
        registry = new CapabilityRegistry();
        planRepository = new InMemoryPlanRepository();
        sessionStore = new InMemorySessionContextStore();
        sessionStore.initialize();
        OrchestratorMetrics metrics = new OrchestratorMetrics();
        engine = new ExecutionEngine(registry, planRepository,
            new EngineSettings(4, RetryPolicy.noBackoff(), Duration.ofSeconds(1)), metrics);
        coordinator = new OrchestrationCoordinator(
            new ChainedIntentClassifier(new KeywordIntentClassifier(), null, IntentType.CODE_GENERATION, metrics),
            new TaskPlanner(registry),
            engine,
            registry,
            planRepository,
            sessionStore,
            new RequestValidator(),
            new ResultAggregator(new ObjectMapper()));
    }

    @AfterEach
    void tearDown() {
        engine.shutdown(Duration.ofSeconds(1));
    }

    private TaskStatusView awaitStatus(String taskId, TaskStatus expected) throws InterruptedException {
        Instant deadline = Instant.now().plusSeconds(5);
        TaskStatusView view = coordinator.getStatus(taskId);
        while (view.status() != expected && Instant.now().isBefore(deadline)) {
            Thread.sleep(20);
            view = coordinator.getStatus(taskId);
        }
        return view;
    }

    // ========== Synchronous Submission ==========

    @Test
    @DisplayName("Simple code request completes in one step and is recorded in the session")
    void testSimpleCodeRequest() {
        registry.register(ScriptedWorker.of(CapabilityType.CODE));

        SubmitResponse response = coordinator.submit(SubmitRequest.of("Create a FastAPI endpoint", SESSION));

        OrchestrationOutcome outcome = response.response();
        assertThat(outcome.status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(outcome.intent()).isEqualTo(IntentType.CODE_GENERATION);
        assertThat(outcome.stepCount()).isEqualTo(1);
        assertThat(outcome.error()).isNull();
        assertThat(outcome.result().get("worker").asText()).isEqualTo("code-worker");
        assertThat(outcome.usage().tokensUsed()).isEqualTo(10);
        assertThat(response.confidence()).isEqualTo(0.9);
        assertThat(response.sessionId()).isEqualTo(SESSION);
        assertThat(response.processingTime()).isGreaterThanOrEqualTo(Duration.ZERO);

        SessionContext session = coordinator.getSession(SESSION);
        assertThat(session.conversationHistory())
            .extracting(ConversationMessage::type)
            .containsExactly(MessageType.USER_INPUT, MessageType.AGENT_RESPONSE);
        assertThat(session.conversationHistory().get(0).content()).isEqualTo("Create a FastAPI endpoint");
        assertThat(session.activeCapabilities()).containsExactly(CapabilityType.CODE);
        assertThat(session.contextData()).containsEntry("lastTaskId", response.taskId());
        assertThat(session.messageCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Project setup runs the composite plan and keys results by step name")
    void testProjectSetup() {
        registry.register(ScriptedWorker.of(CapabilityType.INFRASTRUCTURE));
        registry.register(ScriptedWorker.of(CapabilityType.CODE));
        registry.register(ScriptedWorker.of(CapabilityType.TESTING));

        SubmitResponse response = coordinator.submit(SubmitRequest.of("Scaffold a new project for a todo API", SESSION));

        OrchestrationOutcome outcome = response.response();
        assertThat(outcome.status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(outcome.intent()).isEqualTo(IntentType.PROJECT_SETUP);
        assertThat(outcome.stepCount()).isEqualTo(3);
        assertThat(outcome.result().fieldNames()).toIterable()
            .containsExactlyInAnyOrder("infrastructure", "code", "tests");
        assertThat(outcome.usage().tokensUsed()).isEqualTo(30);
    }

    @Test
    @DisplayName("Empty message is reported as a validation failure, not thrown")
    void testValidationFailure() {
        SubmitResponse response = coordinator.submit(SubmitRequest.of("   ", SESSION));

        assertThat(response.response().status()).isEqualTo(TaskStatus.FAILED);
        assertThat(response.response().errorCode()).isEqualTo(ValidationException.ERROR_CODE);
        assertThat(response.response().error()).contains("message");
        assertThat(response.confidence()).isZero();
        assertThat(planRepository.findByTaskId(response.taskId())).isEmpty();
    }

    @Test
    @DisplayName("Out-of-range timeout and retry budget are rejected")
    void testRangeValidation() {
        SubmitRequest shortTimeout = new SubmitRequest("write code", SESSION, null, null, null,
            Priority.HIGH, Duration.ofMillis(10), null, Map.of());
        SubmitRequest tooManyRetries = new SubmitRequest("write code", SESSION, null, null, null,
            null, null, 11, Map.of());

        assertThat(coordinator.submit(shortTimeout).response().error()).contains("timeout");
        assertThat(coordinator.submit(tooManyRetries).response().error()).contains("maxRetries");
    }

    @Test
    @DisplayName("Capability gap surfaces as a planning failure and an error message in the session")
    void testPlanningFailure() {
        registry.register(ScriptedWorker.of(CapabilityType.CODE));

        SubmitResponse response = coordinator.submit(
            SubmitRequest.of("Check for security vulnerabilities", SESSION));

        assertThat(response.response().status()).isEqualTo(TaskStatus.FAILED);
        assertThat(response.response().errorCode()).isEqualTo(PlanningException.ERROR_CODE);
        assertThat(coordinator.getSession(SESSION).conversationHistory())
            .extracting(ConversationMessage::type)
            .containsExactly(MessageType.USER_INPUT, MessageType.ERROR);
    }

    @Test
    @DisplayName("Request for a capability with no registered worker fails at planning, before dispatch")
    void testNoWorkersRegistered() {
        SubmitResponse response = coordinator.submit(SubmitRequest.of("Create a FastAPI endpoint", SESSION));

        OrchestrationOutcome outcome = response.response();
        assertThat(outcome.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(outcome.errorCode()).isEqualTo(PlanningException.ERROR_CODE);
        assertThat(outcome.error()).contains("Capability gap", "code");
        assertThat(outcome.planId()).isNull();
        assertThat(outcome.stepCount()).isZero();
        assertThat(planRepository.findByTaskId(response.taskId())).isEmpty();
    }

    @Test
    @DisplayName("Permanent worker failure reports the worker's error code")
    void testWorkerFailure() {
        registry.register(ScriptedWorker.of(CapabilityType.CODE).thenFailPermanently("BAD_INPUT", "cannot parse request"));

        OrchestrationOutcome outcome = coordinator.submit(SubmitRequest.of("Implement a parser", SESSION)).response();

        assertThat(outcome.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(outcome.errorCode()).isEqualTo("BAD_INPUT");
        assertThat(outcome.error()).contains("cannot parse request");
        assertThat(outcome.result()).isNull();
    }

    @Test
    @DisplayName("Missing session id gets a generated one")
    void testGeneratedSessionId() {
        registry.register(ScriptedWorker.of(CapabilityType.CODE));

        SubmitResponse response = coordinator.submit(SubmitRequest.of("Implement a parser", null));

        assertThat(response.sessionId()).isNotBlank();
        assertThat(coordinator.getSession(response.sessionId()).conversationHistory()).hasSize(2);
    }

    @Test
    @DisplayName("Conversation history accumulates across requests of one session")
    void testHistoryAccumulates() {
        registry.register(ScriptedWorker.of(CapabilityType.CODE));

        coordinator.submit(SubmitRequest.of("Implement a parser", SESSION));
        coordinator.submit(SubmitRequest.of("Implement a lexer", SESSION));

        SessionContext session = coordinator.getSession(SESSION);
        assertThat(session.conversationHistory()).hasSize(4);
        assertThat(session.messageCount()).isEqualTo(2);
    }

    // ========== Status ==========

    @Test
    @DisplayName("Status of a finished task is stable across reads")
    void testStatusIdempotent() {
        registry.register(ScriptedWorker.of(CapabilityType.CODE));
        String taskId = coordinator.submit(SubmitRequest.of("Implement a parser", SESSION)).taskId();

        TaskStatusView first = coordinator.getStatus(taskId);
        TaskStatusView second = coordinator.getStatus(taskId);

        assertThat(first).isEqualTo(second);
        assertThat(first.status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(first.progress()).isEqualTo(100.0);
        assertThat(first.result()).isNotNull();
        assertThat(first.updatedAt()).isAfterOrEqualTo(first.createdAt());
    }

    @Test
    @DisplayName("Unknown task and unknown session are NotFound")
    void testUnknownLookups() {
        assertThatThrownBy(() -> coordinator.getStatus("nope")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> coordinator.getSession("nope")).isInstanceOf(NotFoundException.class);
        assertThat(coordinator.cancel("nope")).isFalse();
    }

    // ========== Asynchronous Submission ==========

    @Test
    @DisplayName("Async submission returns at once and completes in the background")
    void testAsyncCompletes() throws Exception {
        registry.register(ScriptedWorker.of(CapabilityType.CODE).thenSucceedAfter(Duration.ofMillis(100)));

        AsyncTaskResponse ack = coordinator.submitAsync(SubmitRequest.of("Implement a parser", SESSION));

        assertThat(ack.status()).isIn(TaskStatus.IN_PROGRESS, TaskStatus.COMPLETED);
        assertThat(ack.message()).isEqualTo("Task started");
        assertThat(ack.estimatedDuration()).isEqualTo(CapabilityDescriptor.DEFAULT_ESTIMATE);

        TaskStatusView view = awaitStatus(ack.taskId(), TaskStatus.COMPLETED);
        assertThat(view.status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(view.result().get("worker").asText()).isEqualTo("code-worker");
    }

    @Test
    @DisplayName("Running async task can be cancelled")
    void testAsyncCancel() throws Exception {
        ScriptedWorker worker = ScriptedWorker.of(CapabilityType.CODE).thenHang();
        registry.register(worker);
        AsyncTaskResponse ack = coordinator.submitAsync(SubmitRequest.of("Implement a parser", SESSION));

        TaskStatusView running = coordinator.getStatus(ack.taskId());
        assertThat(running.status()).isEqualTo(TaskStatus.IN_PROGRESS);
        assertThat(running.result()).isNull();

        assertThat(coordinator.cancel(ack.taskId())).isTrue();

        TaskStatusView cancelled = awaitStatus(ack.taskId(), TaskStatus.CANCELLED);
        assertThat(cancelled.status()).isEqualTo(TaskStatus.CANCELLED);
        assertThat(cancelled.error()).contains("cancelled");
        assertThat(coordinator.cancel(ack.taskId())).isFalse();
        assertThat(worker.hangingFutures()).allMatch(future -> future.isCancelled());
    }

    @Test
    @DisplayName("Async submission rejected up front is observable as FAILED")
    void testAsyncRejected() {
        AsyncTaskResponse ack = coordinator.submitAsync(SubmitRequest.of("", SESSION));

        assertThat(ack.status()).isEqualTo(TaskStatus.FAILED);
        TaskStatusView view = coordinator.getStatus(ack.taskId());
        assertThat(view.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(view.error()).contains("message");
    }

    @Test
    @DisplayName("Only the most recent rejected submissions stay observable")
    void testRejectedTasksAreBounded() {
        String first = coordinator.submitAsync(SubmitRequest.of("", SESSION)).taskId();
        String last = first;
        for (int i = 0; i < OrchestrationCoordinator.MAX_REJECTED_TASKS; i++) {
            last = coordinator.submitAsync(SubmitRequest.of("", SESSION)).taskId();
        }

        assertThatThrownBy(() -> coordinator.getStatus(first)).isInstanceOf(NotFoundException.class);
        assertThat(coordinator.getStatus(last).status()).isEqualTo(TaskStatus.FAILED);
    }

    // ========== Capabilities ==========

    @Test
    @DisplayName("Capabilities are listed once per type")
    void testListCapabilities() {
        registry.register(ScriptedWorker.named("python", CapabilityType.CODE));
        registry.register(ScriptedWorker.named("java", CapabilityType.CODE));
        registry.register(ScriptedWorker.named("pytest", CapabilityType.TESTING));

        List<CapabilityView> views = coordinator.listCapabilities();

        assertThat(views).extracting(CapabilityView::type)
            .containsExactly(CapabilityType.CODE, CapabilityType.TESTING);
        assertThat(views.get(0).capabilities()).extracting(CapabilityDescriptor::name)
            .containsExactly("python", "java");
    }
}
