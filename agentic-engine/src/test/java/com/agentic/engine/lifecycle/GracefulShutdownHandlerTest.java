package com.agentic.engine.lifecycle;

import com.agentic.core.exception.AgenticException;
import com.agentic.core.model.CapabilityType;
import com.agentic.core.model.ExecutionPlan;
import com.agentic.core.model.RetryPolicy;
import com.agentic.core.model.TaskStatus;
import com.agentic.engine.execution.EngineSettings;
import com.agentic.engine.execution.ExecutionEngine;
import com.agentic.engine.metrics.OrchestratorMetrics;
import com.agentic.engine.persistence.InMemoryPlanRepository;
import com.agentic.engine.persistence.InMemorySessionContextStore;
import com.agentic.engine.registry.CapabilityRegistry;
import com.agentic.engine.test.ScriptedWorker;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static com.agentic.engine.test.TestRequests.requestBuilder;
import static com.agentic.engine.test.TestRequests.step;
import static org.assertj.core.api.Assertions.*;

class GracefulShutdownHandlerTest {

    private CapabilityRegistry registry;
    private InMemorySessionContextStore sessionStore;

    @BeforeEach
    void setUp() {
        registry = new CapabilityRegistry();
        sessionStore = new InMemorySessionContextStore();
        sessionStore.initialize();
    }

    private ExecutionEngine engine(Duration shutdownTimeout) {
        return new ExecutionEngine(registry, new InMemoryPlanRepository(), settings(shutdownTimeout), new OrchestratorMetrics());
    }

    private static EngineSettings settings(Duration shutdownTimeout) {
        return new EngineSettings(4, RetryPolicy.noBackoff(), shutdownTimeout);
    }

    private static ExecutionPlan singleStepPlan() {
        return ExecutionPlan.create(requestBuilder("work").build(),
            List.of(step("work", CapabilityType.CODE)), Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("Waits for running plans, then closes the session store")
    void testDrainsActivePlans() throws Exception {
        registry.register(ScriptedWorker.of(CapabilityType.CODE).thenSucceedAfter(Duration.ofMillis(200)));
        ExecutionEngine engine = engine(Duration.ofSeconds(5));
        GracefulShutdownHandler handler = new GracefulShutdownHandler(engine, sessionStore, settings(Duration.ofSeconds(5)));
        CompletableFuture<ExecutionPlan> running = engine.execute(singleStepPlan());

        boolean drained = handler.shutdown();

        assertThat(drained).isTrue();
        assertThat(handler.isShuttingDown()).isTrue();
        assertThat(running.get(1, TimeUnit.SECONDS).status()).isEqualTo(TaskStatus.COMPLETED);
        assertThatThrownBy(() -> sessionStore.find("any")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Cancels what is still running when the timeout expires")
    void testTimeoutCancelsStragglers() throws Exception {
        ScriptedWorker worker = ScriptedWorker.of(CapabilityType.CODE).thenHang();
        registry.register(worker);
        ExecutionEngine engine = engine(Duration.ofMillis(100));
        GracefulShutdownHandler handler = new GracefulShutdownHandler(engine, sessionStore, settings(Duration.ofMillis(100)));
        CompletableFuture<ExecutionPlan> running = engine.execute(singleStepPlan());

        boolean drained = handler.shutdown();

        assertThat(drained).isFalse();
        assertThat(running.get(1, TimeUnit.SECONDS).status()).isEqualTo(TaskStatus.CANCELLED);
    }

    @Test
    @DisplayName("Runs once and rejects new plans afterwards")
    void testIdempotent() {
        ExecutionEngine engine = engine(Duration.ofSeconds(1));
        GracefulShutdownHandler handler = new GracefulShutdownHandler(engine, sessionStore, settings(Duration.ofSeconds(1)));

        assertThat(handler.shutdown()).isTrue();
        assertThat(handler.shutdown()).isTrue();
        assertThat(engine.execute(singleStepPlan()))
            .failsWithin(Duration.ofSeconds(1))
            .withThrowableOfType(ExecutionException.class)
            .withCauseInstanceOf(AgenticException.class);
    }
}
