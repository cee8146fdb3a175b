package com.agentic.engine.metrics;

import com.agentic.core.model.CapabilityType;
import com.agentic.core.model.IntentType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.*;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class OrchestratorMetricsTest {

    private SimpleMeterRegistry registry;
    private OrchestratorMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new OrchestratorMetrics(registry);
    }

    @Test
    @DisplayName("Plan outcomes are counted per intent with a duration timer")
    void testPlanMetrics() {
        metrics.planStarted(IntentType.PROJECT_SETUP);
        metrics.planStarted(IntentType.PROJECT_SETUP);
        metrics.planCompleted(IntentType.PROJECT_SETUP, Duration.ofSeconds(3));
        metrics.planFailed(IntentType.PROJECT_SETUP, Duration.ofSeconds(1));

        assertThat(registry.get(OrchestratorMetrics.PLANS_STARTED).tag("intent", "project_setup").counter().count())
            .isEqualTo(2.0);
        assertThat(registry.get(OrchestratorMetrics.PLANS_COMPLETED).counter().count()).isEqualTo(1.0);
        assertThat(registry.get(OrchestratorMetrics.PLAN_DURATION).tag("outcome", "success").timer().count())
            .isEqualTo(1);
        assertThat(registry.get(OrchestratorMetrics.PLAN_DURATION).tag("outcome", "failure").timer().count())
            .isEqualTo(1);
    }

    @Test
    @DisplayName("Step failures are tagged with error type and retry decision")
    void testStepFailureTags() {
        metrics.stepFailed(CapabilityType.CODE, "WORKER_ERROR", true);
        metrics.stepFailed(CapabilityType.CODE, null, false);

        assertThat(registry.get(OrchestratorMetrics.STEP_FAILURES)
            .tags("capability", "code", "error_type", "WORKER_ERROR", "will_retry", "true")
            .counter().count()).isEqualTo(1.0);
        assertThat(registry.get(OrchestratorMetrics.STEP_FAILURES)
            .tags("error_type", "unknown", "will_retry", "false")
            .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Gauges follow the engine's in-flight and queue counts")
    void testGauges() {
        metrics.updateInFlight(3);
        metrics.updateQueueDepth(7);

        assertThat(registry.get(OrchestratorMetrics.STEPS_IN_FLIGHT).gauge().value()).isEqualTo(3.0);
        assertThat(registry.get(OrchestratorMetrics.QUEUE_DEPTH).gauge().value()).isEqualTo(7.0);
        assertThat(metrics.getInFlight()).isEqualTo(3);
    }

    @Test
    @DisplayName("Unbound metrics accept recordings without a registry")
    void testUnbound() {
        OrchestratorMetrics unbound = new OrchestratorMetrics();

        assertThatCode(() -> {
            unbound.stepDispatched(CapabilityType.TESTING, "tester");
            unbound.stepTimedOut(CapabilityType.TESTING);
            unbound.intentClassified(IntentType.TESTING, "keyword");
        }).doesNotThrowAnyException();
    }
}
