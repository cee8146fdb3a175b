package com.agentic.engine.metrics;

import com.agentic.core.model.CapabilityType;
import com.agentic.core.model.IntentType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for the orchestrator.
 *
 * Metrics exposed:
 * - Plan counts by outcome and plan duration
 * - Step dispatches, retries, timeouts and failures per capability
 * - Step latency histograms
 * - In-flight dispatches and dispatch queue depth
 *
 * Until bound to a registry, meters are recorded into an empty composite registry and dropped.
 */
@Component
public class OrchestratorMetrics implements MeterBinder {

    // Metric names
    public static final String PLANS_STARTED = "orchestrator.plans.started";
    public static final String PLANS_COMPLETED = "orchestrator.plans.completed";
    public static final String PLANS_FAILED = "orchestrator.plans.failed";
    public static final String PLANS_CANCELLED = "orchestrator.plans.cancelled";
    public static final String PLAN_DURATION = "orchestrator.plan.duration";

    public static final String STEP_DISPATCHES = "orchestrator.step.dispatches";
    public static final String STEP_DURATION = "orchestrator.step.duration";
    public static final String STEP_RETRIES = "orchestrator.step.retries";
    public static final String STEP_TIMEOUTS = "orchestrator.step.timeouts";
    public static final String STEP_FAILURES = "orchestrator.step.failures";

    public static final String STEPS_IN_FLIGHT = "orchestrator.steps.in_flight";
    public static final String QUEUE_DEPTH = "orchestrator.queue.depth";

    public static final String INTENTS_CLASSIFIED = "orchestrator.intents.classified";

    private volatile MeterRegistry registry = new CompositeMeterRegistry();

    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final AtomicInteger queueDepth = new AtomicInteger(0);

    public OrchestratorMetrics() {
    }

    /**
     * Create metrics already bound to the given registry.
     */
    public OrchestratorMetrics(MeterRegistry registry) {
        bindTo(registry);
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(STEPS_IN_FLIGHT, inFlight, AtomicInteger::get)
            .description("Steps currently dispatched to workers")
            .register(registry);
        Gauge.builder(QUEUE_DEPTH, queueDepth, AtomicInteger::get)
            .description("Ready steps waiting for a dispatch slot")
            .register(registry);
    }

    // ========== Plan Metrics ==========

    public void planStarted(IntentType intent) {
        Counter.builder(PLANS_STARTED)
            .tag("intent", intent.value())
            .description("Total plans started")
            .register(registry)
            .increment();
    }

    public void planCompleted(IntentType intent, Duration duration) {
        Counter.builder(PLANS_COMPLETED)
            .tag("intent", intent.value())
            .description("Total plans completed successfully")
            .register(registry)
            .increment();
        recordPlanDuration(intent, "success", duration);
    }

    public void planFailed(IntentType intent, Duration duration) {
        Counter.builder(PLANS_FAILED)
            .tag("intent", intent.value())
            .description("Total plans failed")
            .register(registry)
            .increment();
        recordPlanDuration(intent, "failure", duration);
    }

    public void planCancelled(IntentType intent) {
        Counter.builder(PLANS_CANCELLED)
            .tag("intent", intent.value())
            .description("Total plans cancelled")
            .register(registry)
            .increment();
    }

    private void recordPlanDuration(IntentType intent, String outcome, Duration duration) {
        Timer.builder(PLAN_DURATION)
            .tag("intent", intent.value())
            .tag("outcome", outcome)
            .description("Plan execution duration")
            .register(registry)
            .record(duration);
    }

    // ========== Step Metrics ==========

    public void stepDispatched(CapabilityType capability, String worker) {
        Counter.builder(STEP_DISPATCHES)
            .tag("capability", capability.value())
            .tag("worker", worker)
            .description("Total step dispatches")
            .register(registry)
            .increment();
    }

    public void stepCompleted(CapabilityType capability, Duration duration) {
        Timer.builder(STEP_DURATION)
            .tag("capability", capability.value())
            .tag("outcome", "success")
            .description("Step execution duration")
            .register(registry)
            .record(duration);
    }

    public void stepFailed(CapabilityType capability, String errorCode, boolean willRetry) {
        Counter.builder(STEP_FAILURES)
            .tag("capability", capability.value())
            .tag("error_type", errorCode != null ? errorCode : "unknown")
            .tag("will_retry", String.valueOf(willRetry))
            .description("Total step failures")
            .register(registry)
            .increment();
    }

    public void stepRetried(CapabilityType capability, int retryNumber) {
        Counter.builder(STEP_RETRIES)
            .tag("capability", capability.value())
            .tag("retry", String.valueOf(retryNumber))
            .description("Total step retry attempts")
            .register(registry)
            .increment();
    }

    public void stepTimedOut(CapabilityType capability) {
        Counter.builder(STEP_TIMEOUTS)
            .tag("capability", capability.value())
            .description("Total step timeouts")
            .register(registry)
            .increment();
    }

    // ========== Classifier Metrics ==========

    public void intentClassified(IntentType intent, String source) {
        Counter.builder(INTENTS_CLASSIFIED)
            .tag("intent", intent.value())
            .tag("source", source)
            .description("Total classified instructions")
            .register(registry)
            .increment();
    }

    // ========== Gauges ==========

    public void updateInFlight(int count) {
        inFlight.set(count);
    }

    public void updateQueueDepth(int depth) {
        queueDepth.set(depth);
    }

    public int getInFlight() {
        return inFlight.get();
    }

    public int getQueueDepth() {
        return queueDepth.get();
    }
}
