package com.agentic.engine.logging;

import org.slf4j.MDC;

import java.util.Map;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs include relevant correlation IDs for tracing.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forStep(planId, stepId, "testing", 1)) {
 *     log.info("Dispatching step"); // Automatically includes planId, stepId
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [worker-1] INFO  c.a.e.e.ExecutionEngine - Dispatching step
 *   planId=abc-123 stepId=def-456 capability=testing attempt=1 traceId=1f2e3d4c
 *
 * Closing a context restores the MDC exactly as it was when the context was opened,
 * so nested contexts unwind cleanly and nothing leaks to the next request on a pooled thread.
 */
public final class LoggingContext implements AutoCloseable {

    public static final String PLAN_ID = "planId";
    public static final String STEP_ID = "stepId";
    public static final String TASK_ID = "taskId";
    public static final String SESSION_ID = "sessionId";
    public static final String CAPABILITY = "capability";
    public static final String ATTEMPT = "attempt";
    public static final String TRACE_ID = "traceId";

    private final Map<String, String> previous;

    private LoggingContext() {
        this.previous = MDC.getCopyOfContextMap();
    }

    /**
     * Create a logging context for request-level operations in the façade.
     * Every request starts a new trace.
     */
    public static LoggingContext forRequest(String sessionId, String taskId) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(SESSION_ID, sessionId);
        putIfPresent(TASK_ID, taskId);
        MDC.put(TRACE_ID, newTraceId());
        return ctx;
    }

    /**
     * Create a logging context for plan-level operations.
     */
    public static LoggingContext forPlan(String planId, String taskId) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(PLAN_ID, planId);
        putIfPresent(TASK_ID, taskId);
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for step-level operations.
     */
    public static LoggingContext forStep(String planId, String stepId, String capability, int attempt) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(PLAN_ID, planId);
        putIfPresent(STEP_ID, stepId);
        putIfPresent(CAPABILITY, capability);
        MDC.put(ATTEMPT, String.valueOf(attempt));
        ensureTraceId();
        return ctx;
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    /**
     * Keep the enclosing trace, or start one.
     */
    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, newTraceId());
        }
    }

    private static String newTraceId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    @Override
    public void close() {
        if (previous == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(previous);
        }
    }
}
