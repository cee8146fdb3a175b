package com.agentic.engine.logging;

import org.junit.jupiter.api.*;
import org.slf4j.MDC;

import static org.assertj.core.api.Assertions.*;

class LoggingContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Step context tags plan, step, capability and attempt, and removes them on close")
    void testStepContext() {
        try (var ctx = LoggingContext.forStep("plan-1", "step-1", "code", 2)) {
            assertThat(MDC.get(LoggingContext.PLAN_ID)).isEqualTo("plan-1");
            assertThat(MDC.get(LoggingContext.STEP_ID)).isEqualTo("step-1");
            assertThat(MDC.get(LoggingContext.CAPABILITY)).isEqualTo("code");
            assertThat(MDC.get(LoggingContext.ATTEMPT)).isEqualTo("2");
            assertThat(MDC.get(LoggingContext.TRACE_ID)).hasSize(8);
        }

        assertThat(MDC.getCopyOfContextMap()).isNullOrEmpty();
    }

    @Test
    @DisplayName("Nested context shares the trace and restores the outer keys on close")
    void testNestedContextRestoresOuter() {
        try (var request = LoggingContext.forRequest("session-1", "task-1")) {
            String traceId = MDC.get(LoggingContext.TRACE_ID);
            assertThat(traceId).hasSize(8);

            try (var step = LoggingContext.forStep("plan-1", "step-1", "code", 1)) {
                assertThat(MDC.get(LoggingContext.TRACE_ID)).isEqualTo(traceId);
                assertThat(MDC.get(LoggingContext.SESSION_ID)).isEqualTo("session-1");
            }

            assertThat(MDC.get(LoggingContext.SESSION_ID)).isEqualTo("session-1");
            assertThat(MDC.get(LoggingContext.TASK_ID)).isEqualTo("task-1");
            assertThat(MDC.get(LoggingContext.TRACE_ID)).isEqualTo(traceId);
            assertThat(MDC.get(LoggingContext.STEP_ID)).isNull();
        }

        assertThat(MDC.get(LoggingContext.SESSION_ID)).isNull();
        assertThat(MDC.get(LoggingContext.TRACE_ID)).isNull();
    }

    @Test
    @DisplayName("Sequential requests on one thread get distinct trace ids")
    void testTraceIdPerRequest() {
        String first;
        try (var ctx = LoggingContext.forRequest("session-1", "task-1")) {
            first = MDC.get(LoggingContext.TRACE_ID);
        }
        String second;
        try (var ctx = LoggingContext.forRequest("session-1", "task-2")) {
            second = MDC.get(LoggingContext.TRACE_ID);
        }

        assertThat(first).isNotNull();
        assertThat(second).isNotNull().isNotEqualTo(first);
    }

    @Test
    @DisplayName("Keys present before the context are kept after it closes")
    void testForeignKeysPreserved() {
        MDC.put("requestUri", "/api/v1/chat");

        try (var ctx = LoggingContext.forPlan("plan-1", "task-1")) {
            assertThat(MDC.get("requestUri")).isEqualTo("/api/v1/chat");
        }

        assertThat(MDC.get("requestUri")).isEqualTo("/api/v1/chat");
        assertThat(MDC.get(LoggingContext.PLAN_ID)).isNull();
    }

    @Test
    @DisplayName("Null values are not written")
    void testNullValuesSkipped() {
        try (var ctx = LoggingContext.forRequest(null, "task-1")) {
            assertThat(MDC.get(LoggingContext.SESSION_ID)).isNull();
            assertThat(MDC.get(LoggingContext.TASK_ID)).isEqualTo("task-1");
        }
    }
}
