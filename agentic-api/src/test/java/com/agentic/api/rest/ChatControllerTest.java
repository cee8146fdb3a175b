package com.agentic.api.rest;

import com.agentic.core.exception.ValidationException;
import com.agentic.core.model.IntentType;
import com.agentic.core.model.Priority;
import com.agentic.core.model.ResourceUsage;
import com.agentic.core.model.TaskStatus;
import com.agentic.engine.service.OrchestrationService.AsyncTaskResponse;
import com.agentic.engine.service.OrchestrationService.OrchestrationOutcome;
import com.agentic.engine.service.OrchestrationService.SubmitRequest;
import com.agentic.engine.service.OrchestrationService.SubmitResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ChatControllerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private StubOrchestrationService service;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        service = new StubOrchestrationService();
        mockMvc = MockMvcBuilders.standaloneSetup(new ChatController(service))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    private SubmitResponse response(TaskStatus status, String error, String errorCode) {
        OrchestrationOutcome outcome = new OrchestrationOutcome(
            status,
            IntentType.CODE_GENERATION,
            "plan-1",
            status == TaskStatus.COMPLETED ? objectMapper.createObjectNode().put("code", "print(1)") : null,
            error,
            errorCode,
            Duration.ofMillis(250),
            ResourceUsage.of(42, 0.01),
            1
        );
        return new SubmitResponse("session-1", outcome, Duration.ofMillis(300), "task-1", 0.9, Instant.now());
    }

    @Test
    @DisplayName("Completed request answers 200 with the aggregated outcome")
    void testChatCompleted() throws Exception {
        service.onSubmit = request -> response(TaskStatus.COMPLETED, null, null);

        mockMvc.perform(post("/api/v1/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of(
                    "message", "Create a FastAPI endpoint",
                    "sessionId", "session-1",
                    "priority", "HIGH",
                    "timeoutSeconds", 120,
                    "maxRetries", 2))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.taskId").value("task-1"))
            .andExpect(jsonPath("$.status").value("COMPLETED"))
            .andExpect(jsonPath("$.result.code").value("print(1)"))
            .andExpect(jsonPath("$.tokensUsed").value(42))
            .andExpect(jsonPath("$.processingTimeMs").value(300));

        SubmitRequest submitted = service.submitted.get(0);
        assertThat(submitted.message()).isEqualTo("Create a FastAPI endpoint");
        assertThat(submitted.priority()).isEqualTo(Priority.HIGH);
        assertThat(submitted.timeout()).isEqualTo(Duration.ofSeconds(120));
        assertThat(submitted.maxRetries()).isEqualTo(2);
        assertThat(submitted.parameters()).isEmpty();
    }

    @Test
    @DisplayName("Validation failure answers 400 with the error code")
    void testChatValidationFailure() throws Exception {
        service.onSubmit = request -> response(TaskStatus.FAILED,
            "Invalid request: description - cannot be blank", ValidationException.ERROR_CODE);

        mockMvc.perform(post("/api/v1/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"message\": \"   \"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("FAILED"))
            .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("Failed execution still answers 200 and carries the error")
    void testChatExecutionFailure() throws Exception {
        service.onSubmit = request -> response(TaskStatus.FAILED, "Capability gap: security", "PLANNING_ERROR");

        mockMvc.perform(post("/api/v1/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"message\": \"Check for security vulnerabilities\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("FAILED"))
            .andExpect(jsonPath("$.error").value("Capability gap: security"))
            .andExpect(jsonPath("$.errorCode").value("PLANNING_ERROR"));
    }

    @Test
    @DisplayName("Async submission answers 202 with the task id")
    void testChatAsync() throws Exception {
        service.onSubmitAsync = request ->
            new AsyncTaskResponse("task-2", TaskStatus.IN_PROGRESS, Duration.ofSeconds(45), "Task started");

        mockMvc.perform(post("/api/v1/chat/async")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"message\": \"Create a FastAPI endpoint\"}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.taskId").value("task-2"))
            .andExpect(jsonPath("$.status").value("IN_PROGRESS"))
            .andExpect(jsonPath("$.estimatedDurationMs").value(45000));
    }

    @Test
    @DisplayName("Async submission rejected before planning answers 200 with FAILED")
    void testChatAsyncRejected() throws Exception {
        service.onSubmitAsync = request ->
            new AsyncTaskResponse("task-3", TaskStatus.FAILED, Duration.ZERO, "Invalid request");

        mockMvc.perform(post("/api/v1/chat/async")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"message\": \"\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("FAILED"))
            .andExpect(jsonPath("$.message").value("Invalid request"));
    }

    @Test
    @DisplayName("Unreadable body answers 400 through the exception handler")
    void testMalformedBody() throws Exception {
        mockMvc.perform(post("/api/v1/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"message\": "))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("BAD_REQUEST"));

        assertThat(service.submitted).isEmpty();
    }
}
