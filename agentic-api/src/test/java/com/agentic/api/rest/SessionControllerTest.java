package com.agentic.api.rest;

import com.agentic.core.model.CapabilityType;
import com.agentic.core.model.ConversationMessage;
import com.agentic.core.model.SessionContext;
import org.junit.jupiter.api.*;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Set;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class SessionControllerTest {

    private StubOrchestrationService service;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        service = new StubOrchestrationService();
        mockMvc = MockMvcBuilders.standaloneSetup(new SessionController(service))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    @DisplayName("Session answers its most recent messages, oldest first")
    void testGetSession() throws Exception {
        SessionContext session = SessionContext.create("session-1", "user-1", "project-1")
            .withMessage(ConversationMessage.userInput("session-1", "first"))
            .withMessage(ConversationMessage.userInput("session-1", "second"))
            .withMessage(ConversationMessage.error("session-1", "third"))
            .withActivity()
            .withActiveCapabilities(Set.of(CapabilityType.CODE));
        service.sessions.put("session-1", session);

        mockMvc.perform(get("/api/v1/sessions/{sessionId}", "session-1").param("limit", "2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.sessionId").value("session-1"))
            .andExpect(jsonPath("$.messageCount").value(1))
            .andExpect(jsonPath("$.activeCapabilities[0]").value("CODE"))
            .andExpect(jsonPath("$.messages.length()").value(2))
            .andExpect(jsonPath("$.messages[0].content").value("second"))
            .andExpect(jsonPath("$.messages[1].type").value("ERROR"));
    }

    @Test
    @DisplayName("Unknown session answers 404")
    void testUnknownSession() throws Exception {
        mockMvc.perform(get("/api/v1/sessions/{sessionId}", "nope"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message").value("Session not found: nope"));
    }
}
