package com.agentic.examples;

import com.agentic.core.model.IntentType;
import com.agentic.core.model.TaskStatus;
import com.agentic.engine.service.OrchestrationService.OrchestrationOutcome;
import com.agentic.engine.service.OrchestrationService.TaskStatusView;
import org.junit.jupiter.api.*;

import static org.assertj.core.api.Assertions.*;

class ProjectSetupDemoTest {

    private ProjectSetupDemo demo;

    @BeforeEach
    void setUp() {
        demo = new ProjectSetupDemo(new MockLanguageModelGateway());
    }

    @AfterEach
    void tearDown() {
        demo.close();
    }

    @Test
    @DisplayName("Every demo scenario ends in the expected status")
    void testScenarios() throws Exception {
        OrchestrationOutcome simple = demo.runSimpleRequest().response();
        assertThat(simple.status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(simple.result().get("code").asText()).contains("FastAPI");

        OrchestrationOutcome setup = demo.runProjectSetup().response();
        assertThat(setup.status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(setup.intent()).isEqualTo(IntentType.PROJECT_SETUP);
        assertThat(setup.stepCount()).isEqualTo(4);
        assertThat(setup.result().has("documentation")).isTrue();

        TaskStatusView async = demo.runAsyncRequest();
        assertThat(async.status()).isEqualTo(TaskStatus.COMPLETED);

        OrchestrationOutcome rejected = demo.runRejectedRequest().response();
        assertThat(rejected.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(rejected.errorCode()).isEqualTo("VALIDATION_ERROR");
    }
}
