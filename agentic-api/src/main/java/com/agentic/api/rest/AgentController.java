package com.agentic.api.rest;

import com.agentic.core.model.CapabilityDescriptor;
import com.agentic.core.model.CapabilityType;
import com.agentic.engine.service.OrchestrationService;
import com.agentic.engine.service.OrchestrationService.CapabilityView;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API listing the registered workers.
 */
@RestController
@RequestMapping("/api/v1/agents")
public class AgentController {

    private final OrchestrationService orchestrationService;

    public AgentController(OrchestrationService orchestrationService) {
        this.orchestrationService = orchestrationService;
    }

    @GetMapping
    public ResponseEntity<List<AgentResponse>> listAgents() {
        List<AgentResponse> agents = orchestrationService.listCapabilities().stream()
            .map(AgentResponse::from)
            .toList();
        return ResponseEntity.ok(agents);
    }

    // ========== DTOs ==========

    public record AgentResponse(
        CapabilityType type,
        List<CapabilitySummary> capabilities
    ) {
        public static AgentResponse from(CapabilityView view) {
            return new AgentResponse(
                view.type(),
                view.capabilities().stream().map(CapabilitySummary::from).toList()
            );
        }
    }

    public record CapabilitySummary(
        String name,
        String description,
        List<String> requiredInputs,
        List<String> outputs,
        long estimatedDurationMs
    ) {
        public static CapabilitySummary from(CapabilityDescriptor descriptor) {
            return new CapabilitySummary(
                descriptor.name(),
                descriptor.description(),
                descriptor.requiredInputs(),
                descriptor.outputs(),
                descriptor.estimatedDuration().toMillis()
            );
        }
    }
}
