package com.agentic.examples;

import com.agentic.core.model.CapabilityDescriptor;
import com.agentic.core.model.CapabilityType;
import com.agentic.engine.registry.CapabilityRegistry;
import com.agentic.worker.Worker;
import com.agentic.worker.llm.LanguageModelGateway;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Factory for one language-model worker per capability type.
 */
public final class ExampleWorkers {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private ExampleWorkers() {
    }

    public static List<Worker> all(LanguageModelGateway gateway) {
        return all(gateway, DEFAULT_TIMEOUT);
    }

    public static List<Worker> all(LanguageModelGateway gateway, Duration timeout) {
        List<Worker> workers = new ArrayList<>();
        for (CapabilityType type : CapabilityType.values()) {
            workers.add(create(type, gateway, timeout));
        }
        return workers;
    }

    /**
     * Register one worker per capability type.
     *
     * @return the registered workers
     */
    public static List<Worker> registerAll(CapabilityRegistry registry, LanguageModelGateway gateway) {
        List<Worker> workers = all(gateway);
        workers.forEach(registry::register);
        return workers;
    }

    public static Worker create(CapabilityType type, LanguageModelGateway gateway, Duration timeout) {
        return new LanguageModelWorker(type, descriptor(type), systemPrompt(type), gateway, timeout);
    }

    static CapabilityDescriptor descriptor(CapabilityType type) {
        return switch (type) {
            case CODE -> new CapabilityDescriptor("code-agent",
                "Generates Python, JavaScript/TypeScript code, API endpoints and React components",
                List.of("description"), List.of("code", "language", "explanation"), Duration.ofSeconds(30));
            case INFRASTRUCTURE -> new CapabilityDescriptor("infrastructure-agent",
                "Writes Dockerfiles, compose files and Kubernetes manifests",
                List.of("description"), List.of("files"), Duration.ofSeconds(45));
            case TESTING -> new CapabilityDescriptor("testing-agent",
                "Writes unit and integration tests",
                List.of("description"), List.of("code", "framework"), Duration.ofSeconds(40));
            case DEVOPS -> new CapabilityDescriptor("devops-agent",
                "Builds CI/CD pipelines and deploys services",
                List.of("description"), List.of("pipeline"), Duration.ofSeconds(60));
            case DOCUMENTATION -> new CapabilityDescriptor("documentation-agent",
                "Writes READMEs, API references and explanations",
                List.of("description"), List.of("markdown"), Duration.ofSeconds(20));
            case SECURITY -> new CapabilityDescriptor("security-agent",
                "Scans code and dependencies for vulnerabilities and leaked secrets",
                List.of("description"), List.of("findings"), Duration.ofSeconds(50));
            case PLANNING -> new CapabilityDescriptor("planning-agent",
                "Breaks large requests into actionable work items",
                List.of("description"), List.of("items"), Duration.ofSeconds(15));
            case REVIEW -> new CapabilityDescriptor("review-agent",
                "Reviews code for correctness, style and maintainability",
                List.of("description"), List.of("comments"), Duration.ofSeconds(25));
        };
    }

    static String systemPrompt(CapabilityType type) {
        String role = switch (type) {
            case CODE -> "You are a code generation expert. Generate clean, well-documented code.";
            case INFRASTRUCTURE -> "You are an infrastructure engineer. Produce container and deployment files.";
            case TESTING -> "You are a test engineer. Write thorough, deterministic tests.";
            case DEVOPS -> "You are a DevOps engineer. Produce CI/CD configuration and deployment steps.";
            case DOCUMENTATION -> "You are a technical writer. Produce clear documentation.";
            case SECURITY -> "You are a security reviewer. Report vulnerabilities with severity and fix.";
            case PLANNING -> "You are a technical lead. Break the request into ordered work items.";
            case REVIEW -> "You are a senior reviewer. Point out defects and suggest improvements.";
        };
        return role + " Answer with a single JSON object.";
    }
}
