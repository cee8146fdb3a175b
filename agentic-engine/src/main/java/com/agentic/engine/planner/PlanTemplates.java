package com.agentic.engine.planner;

import com.agentic.core.model.CapabilityType;
import com.agentic.core.model.IntentType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decomposition table: composite intents expand into fixed step graphs,
 * every other intent maps to a single capability.
 */
public class PlanTemplates {

    private final Map<IntentType, List<StepTemplate>> composites;
    private final Map<IntentType, CapabilityType> singles;

    public PlanTemplates(Map<IntentType, List<StepTemplate>> composites, Map<IntentType, CapabilityType> singles) {
        this.composites = new EnumMap<>(IntentType.class);
        this.composites.putAll(composites);
        this.singles = new EnumMap<>(IntentType.class);
        this.singles.putAll(singles);
    }

    public static PlanTemplates defaults() {
        Map<IntentType, List<StepTemplate>> composites = new EnumMap<>(IntentType.class);
        composites.put(IntentType.PROJECT_SETUP, List.of(
            StepTemplate.of("infrastructure", CapabilityType.INFRASTRUCTURE, IntentType.INFRASTRUCTURE_SETUP,
                "Set up infrastructure for: %s"),
            StepTemplate.of("code", CapabilityType.CODE, IntentType.CODE_GENERATION,
                "Generate the initial code for: %s", "infrastructure"),
            StepTemplate.of("tests", CapabilityType.TESTING, IntentType.TESTING,
                "Write tests for: %s", "code"),
            StepTemplate.optional("documentation", CapabilityType.DOCUMENTATION, IntentType.DOCUMENTATION,
                "Document: %s", "code")
        ));
        composites.put(IntentType.DEPLOYMENT, List.of(
            StepTemplate.of("tests", CapabilityType.TESTING, IntentType.TESTING,
                "Run the test suite before deploying: %s"),
            StepTemplate.of("security", CapabilityType.SECURITY, IntentType.SECURITY_SCAN,
                "Scan for vulnerabilities before deploying: %s", "tests"),
            StepTemplate.of("deploy", CapabilityType.DEVOPS, IntentType.DEPLOYMENT,
                "Deploy: %s", "security")
        ));

        Map<IntentType, CapabilityType> singles = new EnumMap<>(IntentType.class);
        singles.put(IntentType.CODE_GENERATION, CapabilityType.CODE);
        singles.put(IntentType.REFACTORING, CapabilityType.CODE);
        singles.put(IntentType.DEBUGGING, CapabilityType.CODE);
        singles.put(IntentType.CODE_REVIEW, CapabilityType.REVIEW);
        singles.put(IntentType.INFRASTRUCTURE_SETUP, CapabilityType.INFRASTRUCTURE);
        singles.put(IntentType.TESTING, CapabilityType.TESTING);
        singles.put(IntentType.DOCUMENTATION, CapabilityType.DOCUMENTATION);
        singles.put(IntentType.EXPLANATION, CapabilityType.DOCUMENTATION);
        singles.put(IntentType.SECURITY_SCAN, CapabilityType.SECURITY);

        return new PlanTemplates(composites, singles);
    }

    /**
     * The decomposition of a composite intent, or empty for single-capability intents.
     */
    public Optional<List<StepTemplate>> compositeFor(IntentType intent) {
        return Optional.ofNullable(composites.get(intent));
    }

    /**
     * The capability that handles a single-capability intent.
     */
    public Optional<CapabilityType> capabilityFor(IntentType intent) {
        return Optional.ofNullable(singles.get(intent));
    }
}
