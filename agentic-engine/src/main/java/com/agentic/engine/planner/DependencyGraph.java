package com.agentic.engine.planner;

import com.agentic.core.exception.PlanningException;
import com.agentic.core.model.ExecutionStep;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validation and analysis of a step dependency graph.
 */
public final class DependencyGraph {

    private DependencyGraph() {
    }

    /**
     * Validate the graph and return its steps in a topological order (Kahn).
     *
     * @throws PlanningException on a duplicate id, a self or dangling dependency, or a cycle
     */
    public static List<ExecutionStep> topologicalOrder(List<ExecutionStep> steps) {
        Map<String, ExecutionStep> byId = new LinkedHashMap<>();
        for (ExecutionStep step : steps) {
            if (byId.put(step.id(), step) != null) {
                throw new PlanningException("Duplicate step id: " + step.id());
            }
        }

        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (ExecutionStep step : steps) {
            Set<String> seen = new HashSet<>();
            for (String dependency : step.dependencies()) {
                if (dependency.equals(step.id())) {
                    throw new PlanningException(step.id(), dependency, "step depends on itself");
                }
                if (!byId.containsKey(dependency)) {
                    throw new PlanningException(step.id(), dependency, "unknown step id");
                }
                if (!seen.add(dependency)) {
                    throw new PlanningException(step.id(), dependency, "duplicate dependency");
                }
                dependents.computeIfAbsent(dependency, id -> new ArrayList<>()).add(step.id());
            }
            inDegree.put(step.id(), step.dependencies().size());
        }

        Deque<String> ready = new ArrayDeque<>();
        for (ExecutionStep step : steps) {
            if (inDegree.get(step.id()) == 0) {
                ready.add(step.id());
            }
        }

        List<ExecutionStep> order = new ArrayList<>(steps.size());
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(byId.get(id));
            for (String dependent : dependents.getOrDefault(id, List.of())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() != steps.size()) {
            throw cycleError(steps, inDegree);
        }
        return order;
    }

    /**
     * Longest path through the graph, summing step estimates.
     * The graph must already be valid.
     */
    public static Duration criticalPath(List<ExecutionStep> steps) {
        Map<String, Duration> finish = new HashMap<>();
        Duration longest = Duration.ZERO;
        for (ExecutionStep step : topologicalOrder(steps)) {
            Duration start = Duration.ZERO;
            for (String dependency : step.dependencies()) {
                Duration candidate = finish.get(dependency);
                if (candidate.compareTo(start) > 0) {
                    start = candidate;
                }
            }
            Duration end = start.plus(step.estimatedDuration());
            finish.put(step.id(), end);
            if (end.compareTo(longest) > 0) {
                longest = end;
            }
        }
        return longest;
    }

    /**
     * Name one edge that lies on a cycle among the steps Kahn could not order.
     */
    private static PlanningException cycleError(List<ExecutionStep> steps, Map<String, Integer> inDegree) {
        Set<String> remaining = new HashSet<>();
        for (ExecutionStep step : steps) {
            if (inDegree.get(step.id()) > 0) {
                remaining.add(step.id());
            }
        }
        Map<String, ExecutionStep> byId = new HashMap<>();
        steps.forEach(step -> byId.put(step.id(), step));

        // Every remaining step has a remaining dependency; walking them must revisit a step.
        String current = remaining.iterator().next();
        List<String> path = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        while (visited.add(current)) {
            path.add(current);
            current = byId.get(current).dependencies().stream()
                .filter(remaining::contains)
                .findFirst()
                .orElseThrow();
        }
        // path follows "depends on" links, so the last step depends on the revisited one
        String dependent = path.get(path.size() - 1);
        return new PlanningException(dependent, current, "dependency cycle");
    }
}
