package com.agentic.engine.registry;

import com.agentic.core.model.CapabilityDescriptor;
import com.agentic.core.model.CapabilityType;
import com.agentic.core.model.TaskRequest;
import com.agentic.worker.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Registry of available workers, indexed by capability type.
 *
 * Storage is copy-on-write: lookups never block and observe a consistent
 * snapshot, registrations are rare and serialized. Registrations of the same
 * type are appended in order and never replace earlier workers.
 */
public class CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final CopyOnWriteArrayList<Worker> workers = new CopyOnWriteArrayList<>();

    /**
     * Register a worker under its declared capability type.
     */
    public void register(Worker worker) {
        Objects.requireNonNull(worker, "worker");
        Objects.requireNonNull(worker.capabilityType(), "worker.capabilityType()");
        workers.add(worker);
        log.info("Registered worker {} for capability {}", worker.name(), worker.capabilityType().value());
    }

    /**
     * Every worker whose {@code canHandle} accepts the request, in registration order.
     * Empty when none match.
     */
    public List<Worker> findCapable(TaskRequest request) {
        return filterCapable(workers, request);
    }

    /**
     * Workers of the given capability type that accept the request, in registration order.
     */
    public List<Worker> findCapable(CapabilityType type, TaskRequest request) {
        return filterCapable(workers(type), request);
    }

    /**
     * Snapshot of the registered descriptors per capability type, in registration order.
     */
    public Map<CapabilityType, List<CapabilityDescriptor>> capabilities() {
        Map<CapabilityType, List<CapabilityDescriptor>> result = new LinkedHashMap<>();
        for (Worker worker : workers) {
            result.computeIfAbsent(worker.capabilityType(), type -> new ArrayList<>()).add(worker.descriptor());
        }
        result.replaceAll((type, descriptors) -> Collections.unmodifiableList(descriptors));
        return Collections.unmodifiableMap(result);
    }

    public boolean hasCapability(CapabilityType type) {
        return workers.stream().anyMatch(worker -> worker.capabilityType() == type);
    }

    /**
     * Workers registered for the given type, in registration order.
     */
    public List<Worker> workers(CapabilityType type) {
        return workers.stream()
            .filter(worker -> worker.capabilityType() == type)
            .collect(Collectors.toUnmodifiableList());
    }

    public List<Worker> workers() {
        return List.copyOf(workers);
    }

    public int size() {
        return workers.size();
    }

    private List<Worker> filterCapable(List<Worker> candidates, TaskRequest request) {
        List<Worker> capable = new ArrayList<>();
        for (Worker worker : candidates) {
            try {
                if (worker.canHandle(request)) {
                    capable.add(worker);
                }
            } catch (RuntimeException e) {
                log.warn("Worker {} failed capability check for task {}, skipping", worker.name(), request.id(), e);
            }
        }
        return capable;
    }
}
