package com.agentic.engine.registry;

import com.agentic.core.model.CapabilityDescriptor;
import com.agentic.core.model.CapabilityType;
import com.agentic.core.model.IntentType;
import com.agentic.core.model.TaskRequest;
import com.agentic.engine.test.ScriptedWorker;
import com.agentic.worker.Worker;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.agentic.engine.test.TestRequests.request;
import static org.assertj.core.api.Assertions.*;

class CapabilityRegistryTest {

    private CapabilityRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CapabilityRegistry();
    }

    @Test
    @DisplayName("Workers of the same type are kept in registration order")
    void testRegistrationOrder() {
        Worker first = ScriptedWorker.named("first", CapabilityType.CODE);
        Worker second = ScriptedWorker.named("second", CapabilityType.CODE);
        Worker infra = ScriptedWorker.named("infra", CapabilityType.INFRASTRUCTURE);

        registry.register(first);
        registry.register(infra);
        registry.register(second);

        assertThat(registry.workers(CapabilityType.CODE)).containsExactly(first, second);
        assertThat(registry.workers(CapabilityType.INFRASTRUCTURE)).containsExactly(infra);
        assertThat(registry.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("findCapable returns only workers whose canHandle accepts the request")
    void testFindCapableFilters() {
        TaskRequest python = request(IntentType.CODE_GENERATION, "write a python script");
        ScriptedWorker pythonOnly = ScriptedWorker.named("python", CapabilityType.CODE)
            .accepting(r -> r.description().contains("python"));
        ScriptedWorker javaOnly = ScriptedWorker.named("java", CapabilityType.CODE)
            .accepting(r -> r.description().contains("java"));
        registry.register(javaOnly);
        registry.register(pythonOnly);

        assertThat(registry.findCapable(python)).containsExactly(pythonOnly);
        assertThat(registry.findCapable(CapabilityType.CODE, python)).containsExactly(pythonOnly);
        assertThat(registry.findCapable(CapabilityType.TESTING, python)).isEmpty();
    }

    @Test
    @DisplayName("A worker whose capability check throws is skipped")
    void testThrowingCapabilityCheckSkipped() {
        ScriptedWorker broken = ScriptedWorker.named("broken", CapabilityType.CODE)
            .accepting(r -> {
                throw new IllegalStateException("boom");
            });
        ScriptedWorker healthy = ScriptedWorker.named("healthy", CapabilityType.CODE);
        registry.register(broken);
        registry.register(healthy);

        assertThat(registry.findCapable(request(IntentType.CODE_GENERATION, "anything")))
            .containsExactly(healthy);
    }

    @Test
    @DisplayName("Capabilities are grouped by type with one descriptor per worker")
    void testCapabilitiesSnapshot() {
        registry.register(ScriptedWorker.named("code-a", CapabilityType.CODE));
        registry.register(ScriptedWorker.named("docs", CapabilityType.DOCUMENTATION));
        registry.register(ScriptedWorker.named("code-b", CapabilityType.CODE));

        Map<CapabilityType, List<CapabilityDescriptor>> capabilities = registry.capabilities();

        assertThat(capabilities).containsOnlyKeys(CapabilityType.CODE, CapabilityType.DOCUMENTATION);
        assertThat(capabilities.get(CapabilityType.CODE))
            .extracting(CapabilityDescriptor::name)
            .containsExactly("code-a", "code-b");
        assertThatThrownBy(() -> capabilities.get(CapabilityType.CODE).clear())
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Empty registry answers every lookup with nothing")
    void testEmptyRegistry() {
        assertThat(registry.capabilities()).isEmpty();
        assertThat(registry.hasCapability(CapabilityType.SECURITY)).isFalse();
        assertThat(registry.findCapable(request(IntentType.SECURITY_SCAN, "scan"))).isEmpty();
    }

    @Test
    @DisplayName("Null worker is rejected")
    void testNullWorkerRejected() {
        assertThatThrownBy(() -> registry.register(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Concurrent registrations and lookups do not lose workers")
    void testConcurrentRegistration() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int i = 0; i < 50; i++) {
                String name = "worker-" + i;
                pool.submit(() -> {
                    start.await();
                    registry.register(ScriptedWorker.named(name, CapabilityType.TESTING));
                    return registry.findCapable(request(IntentType.TESTING, "run tests")).size();
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(registry.workers(CapabilityType.TESTING)).hasSize(50);
    }
}
