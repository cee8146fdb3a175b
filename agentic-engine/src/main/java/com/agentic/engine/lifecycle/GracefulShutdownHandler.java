package com.agentic.engine.lifecycle;

import com.agentic.core.repository.SessionContextStore;
import com.agentic.engine.execution.EngineSettings;
import com.agentic.engine.execution.ExecutionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Manages graceful shutdown for the orchestrator.
 *
 * On shutdown:
 * 1. Stops accepting new plans
 * 2. Waits for active plans to finish (with timeout), cancelling the rest
 * 3. Closes the session store
 */
@Component
public class GracefulShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHandler.class);

    private final ExecutionEngine engine;
    private final SessionContextStore sessionStore;
    private final Duration shutdownTimeout;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public GracefulShutdownHandler(ExecutionEngine engine, SessionContextStore sessionStore, EngineSettings settings) {
        this.engine = engine;
        this.sessionStore = sessionStore;
        this.shutdownTimeout = settings.shutdownTimeout();
    }

    /**
     * Check if shutdown is in progress.
     */
    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    /**
     * Handle application shutdown event.
     * This runs before Spring context is fully closed.
     */
    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown(ContextClosedEvent event) {
        shutdown();
    }

    /**
     * Drain the engine and close the session store. Runs once.
     *
     * @return true when every active plan finished before the timeout
     */
    public boolean shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return true;
        }
        log.info("Initiating graceful shutdown ({} active plan(s), {} in flight)",
            engine.activePlanCount(), engine.inFlightCount());

        boolean drained = engine.shutdown(shutdownTimeout);
        if (!drained) {
            log.warn("Shutdown timeout of {}ms reached, remaining plans were cancelled", shutdownTimeout.toMillis());
        }

        sessionStore.close();
        log.info("Graceful shutdown complete");
        return drained;
    }
}
