package com.crewrunner.engine.lifecycle;

import com.crewrunner.engine.execution.ExecutionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Drains the execution manager when the application context closes.
 *
 * On shutdown:
 * 1. Stops accepting new crews
 * 2. Raises the stop flag of every live execution
 * 3. Waits for running and queued crews to return (with timeout)
 * 4. Logs final execution metrics
 */
@Component
public class ExecutionShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(ExecutionShutdownHandler.class);

    private final ExecutionManager executionManager;
    private final Duration shutdownTimeout;

    public ExecutionShutdownHandler(
            ExecutionManager executionManager,
            @Value("${crewrunner.executor.shutdown-timeout:30s}") Duration shutdownTimeout) {
        this.executionManager = executionManager;
        this.shutdownTimeout = shutdownTimeout;
    }

    /**
     * Handle application shutdown event.
     * This runs before Spring context is fully closed.
     */
    @EventListener(ContextClosedEvent.class)
    @Order(0) // Run early in shutdown sequence
    public void onShutdown(ContextClosedEvent event) {
        if (executionManager.isShutdown()) {
            return;
        }
        log.info("Initiating graceful shutdown of crew executions (timeout: {})", shutdownTimeout);

        boolean drained = executionManager.shutdown(true, shutdownTimeout);

        if (drained) {
            log.info("Graceful shutdown complete");
        } else {
            log.warn("Graceful shutdown finished with crews still running");
        }
    }
}
