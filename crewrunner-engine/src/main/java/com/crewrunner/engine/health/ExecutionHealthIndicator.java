package com.crewrunner.engine.health;

import com.crewrunner.core.model.MetricsSnapshot;
import com.crewrunner.engine.execution.ExecutionManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Health indicator for the crew executor.
 * Reports health status based on:
 * - Whether the executor still accepts work
 * - Execution counters
 * - Detached worker threads
 */
@Component("crewRunnerHealthIndicator")
public class ExecutionHealthIndicator implements HealthIndicator {

    private final ExecutionManager executionManager;

    public ExecutionHealthIndicator(ExecutionManager executionManager) {
        this.executionManager = executionManager;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        MetricsSnapshot metrics = executionManager.getMetrics();

        details.put("total", metrics.total());
        details.put("active", metrics.active());
        details.put("completed", metrics.completed());
        details.put("failed", metrics.failed());
        details.put("cancelled", metrics.cancelled());
        details.put("timedOut", metrics.timedOut());
        details.put("detachedWorkers", metrics.detachedWorkers());
        metrics.averageDuration().ifPresent(avg -> details.put("averageDurationMs", avg.toMillis()));

        // Detached workers hold pool threads until their crews return
        if (metrics.detachedWorkers() > 0) {
            details.put("workerWarning",
                metrics.detachedWorkers() + " worker threads still running settled crews");
        }

        if (executionManager.isShutdown()) {
            return Health.down()
                .withDetail("executor", "shut down")
                .withDetails(details)
                .build();
        }
        return Health.up()
            .withDetail("executor", "accepting")
            .withDetails(details)
            .build();
    }
}
