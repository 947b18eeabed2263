package com.crewrunner.server.actuate;

import com.crewrunner.core.model.ExecutionSummary;
import com.crewrunner.core.model.MetricsSnapshot;
import com.crewrunner.engine.execution.ExecutionManager;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.boot.actuate.endpoint.annotation.Selector;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only actuator endpoint for crew executions.
 *
 * <pre>
 * GET /actuator/executions               metrics and running executions
 * GET /actuator/executions/{executionId} one tracked execution
 * </pre>
 */
@Component
@Endpoint(id = "executions")
public class ExecutionsEndpoint {

    private final ExecutionManager executionManager;

    public ExecutionsEndpoint(ExecutionManager executionManager) {
        this.executionManager = executionManager;
    }

    @ReadOperation
    public Map<String, Object> executions() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("metrics", describe(executionManager.getMetrics()));

        List<Map<String, Object>> active = new ArrayList<>();
        executionManager.getActiveExecutions().values().forEach(summary -> active.add(describe(summary)));
        body.put("active", active);
        return body;
    }

    /**
     * Returns null, rendered as 404, for executions that are unknown or already pruned.
     */
    @ReadOperation
    public Map<String, Object> execution(@Selector String executionId) {
        return executionManager.getExecution(executionId)
            .map(ExecutionsEndpoint::describe)
            .orElse(null);
    }

    private static Map<String, Object> describe(MetricsSnapshot metrics) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("total", metrics.total());
        view.put("active", metrics.active());
        view.put("completed", metrics.completed());
        view.put("failed", metrics.failed());
        view.put("cancelled", metrics.cancelled());
        view.put("timedOut", metrics.timedOut());
        view.put("totalDurationMs", metrics.totalDuration().toMillis());
        view.put("averageDurationMs", metrics.averageDuration().map(d -> d.toMillis()).orElse(null));
        view.put("detachedWorkers", metrics.detachedWorkers());
        return view;
    }

    private static Map<String, Object> describe(ExecutionSummary summary) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("executionId", summary.executionId());
        view.put("status", summary.status().name());
        view.put("startTime", summary.startTime().toString());
        view.put("endTime", summary.endTime() != null ? summary.endTime().toString() : null);
        view.put("elapsedMs", summary.elapsed().toMillis());
        return view;
    }
}
