package com.crewrunner.server.actuate;

import com.crewrunner.engine.execution.ExecutionManager;
import com.crewrunner.engine.metrics.ExecutionMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionsEndpointTest {

    private final ExecutionManager manager = new ExecutionManager(2, 10, new ExecutionMetrics());
    private final ExecutionsEndpoint endpoint = new ExecutionsEndpoint(manager);
    private final CountDownLatch release = new CountDownLatch(1);

    @AfterEach
    void tearDown() {
        release.countDown();
        manager.shutdown(false);
    }

    @Test
    @SuppressWarnings("unchecked")
    void executions_shouldReportMetricsAndRunningExecutions() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        manager.submit("live", stopFlag -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return "done";
        });
        manager.submit("quick", stopFlag -> "done").get(5, TimeUnit.SECONDS);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        Map<String, Object> body = endpoint.executions();

        Map<String, Object> metrics = (Map<String, Object>) body.get("metrics");
        assertThat(metrics).containsEntry("total", 2L).containsEntry("completed", 1L);
        List<Map<String, Object>> active = (List<Map<String, Object>>) body.get("active");
        assertThat(active).hasSize(1);
        assertThat(active.get(0)).containsEntry("executionId", "live").containsEntry("status", "RUNNING");
    }

    @Test
    void execution_shouldReturnSummaryOrNull() throws Exception {
        manager.submit("quick", stopFlag -> "done").get(5, TimeUnit.SECONDS);

        assertThat(endpoint.execution("quick")).containsEntry("status", "COMPLETED");
        assertThat(endpoint.execution("missing")).isNull();
    }
}
