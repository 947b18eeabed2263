package com.crewrunner.server;

import com.crewrunner.core.ratelimit.ProviderRateLimiter;
import com.crewrunner.core.ratelimit.ProviderTokenLimit;
import com.crewrunner.core.ratelimit.TokenBucketManager;
import com.crewrunner.engine.execution.ExecutionManager;
import com.crewrunner.engine.health.ExecutionHealthIndicator;
import com.crewrunner.engine.metrics.ExecutionMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.NONE,
    properties = {
        "crewrunner.executor.pool-size=2",
        "crewrunner.executor.retention-cap=5"
    }
)
class CrewRunnerApplicationTest {

    @Autowired
    private ExecutionManager executionManager;

    @Autowired
    private ProviderRateLimiter providerRateLimiter;

    @Autowired
    private TokenBucketManager tokenBucketManager;

    @Autowired
    private ExecutionHealthIndicator healthIndicator;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    void contextLoads_withSharedExecutionAndRateLimitComponents() throws Exception {
        assertThat(executionManager.submit("context-check", stopFlag -> "ok").get(5, TimeUnit.SECONDS))
            .isEqualTo("ok");
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.UP);

        assertThat(providerRateLimiter.consume(ProviderTokenLimit.ANTHROPIC_INPUT, 1_000, null, false)).isTrue();
        assertThat(tokenBucketManager.findBucket("anthropic-input")).isPresent();
        assertThat(providerRateLimiter.getBucketManager()).isSameAs(tokenBucketManager);
    }

    @Test
    void executionMetrics_shouldBeBoundWithCommonTag() throws Exception {
        executionManager.submit("metrics-check", stopFlag -> "ok").get(5, TimeUnit.SECONDS);

        assertThat(meterRegistry.get(ExecutionMetrics.EXECUTIONS_COMPLETED)
                .tag("application", "crew-runner")
                .functionCounter()
                .count())
            .isGreaterThanOrEqualTo(1.0);
    }
}
