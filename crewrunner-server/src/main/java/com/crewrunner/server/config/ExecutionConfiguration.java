package com.crewrunner.server.config;

import com.crewrunner.core.ratelimit.ProviderRateLimiter;
import com.crewrunner.core.ratelimit.TokenBucketManager;
import com.crewrunner.engine.execution.ExecutionManager;
import com.crewrunner.engine.metrics.ExecutionMetrics;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-scoped execution and rate limiting components.
 * One execution manager and one bucket manager are shared by every caller in the process.
 */
@Configuration
public class ExecutionConfiguration {

    @Bean
    public ExecutionMetrics executionMetrics() {
        return new ExecutionMetrics();
    }

    @Bean
    public ExecutionManager executionManager(
            ExecutionMetrics executionMetrics,
            @Value("${crewrunner.executor.pool-size:20}") int poolSize,
            @Value("${crewrunner.executor.retention-cap:100}") int retentionCap) {
        return new ExecutionManager(poolSize, retentionCap, executionMetrics);
    }

    @Bean
    public TokenBucketManager tokenBucketManager() {
        return new TokenBucketManager();
    }

    @Bean
    public ProviderRateLimiter providerRateLimiter(TokenBucketManager tokenBucketManager) {
        return new ProviderRateLimiter(tokenBucketManager);
    }
}
