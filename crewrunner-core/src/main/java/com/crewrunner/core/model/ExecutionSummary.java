package com.crewrunner.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Read-only view of a tracked execution, as reported by the introspection API.
 */
public record ExecutionSummary(
    String executionId,
    ExecutionStatus status,
    Instant startTime,
    // Null until the execution reaches a terminal state
    Instant endTime,
    Duration elapsed
) {
    /**
     * Build a summary, measuring elapsed time up to {@code now} for live executions.
     */
    public static ExecutionSummary of(String executionId, ExecutionStatus status,
                                      Instant startTime, Instant endTime, Instant now) {
        Instant until = endTime != null ? endTime : now;
        Duration elapsed = Duration.between(startTime, until);
        return new ExecutionSummary(
            executionId,
            status,
            startTime,
            endTime,
            elapsed.isNegative() ? Duration.ZERO : elapsed
        );
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
