package com.crewrunner.core.model;

import java.time.Duration;
import java.util.Optional;

/**
 * Point-in-time copy of the execution counters.
 *
 * Invariants:
 * - active + completed + failed + cancelled == total
 * - timedOut is a subset of failed
 * - totalDuration covers completed executions only
 */
public record MetricsSnapshot(
    long total,
    long active,
    long completed,
    long failed,
    long cancelled,
    long timedOut,
    Duration totalDuration,
    // Worker threads still running work whose execution already settled
    long detachedWorkers
) {
    public static MetricsSnapshot empty() {
        return new MetricsSnapshot(0, 0, 0, 0, 0, 0, Duration.ZERO, 0);
    }

    /**
     * Mean duration of completed executions, empty until one completes.
     */
    public Optional<Duration> averageDuration() {
        if (completed == 0) {
            return Optional.empty();
        }
        return Optional.of(totalDuration.dividedBy(completed));
    }

    /**
     * Number of executions that reached a terminal state.
     */
    public long settled() {
        return completed + failed + cancelled;
    }
}
