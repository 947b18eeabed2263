package com.crewrunner.engine.metrics;

import com.crewrunner.core.model.ExecutionStatus;
import com.crewrunner.core.model.MetricsSnapshot;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;
import java.util.Locale;

/**
 * Aggregate counters for crew executions, also exported through Micrometer.
 *
 * <p>All counters change under one monitor so every {@link #snapshot()} satisfies
 * {@code active + completed + failed + cancelled == total}.</p>
 *
 * Metrics exposed:
 * - Executions started and settled, by outcome
 * - Executions currently active
 * - Worker threads still busy with work whose execution already settled
 * - Execution duration by outcome
 */
public class ExecutionMetrics implements MeterBinder {

    // Metric names
    public static final String EXECUTIONS_STARTED = "crewrunner.executions.started";
    public static final String EXECUTIONS_COMPLETED = "crewrunner.executions.completed";
    public static final String EXECUTIONS_FAILED = "crewrunner.executions.failed";
    public static final String EXECUTIONS_CANCELLED = "crewrunner.executions.cancelled";
    public static final String EXECUTIONS_TIMEOUTS = "crewrunner.executions.timeouts";
    public static final String EXECUTIONS_ACTIVE = "crewrunner.executions.active";
    public static final String WORKERS_DETACHED = "crewrunner.workers.detached";
    public static final String EXECUTION_DURATION = "crewrunner.execution.duration";

    private volatile MeterRegistry registry;

    // guarded by this
    private long total;
    private long active;
    private long completed;
    private long failed;
    private long cancelled;
    private long timedOut;
    private Duration totalDuration = Duration.ZERO;
    private long detachedWorkers;

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        FunctionCounter.builder(EXECUTIONS_STARTED, this, m -> m.snapshot().total())
            .description("Total crew executions started")
            .register(registry);
        FunctionCounter.builder(EXECUTIONS_COMPLETED, this, m -> m.snapshot().completed())
            .description("Total crew executions completed successfully")
            .register(registry);
        FunctionCounter.builder(EXECUTIONS_FAILED, this, m -> m.snapshot().failed())
            .description("Total crew executions failed, timeouts included")
            .register(registry);
        FunctionCounter.builder(EXECUTIONS_CANCELLED, this, m -> m.snapshot().cancelled())
            .description("Total crew executions cancelled")
            .register(registry);
        FunctionCounter.builder(EXECUTIONS_TIMEOUTS, this, m -> m.snapshot().timedOut())
            .description("Total crew executions that hit their deadline")
            .register(registry);

        Gauge.builder(EXECUTIONS_ACTIVE, this, m -> m.snapshot().active())
            .description("Crew executions not yet settled")
            .register(registry);
        Gauge.builder(WORKERS_DETACHED, this, m -> m.snapshot().detachedWorkers())
            .description("Worker threads still running work of a settled execution")
            .register(registry);
    }

    public synchronized void executionStarted() {
        total++;
        active++;
    }

    /**
     * Move one execution from active to the counter for its terminal outcome.
     */
    public void recordOutcome(ExecutionStatus outcome, Duration duration) {
        if (!outcome.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal outcome: " + outcome);
        }
        synchronized (this) {
            active--;
            switch (outcome) {
                case COMPLETED -> {
                    completed++;
                    totalDuration = totalDuration.plus(duration);
                }
                case FAILED -> failed++;
                case TIMEOUT -> {
                    failed++;
                    timedOut++;
                }
                case CANCELLED -> cancelled++;
                default -> throw new IllegalStateException("Unexpected outcome: " + outcome);
            }
        }

        MeterRegistry meters = registry;
        if (meters != null) {
            Timer.builder(EXECUTION_DURATION)
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .description("Crew execution duration, from submission to settlement")
                .register(meters)
                .record(duration);
        }
    }

    public synchronized void workerDetached() {
        detachedWorkers++;
    }

    public synchronized void detachedWorkerReturned() {
        detachedWorkers--;
    }

    public synchronized MetricsSnapshot snapshot() {
        return new MetricsSnapshot(
            total, active, completed, failed, cancelled, timedOut, totalDuration, detachedWorkers
        );
    }
}
