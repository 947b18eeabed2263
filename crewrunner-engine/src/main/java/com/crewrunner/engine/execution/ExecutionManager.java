package com.crewrunner.engine.execution;

import com.crewrunner.core.exception.ExecutionCancelledException;
import com.crewrunner.core.exception.ExecutionTimeoutException;
import com.crewrunner.core.exception.ExecutorUnavailableException;
import com.crewrunner.core.model.ExecutionStatus;
import com.crewrunner.core.model.ExecutionSummary;
import com.crewrunner.core.model.MetricsSnapshot;
import com.crewrunner.engine.logging.LoggingContext;
import com.crewrunner.engine.metrics.ExecutionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs blocking crew work on a bounded pool of worker threads.
 *
 * Usage:
 * <pre>
 * ExecutionManager executions = new ExecutionManager();
 * CompletableFuture&lt;Report&gt; report = executions.submit(
 *     "exec-42", stopFlag -&gt; crew.kickoff(stopFlag), Duration.ofHours(1));
 * </pre>
 *
 * <p>Each submission is tracked by a record that moves RUNNING to one of
 * COMPLETED, FAILED, CANCELLED or TIMEOUT, possibly through STOPPING. The
 * returned future settles after the record, the metrics and the callbacks have
 * been updated, so a caller that observes the outcome also observes its
 * bookkeeping.</p>
 *
 * <p>Cancellation is cooperative: a running crew only stops when its work
 * honors the stop flag. Timeouts and stop requests settle the execution
 * immediately and leave the worker thread detached until the work returns.</p>
 */
public class ExecutionManager {

    private static final Logger log = LoggerFactory.getLogger(ExecutionManager.class);

    public static final int DEFAULT_POOL_SIZE = 20;
    public static final int DEFAULT_RETENTION_CAP = 100;

    private static final String WORKER_PREFIX = "CrewWorker-";
    private static final String CREW_THREAD_PREFIX = "Crew_";

    private final ThreadPoolExecutor pool;
    private final ScheduledThreadPoolExecutor timeoutScheduler;
    private final ExecutorService settlementExecutor;
    private final ExecutionRegistry registry = new ExecutionRegistry();
    private final CancellationController cancellation;
    private final ExecutionMetrics metrics;
    private final Clock clock;
    private final int retentionCap;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public ExecutionManager() {
        this(DEFAULT_POOL_SIZE, DEFAULT_RETENTION_CAP, new ExecutionMetrics(), Clock.systemUTC());
    }

    public ExecutionManager(int poolSize, int retentionCap, ExecutionMetrics metrics) {
        this(poolSize, retentionCap, metrics, Clock.systemUTC());
    }

    public ExecutionManager(int poolSize, int retentionCap, ExecutionMetrics metrics, Clock clock) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be >= 1");
        }
        if (retentionCap < 0) {
            throw new IllegalArgumentException("retentionCap must be >= 0");
        }
        this.retentionCap = retentionCap;
        this.metrics = metrics;
        this.clock = clock;
        this.cancellation = new CancellationController(metrics);
        this.timeoutScheduler = new ScheduledThreadPoolExecutor(1, namedThreads("CrewTimeout-", true));
        this.timeoutScheduler.setRemoveOnCancelPolicy(true);
        this.settlementExecutor = Executors.newCachedThreadPool(namedThreads("CrewSettle-", true));
        this.pool = new ThreadPoolExecutor(
            poolSize, poolSize, 0L, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(),
            namedThreads(WORKER_PREFIX, false)
        ) {
            // Deadlines stay armed until the last running crew has returned
            @Override
            protected void terminated() {
                timeoutScheduler.shutdownNow();
                settlementExecutor.shutdown();
                log.debug("Worker pool terminated, timeout scheduler stopped");
            }
        };

        log.info("Execution manager started with {} workers, retaining {} finished executions",
            poolSize, retentionCap);
    }

    // ========== Submission ==========

    public <T> CompletableFuture<T> submit(String executionId, CrewWork<T> work) {
        return submit(executionId, work, null, null, null);
    }

    public <T> CompletableFuture<T> submit(String executionId, CrewWork<T> work, Duration timeout) {
        return submit(executionId, work, timeout, null, null);
    }

    /**
     * Submit crew work without blocking the caller.
     *
     * @param executionId caller-chosen id, unique among live executions
     * @param work        the crew to run
     * @param timeout     deadline measured from submission; null for none
     * @param onComplete  invoked with the result on success; may be null
     * @param onError     invoked with the failure on error or timeout, not on cancellation; may be null
     * @return future settling with the result, the work's exception,
     *         {@link ExecutionTimeoutException} or {@link ExecutionCancelledException}
     * @throws com.crewrunner.core.exception.DuplicateExecutionException if the id is live
     * @throws ExecutorUnavailableException if shutdown has begun
     */
    public <T> CompletableFuture<T> submit(String executionId,
                                           CrewWork<T> work,
                                           Duration timeout,
                                           Consumer<? super T> onComplete,
                                           Consumer<? super Throwable> onError) {
        if (executionId == null || executionId.isBlank()) {
            throw new IllegalArgumentException("executionId must not be blank");
        }
        if (work == null) {
            throw new IllegalArgumentException("work must not be null");
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (shutdown.get()) {
            throw new ExecutorUnavailableException(executionId);
        }

        CompletableFuture<T> completion = new CompletableFuture<>();
        ExecutionRecord record = new ExecutionRecord(
            executionId, clock.instant(), completion, LoggingContext.currentOrNewTraceId());
        registry.register(record);
        metrics.executionStarted();

        // Attached before dispatch so settlement runs in whichever thread completes first
        CompletableFuture<T> settled = completion.handle(
            (result, failure) -> settle(record, result, failure, onComplete, onError));

        if (timeout != null) {
            scheduleTimeout(record, timeout);
        }

        try (LoggingContext ctx = LoggingContext.forExecution(executionId, null, record.traceId())) {
            log.info("Submitted execution {}{}", executionId,
                timeout != null ? " with timeout " + timeout : "");
            try {
                record.attachDispatch(pool.submit(worker(record, work, completion)));
            } catch (RejectedExecutionException e) {
                log.error("Worker pool rejected execution {}", executionId, e);
                record.preventStart();
                completion.completeExceptionally(new ExecutorUnavailableException(executionId, e));
            }
        }
        return settled;
    }

    /**
     * Submit and block until the execution settles.
     *
     * @throws Exception the work's own exception, or a timeout or cancellation exception
     */
    public <T> T run(String executionId, CrewWork<T> work, Duration timeout) throws Exception {
        CompletableFuture<T> future = submit(executionId, work, timeout);
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    private <T> Runnable worker(ExecutionRecord record, CrewWork<T> work, CompletableFuture<T> completion) {
        return () -> {
            Thread thread = Thread.currentThread();
            String poolName = thread.getName();
            if (!record.markStarted(poolName)) {
                log.debug("Skipping execution {}, prevented from starting", record.executionId());
                return;
            }

            String executionId = record.executionId();
            thread.setName(CREW_THREAD_PREFIX + shortId(executionId));
            try (LoggingContext ctx = LoggingContext.forExecution(executionId, poolName, record.traceId())) {
                log.info("Crew started on {}", poolName);
                try {
                    T result = work.run(record.stopFlag());
                    if (record.stopFlag().isStopRequested()) {
                        completion.completeExceptionally(
                            new ExecutionCancelledException(executionId, "stop flag raised before work returned"));
                    } else {
                        completion.complete(result);
                    }
                } catch (Exception e) {
                    completion.completeExceptionally(e);
                } catch (Error e) {
                    completion.completeExceptionally(e);
                    throw e;
                }
            } finally {
                thread.setName(poolName);
                cancellation.workerReturned(record);
            }
        };
    }

    private void scheduleTimeout(ExecutionRecord record, Duration timeout) {
        ScheduledFuture<?> timer = timeoutScheduler.schedule(
            () -> handOff(() -> expire(record, timeout)), timeout.toNanos(), TimeUnit.NANOSECONDS);
        record.completion().whenComplete((result, failure) -> timer.cancel(false));
    }

    // Settlement and user callbacks must not run on the shared timer thread
    private void handOff(Runnable expiry) {
        try {
            settlementExecutor.execute(expiry);
        } catch (RejectedExecutionException e) {
            expiry.run();
        }
    }

    private void expire(ExecutionRecord record, Duration timeout) {
        if (record.completion().isDone()) {
            return;
        }
        boolean prevented = record.preventStart();
        boolean expired = record.completion().completeExceptionally(
            new ExecutionTimeoutException(record.executionId(), timeout));
        if (!expired) {
            return;
        }
        record.stopFlag().requestStop();
        if (prevented) {
            record.cancelDispatch();
        } else {
            cancellation.detachWorker(record);
        }
    }

    // ========== Settlement ==========

    private <T> T settle(ExecutionRecord record,
                         T result,
                         Throwable failure,
                         Consumer<? super T> onComplete,
                         Consumer<? super Throwable> onError) {
        Throwable cause = unwrap(failure);
        ExecutionStatus outcome = outcomeOf(cause);
        Instant now = clock.instant();

        if (!record.transitionTo(outcome, now)) {
            log.warn("Execution {} could not move from {} to {}",
                record.executionId(), record.status(), outcome);
        }
        Duration duration = Duration.between(record.startTime(), now);
        metrics.recordOutcome(outcome, duration.isNegative() ? Duration.ZERO : duration);
        registry.pruneTerminal(retentionCap);

        try (LoggingContext ctx = LoggingContext.forExecution(record.executionId(), null, record.traceId())) {
            switch (outcome) {
                case COMPLETED -> log.info("Execution {} completed in {} ms",
                    record.executionId(), duration.toMillis());
                case TIMEOUT -> log.warn("Execution {} timed out: {}",
                    record.executionId(), cause.getMessage());
                case CANCELLED -> log.info("Execution {} cancelled: {}",
                    record.executionId(), cause.getMessage());
                default -> log.error("Execution {} failed", record.executionId(), cause);
            }

            if (outcome == ExecutionStatus.COMPLETED) {
                if (onComplete != null) {
                    onComplete.accept(result);
                }
                return result;
            }
            if (onError != null && outcome != ExecutionStatus.CANCELLED) {
                onError.accept(cause);
            }
        }
        throw new CompletionException(cause);
    }

    private static ExecutionStatus outcomeOf(Throwable cause) {
        if (cause == null) {
            return ExecutionStatus.COMPLETED;
        }
        if (cause instanceof ExecutionTimeoutException) {
            return ExecutionStatus.TIMEOUT;
        }
        if (cause instanceof ExecutionCancelledException || cause instanceof CancellationException) {
            return ExecutionStatus.CANCELLED;
        }
        return ExecutionStatus.FAILED;
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable cause = failure;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    // ========== Control and introspection ==========

    /**
     * Request a cooperative stop.
     *
     * @return true if the execution existed and was RUNNING
     */
    public boolean requestStop(String executionId) {
        Optional<ExecutionRecord> record = registry.find(executionId);
        if (record.isEmpty()) {
            log.warn("Stop requested for unknown execution {}", executionId);
            return false;
        }
        return cancellation.requestStop(record.get());
    }

    public MetricsSnapshot getMetrics() {
        return metrics.snapshot();
    }

    /**
     * Get executions currently RUNNING, oldest first.
     */
    public Map<String, ExecutionSummary> getActiveExecutions() {
        Instant now = clock.instant();
        Map<String, ExecutionSummary> active = new LinkedHashMap<>();
        registry.records().stream()
            .map(record -> record.summary(now))
            .filter(summary -> summary.status() == ExecutionStatus.RUNNING)
            .sorted(Comparator.comparing(ExecutionSummary::startTime))
            .forEach(summary -> active.put(summary.executionId(), summary));
        return active;
    }

    /**
     * Get a tracked execution, live or retained after settling.
     */
    public Optional<ExecutionSummary> getExecution(String executionId) {
        return registry.find(executionId).map(record -> record.summary(clock.instant()));
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    // ========== Shutdown ==========

    /**
     * Stop accepting work and raise every live stop flag.
     *
     * @param wait if true, block until all started and queued work returned;
     *             if false, queued work is cancelled and running work is left behind
     * @return true if the pool terminated (always false when not waiting and work is running)
     */
    public boolean shutdown(boolean wait) {
        return shutdown(wait, null);
    }

    /**
     * Like {@link #shutdown(boolean)}, waiting at most {@code maxWait}; null waits indefinitely.
     */
    public boolean shutdown(boolean wait, Duration maxWait) {
        if (!shutdown.compareAndSet(false, true)) {
            log.debug("Shutdown already in progress");
            return pool.isTerminated();
        }

        List<ExecutionRecord> live = registry.records().stream()
            .filter(record -> !record.isTerminal())
            .toList();
        log.info("Shutting down execution manager: {} live executions, wait={}", live.size(), wait);

        for (ExecutionRecord record : live) {
            record.stopFlag().requestStop();
        }
        if (!wait) {
            abandonQueued(live, "abandoned at shutdown");
        }

        pool.shutdown();
        boolean terminated = pool.isTerminated();
        if (wait) {
            terminated = awaitWorkers(maxWait, live);
        }

        MetricsSnapshot snapshot = metrics.snapshot();
        log.info("Execution manager shut down. total={} completed={} failed={} cancelled={} active={} "
                + "timedOut={} detachedWorkers={} averageDuration={}",
            snapshot.total(), snapshot.completed(), snapshot.failed(), snapshot.cancelled(),
            snapshot.active(), snapshot.timedOut(), snapshot.detachedWorkers(),
            snapshot.averageDuration().map(Duration::toString).orElse("n/a"));
        return terminated;
    }

    private boolean awaitWorkers(Duration maxWait, List<ExecutionRecord> live) {
        try {
            if (maxWait == null) {
                while (!pool.awaitTermination(1, TimeUnit.MINUTES)) {
                    log.info("Still waiting for {} running crews", pool.getActiveCount());
                }
                return true;
            }
            if (pool.awaitTermination(maxWait.toNanos(), TimeUnit.NANOSECONDS)) {
                return true;
            }
            log.warn("Shutdown timeout of {} reached with {} crews still running; interrupting workers",
                maxWait, pool.getActiveCount());
            pool.shutdownNow();
            abandonQueued(live, "shutdown timeout reached before start");
            return false;
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for running crews");
            pool.shutdownNow();
            abandonQueued(live, "shutdown interrupted before start");
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Settle every execution whose work has not started as cancelled; it never will.
     */
    private void abandonQueued(List<ExecutionRecord> live, String reason) {
        int abandoned = 0;
        for (ExecutionRecord record : live) {
            if (record.preventStart()) {
                record.cancelDispatch();
                record.completion().completeExceptionally(
                    new ExecutionCancelledException(record.executionId(), reason));
                abandoned++;
            }
        }
        if (abandoned > 0) {
            log.info("Cancelled {} queued executions: {}", abandoned, reason);
        }
    }

    // Visible for testing
    ExecutionRegistry registry() {
        return registry;
    }

    private static String shortId(String executionId) {
        return executionId.length() > 8 ? executionId.substring(0, 8) : executionId;
    }

    private static ThreadFactory namedThreads(String prefix, boolean daemon) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(daemon);
            return thread;
        };
    }
}
