package com.crewrunner.engine.execution;

import com.crewrunner.core.model.CancellationToken;
import com.crewrunner.core.model.ExecutionStatus;
import com.crewrunner.core.model.ExecutionSummary;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracking entry for one submitted crew.
 *
 * <p>Status and end time change under the record's monitor. The worker state is
 * tracked separately with compare-and-set so the pool thread, the timeout timer
 * and stop requests agree on whether the work ever started. Futures are never
 * completed while the monitor is held.</p>
 */
final class ExecutionRecord {

    /**
     * Where the work itself stands, independent of the execution status.
     */
    enum WorkerState {
        /** Dispatched, waiting for a pool thread. */
        QUEUED,
        /** Running on a pool thread. */
        RUNNING,
        /** Work returned or threw. */
        FINISHED,
        /** Prevented from starting. */
        SKIPPED,
        /** Still running although the execution already settled. */
        DETACHED
    }

    enum StopOutcome {
        NOT_RUNNING,
        PREVENTED,
        STOPPING
    }

    private final String executionId;
    private final Instant startTime;
    private final CancellationToken stopFlag;
    private final CompletableFuture<?> completion;
    private final String traceId;
    private final AtomicReference<WorkerState> workerState = new AtomicReference<>(WorkerState.QUEUED);

    private volatile Future<?> dispatch;
    private volatile String workerName;

    // guarded by this
    private ExecutionStatus status = ExecutionStatus.RUNNING;
    private Instant endTime;

    ExecutionRecord(String executionId, Instant startTime, CompletableFuture<?> completion) {
        this(executionId, startTime, completion, null);
    }

    ExecutionRecord(String executionId, Instant startTime, CompletableFuture<?> completion, String traceId) {
        this.executionId = executionId;
        this.startTime = startTime;
        this.stopFlag = new CancellationToken(executionId);
        this.completion = completion;
        this.traceId = traceId;
    }

    String executionId() {
        return executionId;
    }

    Instant startTime() {
        return startTime;
    }

    /** Trace id of the submitting thread, carried onto the worker; may be null. */
    String traceId() {
        return traceId;
    }

    CancellationToken stopFlag() {
        return stopFlag;
    }

    CompletableFuture<?> completion() {
        return completion;
    }

    synchronized ExecutionStatus status() {
        return status;
    }

    synchronized Instant endTime() {
        return endTime;
    }

    synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    synchronized ExecutionSummary summary(Instant now) {
        return ExecutionSummary.of(executionId, status, startTime, endTime, now);
    }

    /**
     * Move to {@code target} if the state machine allows it, stamping the end time
     * on entry to a terminal state.
     */
    synchronized boolean transitionTo(ExecutionStatus target, Instant now) {
        if (!status.canTransitionTo(target)) {
            return false;
        }
        status = target;
        if (target.isTerminal()) {
            endTime = now;
        }
        return true;
    }

    /**
     * Raise the stop flag if the execution is still RUNNING. Work that has not
     * started yet is prevented from starting; otherwise the status becomes STOPPING.
     */
    synchronized StopOutcome requestStop() {
        if (!status.acceptsStop() || workerState.get() == WorkerState.SKIPPED) {
            return StopOutcome.NOT_RUNNING;
        }
        stopFlag.requestStop();
        if (preventStart()) {
            return StopOutcome.PREVENTED;
        }
        status = ExecutionStatus.STOPPING;
        return StopOutcome.STOPPING;
    }

    void attachDispatch(Future<?> dispatch) {
        this.dispatch = dispatch;
    }

    /**
     * Drop the queued pool task, if any. A running task is not interrupted.
     */
    void cancelDispatch() {
        Future<?> current = dispatch;
        if (current != null) {
            current.cancel(false);
        }
    }

    /**
     * Claim the work for the calling pool thread.
     *
     * @return false if the work was prevented from starting
     */
    boolean markStarted(String workerName) {
        if (workerState.compareAndSet(WorkerState.QUEUED, WorkerState.RUNNING)) {
            this.workerName = workerName;
            return true;
        }
        return false;
    }

    /**
     * @return true if the work had not started and now never will
     */
    boolean preventStart() {
        return workerState.compareAndSet(WorkerState.QUEUED, WorkerState.SKIPPED);
    }

    /**
     * @return true if a running worker is now detached from its settled execution
     */
    boolean detachWorker() {
        return workerState.compareAndSet(WorkerState.RUNNING, WorkerState.DETACHED);
    }

    /**
     * Mark the work as returned.
     *
     * @return the worker state just before, RUNNING or DETACHED
     */
    WorkerState finishWorker() {
        return workerState.getAndSet(WorkerState.FINISHED);
    }

    WorkerState workerState() {
        return workerState.get();
    }

    String workerName() {
        return workerName;
    }
}
