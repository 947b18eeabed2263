package com.crewrunner.engine.execution;

import com.crewrunner.core.exception.ExecutionCancelledException;
import com.crewrunner.engine.logging.LoggingContext;
import com.crewrunner.engine.metrics.ExecutionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies stop requests to execution records.
 *
 * <p>Work that has not started is prevented from ever starting. Work that is
 * already running cannot be preempted: its stop flag is raised, the execution
 * settles as cancelled right away and the worker thread is tracked as detached
 * until the work returns.</p>
 */
class CancellationController {

    private static final Logger log = LoggerFactory.getLogger(CancellationController.class);

    private final ExecutionMetrics metrics;

    CancellationController(ExecutionMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * @return true if the record was RUNNING and the stop was applied
     */
    boolean requestStop(ExecutionRecord record) {
        String executionId = record.executionId();
        ExecutionRecord.StopOutcome outcome = record.requestStop();

        try (LoggingContext ctx = LoggingContext.forExecution(executionId, null, record.traceId())) {
            switch (outcome) {
                case NOT_RUNNING -> {
                    log.info("Stop ignored for execution {} in state {}", executionId, record.status());
                    return false;
                }
                case PREVENTED -> {
                    record.cancelDispatch();
                    log.info("Stopped execution {} before its work started", executionId);
                    record.completion().completeExceptionally(
                        new ExecutionCancelledException(executionId, "stopped before start"));
                    return true;
                }
                case STOPPING -> {
                    log.info("Stop requested for running execution {}", executionId);
                    record.completion().completeExceptionally(
                        new ExecutionCancelledException(executionId, "stop requested"));
                    detachWorker(record);
                    return true;
                }
                default -> throw new IllegalStateException("Unexpected stop outcome: " + outcome);
            }
        }
    }

    /**
     * Track the record's running worker as detached from its already settled execution.
     */
    void detachWorker(ExecutionRecord record) {
        // Count first so the worker's return can never decrement below zero
        metrics.workerDetached();
        if (record.detachWorker()) {
            log.warn("Worker {} still running work of settled execution {}",
                record.workerName(), record.executionId());
        } else {
            metrics.detachedWorkerReturned();
        }
    }

    /**
     * Called by the pool thread once the work returned or threw.
     */
    void workerReturned(ExecutionRecord record) {
        if (record.finishWorker() == ExecutionRecord.WorkerState.DETACHED) {
            metrics.detachedWorkerReturned();
            log.info("Detached worker {} returned from execution {}",
                record.workerName(), record.executionId());
        }
    }
}
