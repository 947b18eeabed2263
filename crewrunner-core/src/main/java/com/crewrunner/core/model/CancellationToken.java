package com.crewrunner.core.model;

import com.crewrunner.core.exception.ExecutionCancelledException;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Per-execution stop flag for cooperative cancellation.
 *
 * <p>The executor cannot preempt a crew once it runs on a worker thread. Work
 * receives this token and is expected to poll it at safe points, for example
 * between agent steps:</p>
 * <pre>{@code
 * executionManager.submit("exec-42", token -> {
 *     for (Step step : steps) {
 *         token.throwIfStopRequested();
 *         step.run();
 *     }
 *     return "done";
 * });
 * }</pre>
 *
 * Once raised, the flag stays raised.
 */
public final class CancellationToken {

    private final String executionId;
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    public CancellationToken(String executionId) {
        this.executionId = executionId;
    }

    public String getExecutionId() {
        return executionId;
    }

    /**
     * Raise the stop flag. Idempotent.
     */
    public void requestStop() {
        stopSignal.countDown();
    }

    /**
     * Check if a stop was requested.
     */
    public boolean isStopRequested() {
        return stopSignal.getCount() == 0;
    }

    /**
     * Throw {@link ExecutionCancelledException} if a stop was requested.
     */
    public void throwIfStopRequested() {
        if (isStopRequested()) {
            throw new ExecutionCancelledException(executionId, "stop flag observed by work");
        }
    }

    /**
     * Block until a stop is requested or the timeout elapses.
     *
     * @return true if a stop was requested
     */
    public boolean awaitStop(Duration timeout) throws InterruptedException {
        return stopSignal.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
