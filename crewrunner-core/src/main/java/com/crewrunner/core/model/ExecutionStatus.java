package com.crewrunner.core.model;

/**
 * Lifecycle states for a crew execution.
 * Transitions follow a strict state machine; terminal states never change again.
 */
public enum ExecutionStatus {
    /**
     * Registered and dispatched to the worker pool, queued or running.
     * Transitions: -> COMPLETED, FAILED, CANCELLED, TIMEOUT, STOPPING
     */
    RUNNING,

    /**
     * Stop requested after the work started on a worker thread.
     * The thread keeps running until the work honors its stop flag or returns.
     * Transitions: -> CANCELLED (or the outcome of work that settled first)
     */
    STOPPING,

    /**
     * Work returned normally. Terminal state.
     */
    COMPLETED,

    /**
     * Work raised an exception. Terminal state.
     */
    FAILED,

    /**
     * Prevented from starting, or stop accepted while running. Terminal state.
     */
    CANCELLED,

    /**
     * Deadline elapsed before the work settled. Terminal state.
     * Counted as failed in aggregate metrics.
     */
    TIMEOUT;

    /**
     * Check if this state is terminal (no further transitions possible).
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED || this == TIMEOUT;
    }

    /**
     * Check if a stop request is still accepted in this state.
     */
    public boolean acceptsStop() {
        return this == RUNNING;
    }

    /**
     * Check if this state can transition to the target state.
     */
    public boolean canTransitionTo(ExecutionStatus target) {
        return switch (this) {
            case RUNNING -> target != RUNNING;
            case STOPPING -> target.isTerminal();
            case COMPLETED, FAILED, CANCELLED, TIMEOUT -> false;
        };
    }
}
