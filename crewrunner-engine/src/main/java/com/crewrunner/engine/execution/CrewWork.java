package com.crewrunner.engine.execution;

import com.crewrunner.core.model.CancellationToken;

/**
 * A blocking unit of crew work run on a pool worker thread.
 * Implementations should poll the stop flag at safe points and return or
 * throw promptly once it is raised; the executor never interrupts them.
 *
 * @param <T> the crew result
 */
@FunctionalInterface
public interface CrewWork<T> {

    /**
     * Run the crew.
     *
     * @param stopFlag raised when a stop was requested, the deadline passed or the executor is shutting down
     * @return the crew result
     * @throws Exception if the crew fails; delivered to the caller unchanged
     */
    T run(CancellationToken stopFlag) throws Exception;
}
