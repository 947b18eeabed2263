package com.crewrunner.core.exception;

import java.time.Duration;

/**
 * Thrown to the caller when an execution does not settle before its deadline.
 * The worker thread running the crew is not interrupted and may keep running.
 */
public class ExecutionTimeoutException extends CrewRunnerException {
    
    public static final String ERROR_CODE = "EXECUTION_TIMEOUT";
    
    private final String executionId;
    private final Duration timeout;
    
    public ExecutionTimeoutException(String executionId, Duration timeout) {
        super(ERROR_CODE, String.format(
            "Execution %s timed out after %d ms",
            executionId, timeout.toMillis()
        ));
        this.executionId = executionId;
        this.timeout = timeout;
    }
    
    public String getExecutionId() {
        return executionId;
    }
    
    public Duration getTimeout() {
        return timeout;
    }
}
