package com.crewrunner.core.exception;

/**
 * Thrown when work is submitted to an executor that is shutting down
 * or whose worker pool refused the task.
 */
public class ExecutorUnavailableException extends CrewRunnerException {
    
    public static final String ERROR_CODE = "EXECUTOR_UNAVAILABLE";
    
    public ExecutorUnavailableException(String executionId) {
        super(ERROR_CODE, String.format(
            "Cannot accept execution %s: executor is shutting down",
            executionId
        ));
    }
    
    public ExecutorUnavailableException(String executionId, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Worker pool rejected execution %s",
            executionId
        ), cause);
    }
}
