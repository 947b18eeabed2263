package com.crewrunner.core.exception;

/**
 * Thrown when an execution was cancelled, either before its work started or
 * through a stop request observed while it was running.
 *
 * <p>Crew work may throw this itself after noticing its stop flag.</p>
 */
public class ExecutionCancelledException extends CrewRunnerException {
    
    public static final String ERROR_CODE = "EXECUTION_CANCELLED";
    
    private final String executionId;
    
    public ExecutionCancelledException(String executionId, String reason) {
        super(ERROR_CODE, String.format(
            "Execution %s was cancelled: %s",
            executionId, reason
        ));
        this.executionId = executionId;
    }
    
    public String getExecutionId() {
        return executionId;
    }
}
