package com.crewrunner.core.exception;

/**
 * Thrown when an execution is submitted with the id of an execution that is still live.
 */
public class DuplicateExecutionException extends CrewRunnerException {
    
    public static final String ERROR_CODE = "DUPLICATE_EXECUTION";
    
    private final String executionId;
    
    public DuplicateExecutionException(String executionId) {
        super(ERROR_CODE, String.format(
            "Execution '%s' is already running",
            executionId
        ));
        this.executionId = executionId;
    }
    
    public String getExecutionId() {
        return executionId;
    }
}
