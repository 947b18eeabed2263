package com.crewrunner.core.exception;

/**
 * Base exception for all crew runner errors.
 */
public class CrewRunnerException extends RuntimeException {
    
    private final String errorCode;
    
    public CrewRunnerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public CrewRunnerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
