package com.crewrunner.core.exception;

/**
 * Thrown when an execution or rate limit bucket is not found.
 */
public class NotFoundException extends CrewRunnerException {
    
    public static final String ERROR_CODE = "NOT_FOUND";
    
    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
