package com.crewrunner.core.exception;

/**
 * Thrown when a consumer asks a token bucket for more tokens than it can ever hold.
 * Such a request could never be granted, however long the caller waited.
 */
public class TokenRequestExceedsCapacityException extends CrewRunnerException {
    
    public static final String ERROR_CODE = "TOKEN_REQUEST_EXCEEDS_CAPACITY";
    
    private final double requested;
    private final double capacity;
    
    public TokenRequestExceedsCapacityException(double requested, double capacity) {
        super(ERROR_CODE, String.format(
            "Requested %.1f tokens but bucket capacity is %.1f",
            requested, capacity
        ));
        this.requested = requested;
        this.capacity = capacity;
    }
    
    public double getRequested() {
        return requested;
    }
    
    public double getCapacity() {
        return capacity;
    }
}
