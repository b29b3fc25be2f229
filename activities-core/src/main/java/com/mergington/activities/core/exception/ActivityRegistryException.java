package com.mergington.activities.core.exception;

/**
 * Base exception for all activity registry errors.
 */
public class ActivityRegistryException extends RuntimeException {
    
    private final String errorCode;
    
    public ActivityRegistryException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
