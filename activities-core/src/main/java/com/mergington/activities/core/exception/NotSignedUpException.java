package com.mergington.activities.core.exception;

/**
 * Thrown when unregistering a student who is not a participant.
 */
public class NotSignedUpException extends ActivityRegistryException {
    
    public static final String ERROR_CODE = "NOT_SIGNED_UP";
    
    public NotSignedUpException() {
        super(ERROR_CODE, "Student is not signed up for this activity");
    }
}
