package com.mergington.activities.core.exception;

/**
 * Thrown when a participant email is missing or malformed.
 */
public class InvalidParticipantException extends ActivityRegistryException {
    
    public static final String ERROR_CODE = "INVALID_PARTICIPANT";
    
    public InvalidParticipantException() {
        super(ERROR_CODE, "Invalid email address");
    }
}
