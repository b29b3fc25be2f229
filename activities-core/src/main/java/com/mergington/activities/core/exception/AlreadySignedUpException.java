package com.mergington.activities.core.exception;

/**
 * Thrown when a student signs up for an activity they already belong to.
 */
public class AlreadySignedUpException extends ActivityRegistryException {
    
    public static final String ERROR_CODE = "ALREADY_SIGNED_UP";
    
    public AlreadySignedUpException() {
        super(ERROR_CODE, "Student is already signed up");
    }
}
