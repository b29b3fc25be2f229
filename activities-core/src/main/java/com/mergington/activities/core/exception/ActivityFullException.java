package com.mergington.activities.core.exception;

/**
 * Thrown when an activity has no places left.
 */
public class ActivityFullException extends ActivityRegistryException {
    
    public static final String ERROR_CODE = "ACTIVITY_FULL";
    
    public ActivityFullException() {
        super(ERROR_CODE, "Activity is full");
    }
}
