package com.mergington.activities.core.exception;

/**
 * Thrown when an activity with the requested name does not exist.
 */
public class ActivityNotFoundException extends ActivityRegistryException {
    
    public static final String ERROR_CODE = "ACTIVITY_NOT_FOUND";
    
    private final String activityName;
    
    public ActivityNotFoundException(String activityName) {
        super(ERROR_CODE, "Activity not found");
        this.activityName = activityName;
    }
    
    public String getActivityName() {
        return activityName;
    }
}
