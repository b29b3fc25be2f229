package com.mergington.activities.engine.service;

import com.mergington.activities.core.model.Activity;
import java.util.List;

/**
 * Core service for the activity registry.
 * Looks up activities and manages their participants.
 */
public interface ActivityService {

    /**
     * List every activity.
     * 
     * @return All activities in registry order
     */
    List<Activity> listActivities();

    /**
     * Get a single activity.
     * 
     * @param activityName The activity name
     * @return The activity
     * @throws com.mergington.activities.core.exception.ActivityNotFoundException if unknown
     */
    Activity getActivity(String activityName);

    /**
     * Sign a student up for an activity.
     * 
     * @param activityName The activity name
     * @param email The student's email
     * @return The activity after the signup and the normalized email
     * @throws com.mergington.activities.core.exception.ActivityNotFoundException if unknown, checked first
     * @throws com.mergington.activities.core.exception.AlreadySignedUpException if already a participant
     * @throws com.mergington.activities.core.exception.ActivityFullException if capacity is enforced and reached
     * @throws com.mergington.activities.core.exception.InvalidParticipantException if the email is malformed
     */
    Registration signup(String activityName, String email);

    /**
     * Remove a student from an activity.
     * 
     * @param activityName The activity name
     * @param email The student's email
     * @return The activity after the removal and the normalized email
     * @throws com.mergington.activities.core.exception.ActivityNotFoundException if unknown, checked first
     * @throws com.mergington.activities.core.exception.NotSignedUpException if not a participant
     * @throws com.mergington.activities.core.exception.InvalidParticipantException if the email is malformed
     */
    Registration unregister(String activityName, String email);
}
