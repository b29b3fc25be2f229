package com.mergington.activities.core.repository;

import com.mergington.activities.core.model.Activity;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Store for the activity registry.
 * Activities are keyed by name and are never deleted.
 */
public interface ActivityRepository {

    /**
     * Store an activity, replacing any activity with the same name.
     * 
     * @param activity The activity to store
     */
    void save(Activity activity);

    /**
     * Find an activity by its name.
     * 
     * @param name The activity name
     * @return The activity if found
     */
    Optional<Activity> findByName(String name);

    /**
     * List all activities.
     * 
     * @return All activities in the order they were first saved
     */
    List<Activity> findAll();

    /**
     * Atomically replace an activity with the result of the given mutation.
     * Updates on the same activity are serialized. If the mutation throws,
     * the stored activity is left unchanged and the exception propagates.
     * 
     * @param name The activity name
     * @param mutation Function from the current activity to its replacement
     * @return The stored replacement
     * @throws com.mergington.activities.core.exception.ActivityNotFoundException if no such activity exists
     */
    Activity update(String name, UnaryOperator<Activity> mutation);

    /**
     * Number of activities in the registry.
     */
    int count();
}
