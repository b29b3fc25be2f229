package com.mergington.activities.engine.service;

import com.mergington.activities.core.model.Activity;

/**
 * Outcome of a signup or unregister.
 *
 * @param activity the activity after the change
 * @param participant the normalized email that was added or removed
 */
public record Registration(Activity activity, String participant) {}
