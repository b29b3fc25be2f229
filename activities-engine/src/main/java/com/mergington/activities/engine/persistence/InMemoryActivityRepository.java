package com.mergington.activities.engine.persistence;

import com.mergington.activities.core.exception.ActivityNotFoundException;
import com.mergington.activities.core.model.Activity;
import com.mergington.activities.core.repository.ActivityRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of ActivityRepository.
 * State lives for the lifetime of the process only.
 *
 * Updates go through {@link ConcurrentHashMap#computeIfPresent}, which runs the
 * mutation atomically per key: writers on the same activity are serialized,
 * writers on different activities proceed in parallel, and readers never block.
 */
public class InMemoryActivityRepository implements ActivityRepository {
    
    private final Map<String, Activity> activities = new ConcurrentHashMap<>();
    
    // Insertion order of names, for stable listing
    private final List<String> names = new CopyOnWriteArrayList<>();
    
    @Override
    public void save(Activity activity) {
        activities.compute(activity.name(), (name, existing) -> {
            if (existing == null) {
                names.add(name);
            }
            return activity;
        });
    }
    
    @Override
    public Optional<Activity> findByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(activities.get(name));
    }
    
    @Override
    public List<Activity> findAll() {
        return names.stream()
            .map(activities::get)
            .filter(Objects::nonNull)
            .toList();
    }
    
    @Override
    public Activity update(String name, UnaryOperator<Activity> mutation) {
        if (name == null) {
            throw new ActivityNotFoundException(null);
        }
        Activity updated = activities.computeIfPresent(name, (key, current) -> {
            Activity replacement = mutation.apply(current);
            if (replacement == null || !replacement.name().equals(key)) {
                throw new IllegalStateException("Mutation must return an activity named " + key);
            }
            return replacement;
        });
        if (updated == null) {
            throw new ActivityNotFoundException(name);
        }
        return updated;
    }
    
    @Override
    public int count() {
        return activities.size();
    }
}
