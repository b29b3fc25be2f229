package com.mergington.activities.core.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * An extracurricular activity and the students signed up for it.
 * Immutable: every mutation returns a new instance.
 *
 * Invariants:
 * - name is not blank
 * - maxParticipants > 0
 * - participants contains no duplicates and keeps signup order
 */
public record Activity(
    String name,
    String description,
    String schedule,
    int maxParticipants,
    List<String> participants
) {
    public Activity {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Activity name must not be blank");
        }
        if (maxParticipants <= 0) {
            throw new IllegalArgumentException(
                "maxParticipants must be positive for " + name + ": " + maxParticipants);
        }
        description = description != null ? description : "";
        schedule = schedule != null ? schedule : "";
        participants = participants != null ? List.copyOf(participants) : List.of();
        if (new LinkedHashSet<>(participants).size() != participants.size()) {
            throw new IllegalArgumentException("Duplicate participants in " + name);
        }
    }

    /**
     * Create an activity with no participants.
     */
    public static Activity create(String name, String description, String schedule, int maxParticipants) {
        return new Activity(name, description, schedule, maxParticipants, List.of());
    }

    public boolean hasParticipant(String email) {
        return participants.contains(email);
    }

    public boolean isFull() {
        return participants.size() >= maxParticipants;
    }

    /**
     * Remaining places; zero when the activity is at or over capacity.
     */
    public int spotsLeft() {
        return Math.max(0, maxParticipants - participants.size());
    }

    /**
     * Copy with the participant appended.
     */
    public Activity withParticipant(String email) {
        List<String> updated = new ArrayList<>(participants);
        updated.add(email);
        return new Activity(name, description, schedule, maxParticipants, updated);
    }

    /**
     * Copy with the participant removed.
     */
    public Activity withoutParticipant(String email) {
        List<String> updated = new ArrayList<>(participants);
        updated.remove(email);
        return new Activity(name, description, schedule, maxParticipants, updated);
    }
}
