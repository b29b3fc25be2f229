package com.mergington.activities.engine.config;

import com.mergington.activities.core.model.Activity;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Registry settings bound from the {@code activities.*} properties.
 *
 * @param enforceCapacity reject signups once an activity reaches max participants
 * @param seed activities loaded into the registry at startup, in listing order
 */
@ConfigurationProperties(prefix = "activities")
public record ActivityRegistryProperties(
    @DefaultValue("true") boolean enforceCapacity,
    List<SeedActivity> seed
) {
    public ActivityRegistryProperties {
        seed = seed != null ? List.copyOf(seed) : List.of();
    }

    public record SeedActivity(
        String name,
        String description,
        String schedule,
        int maxParticipants,
        List<String> participants
    ) {
        public Activity toActivity() {
            return new Activity(name, description, schedule, maxParticipants, participants);
        }
    }
}
