package com.mergington.activities.engine.health;

import com.mergington.activities.core.model.Activity;
import com.mergington.activities.core.repository.ActivityRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reports the state of the activity registry:
 * - number of activities
 * - total participants
 * - activities with no places left
 */
@Component
public class ActivityRegistryHealthIndicator implements HealthIndicator {

    private final ActivityRepository repository;

    public ActivityRegistryHealthIndicator(ActivityRepository repository) {
        this.repository = repository;
    }

    @Override
    public Health health() {
        List<Activity> activities = repository.findAll();
        if (activities.isEmpty()) {
            return Health.down()
                .withDetail("activities", 0)
                .withDetail("reason", "Registry has no activities")
                .build();
        }

        int participants = activities.stream()
            .mapToInt(a -> a.participants().size())
            .sum();
        List<String> full = activities.stream()
            .filter(Activity::isFull)
            .map(Activity::name)
            .toList();

        return Health.up()
            .withDetail("activities", activities.size())
            .withDetail("participants", participants)
            .withDetail("fullActivities", full)
            .build();
    }
}
