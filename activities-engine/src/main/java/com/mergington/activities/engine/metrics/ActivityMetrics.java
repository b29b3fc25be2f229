package com.mergington.activities.engine.metrics;

import com.mergington.activities.core.model.Activity;
import com.mergington.activities.core.repository.ActivityRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Prometheus metrics for the activity registry.
 * 
 * Metrics exposed:
 * - Signup and unregistration counts per activity
 * - Rejected requests by reason
 * - Current participants per activity
 */
public class ActivityMetrics {

    // Metric names
    public static final String SIGNUPS = "activities.signups";
    public static final String UNREGISTRATIONS = "activities.unregistrations";
    public static final String REJECTIONS = "activities.rejections";
    public static final String PARTICIPANTS = "activities.participants";

    private final MeterRegistry registry;

    public ActivityMetrics(MeterRegistry registry, ActivityRepository repository) {
        this.registry = registry;
        
        // Activities are fixed after seeding, so one gauge each is enough
        for (Activity activity : repository.findAll()) {
            String name = activity.name();
            Gauge.builder(PARTICIPANTS, repository,
                    r -> r.findByName(name).map(a -> a.participants().size()).orElse(0))
                .tag("activity", name)
                .description("Number of students signed up for the activity")
                .register(registry);
        }
    }

    public void signupRecorded(String activityName) {
        Counter.builder(SIGNUPS)
            .tag("activity", activityName)
            .description("Total successful signups")
            .register(registry)
            .increment();
    }

    public void unregistrationRecorded(String activityName) {
        Counter.builder(UNREGISTRATIONS)
            .tag("activity", activityName)
            .description("Total successful unregistrations")
            .register(registry)
            .increment();
    }

    /**
     * Count a rejected signup or unregister. Tagged by reason only, since the
     * activity name of a not-found request is arbitrary client input.
     */
    public void rejectionRecorded(String operation, String reason) {
        Counter.builder(REJECTIONS)
            .tag("operation", operation)
            .tag("reason", reason)
            .description("Total rejected registry mutations")
            .register(registry)
            .increment();
    }
}
