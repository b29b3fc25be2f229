package com.mergington.activities.engine.metrics;

import com.mergington.activities.core.repository.ActivityRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Prometheus metrics configuration for the activities service.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "activities-service");
    }

    @Bean
    public ActivityMetrics activityMetrics(MeterRegistry registry, ActivityRepository repository) {
        return new ActivityMetrics(registry, repository);
    }
}
