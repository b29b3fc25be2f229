package com.mergington.activities.engine.config;

import com.mergington.activities.core.model.Activity;
import com.mergington.activities.core.repository.ActivityRepository;
import com.mergington.activities.engine.persistence.InMemoryActivityRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the activity registry and seeds it from configuration.
 */
@Configuration
@EnableConfigurationProperties(ActivityRegistryProperties.class)
public class ActivityRegistryConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ActivityRegistryConfiguration.class);

    @Bean
    public ActivityRepository activityRepository(ActivityRegistryProperties properties) {
        InMemoryActivityRepository repository = new InMemoryActivityRepository();
        for (ActivityRegistryProperties.SeedActivity seed : properties.seed()) {
            Activity activity = seed.toActivity();
            if (repository.findByName(activity.name()).isPresent()) {
                throw new IllegalStateException("Duplicate seed activity: " + activity.name());
            }
            repository.save(activity);
        }
        log.info("Activity registry seeded with {} activities (enforceCapacity={})",
            repository.count(), properties.enforceCapacity());
        return repository;
    }
}
