package com.mergington.activities.engine.config;

import com.mergington.activities.core.model.Activity;
import com.mergington.activities.core.repository.ActivityRepository;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.*;

class ActivityRegistryConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withUserConfiguration(ActivityRegistryConfiguration.class);

    @Test
    void activityRepository_shouldBeSeededFromProperties() {
        contextRunner
            .withPropertyValues(
                "activities.seed[0].name=Chess Club",
                "activities.seed[0].description=Learn strategies",
                "activities.seed[0].schedule=Fridays, 3:30 PM - 5:00 PM",
                "activities.seed[0].max-participants=12",
                "activities.seed[0].participants[0]=michael@mergington.edu",
                "activities.seed[0].participants[1]=daniel@mergington.edu",
                "activities.seed[1].name=Math Club",
                "activities.seed[1].max-participants=10")
            .run(context -> {
                ActivityRepository repository = context.getBean(ActivityRepository.class);
                assertThat(repository.findAll()).extracting(Activity::name)
                    .containsExactly("Chess Club", "Math Club");
                Activity chess = repository.findByName("Chess Club").orElseThrow();
                assertThat(chess.maxParticipants()).isEqualTo(12);
                assertThat(chess.participants())
                    .containsExactly("michael@mergington.edu", "daniel@mergington.edu");
                assertThat(context.getBean(ActivityRegistryProperties.class).enforceCapacity()).isTrue();
            });
    }

    @Test
    void activityRepository_duplicateSeedNames_shouldFailStartup() {
        contextRunner
            .withPropertyValues(
                "activities.seed[0].name=Chess Club",
                "activities.seed[0].max-participants=12",
                "activities.seed[1].name=Chess Club",
                "activities.seed[1].max-participants=10")
            .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void enforceCapacity_shouldBeConfigurable() {
        contextRunner
            .withPropertyValues("activities.enforce-capacity=false")
            .run(context -> {
                assertThat(context.getBean(ActivityRegistryProperties.class).enforceCapacity()).isFalse();
                assertThat(context.getBean(ActivityRepository.class).count()).isZero();
            });
    }
}
