package com.mergington.activities.engine.persistence;

import com.mergington.activities.core.exception.ActivityNotFoundException;
import com.mergington.activities.core.exception.AlreadySignedUpException;
import com.mergington.activities.core.model.Activity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class InMemoryActivityRepositoryTest {

    private InMemoryActivityRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryActivityRepository();
        repository.save(Activity.create("Chess Club", "Strategy", "Fridays", 12));
        repository.save(Activity.create("Art Club", "Painting", "Mondays", 15));
        repository.save(Activity.create("Math Club", "Puzzles", "Wednesdays", 10));
    }

    @Test
    void findAll_shouldKeepInsertionOrder() {
        assertThat(repository.findAll())
            .extracting(Activity::name)
            .containsExactly("Chess Club", "Art Club", "Math Club");
    }

    @Test
    void save_existingName_shouldReplaceWithoutReordering() {
        repository.save(new Activity("Chess Club", "Strategy", "Fridays", 12, List.of("a@mergington.edu")));

        assertThat(repository.count()).isEqualTo(3);
        assertThat(repository.findAll().get(0).participants()).containsExactly("a@mergington.edu");
    }

    @Test
    void findByName_shouldBeExactMatch() {
        assertThat(repository.findByName("Chess Club")).isPresent();
        assertThat(repository.findByName("chess club")).isEmpty();
        assertThat(repository.findByName(null)).isEmpty();
    }

    @Test
    void update_shouldStoreReplacement() {
        Activity updated = repository.update("Art Club", a -> a.withParticipant("b@mergington.edu"));

        assertThat(updated.participants()).containsExactly("b@mergington.edu");
        assertThat(repository.findByName("Art Club").orElseThrow().participants())
            .containsExactly("b@mergington.edu");
    }

    @Test
    void update_unknownActivity_shouldThrowNotFound() {
        assertThatThrownBy(() -> repository.update("Knitting", a -> a))
            .isInstanceOf(ActivityNotFoundException.class)
            .hasMessage("Activity not found");
    }

    @Test
    void update_whenMutationThrows_shouldLeaveActivityUnchanged() {
        Activity before = repository.findByName("Math Club").orElseThrow();

        assertThatThrownBy(() -> repository.update("Math Club", a -> {
            throw new AlreadySignedUpException();
        })).isInstanceOf(AlreadySignedUpException.class);

        assertThat(repository.findByName("Math Club")).contains(before);
    }

    @Test
    void update_renamingActivity_shouldBeRejected() {
        assertThatThrownBy(() -> repository.update("Math Club",
                a -> Activity.create("Other", a.description(), a.schedule(), a.maxParticipants())))
            .isInstanceOf(IllegalStateException.class);

        assertThat(repository.findByName("Other")).isEmpty();
    }
}
