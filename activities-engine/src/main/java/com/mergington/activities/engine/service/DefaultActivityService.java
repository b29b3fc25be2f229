package com.mergington.activities.engine.service;

import com.mergington.activities.core.exception.*;
import com.mergington.activities.core.model.Activity;
import com.mergington.activities.core.repository.ActivityRepository;
import com.mergington.activities.engine.config.ActivityRegistryProperties;
import com.mergington.activities.engine.logging.LoggingContext;
import com.mergington.activities.engine.metrics.ActivityMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class DefaultActivityService implements ActivityService {

    private static final Logger log = LoggerFactory.getLogger(DefaultActivityService.class);

    // Markup and quoting characters never appear in a school address
    private static final String FORBIDDEN_EMAIL_CHARS = "<>\"'`&";

    private final ActivityRepository repository;
    private final ActivityMetrics metrics;
    private final boolean enforceCapacity;

    public DefaultActivityService(
            ActivityRepository repository,
            ActivityMetrics metrics,
            ActivityRegistryProperties properties) {
        this.repository = repository;
        this.metrics = metrics;
        this.enforceCapacity = properties.enforceCapacity();
    }

    @Override
    public List<Activity> listActivities() {
        return repository.findAll();
    }

    @Override
    public Activity getActivity(String activityName) {
        return repository.findByName(activityName)
            .orElseThrow(() -> new ActivityNotFoundException(activityName));
    }

    @Override
    public Registration signup(String activityName, String email) {
        try (var ctx = LoggingContext.forActivity(activityName, email)) {
            try {
                String participant = email != null ? email.trim() : null;
                Activity updated = repository.update(activityName, current -> {
                    requireValidEmail(participant);
                    if (current.hasParticipant(participant)) {
                        throw new AlreadySignedUpException();
                    }
                    if (enforceCapacity && current.isFull()) {
                        throw new ActivityFullException();
                    }
                    return current.withParticipant(participant);
                });
                metrics.signupRecorded(activityName);
                log.info("Signed up participant, {} spots left", updated.spotsLeft());
                return new Registration(updated, participant);
            } catch (ActivityRegistryException e) {
                metrics.rejectionRecorded("signup", e.getErrorCode());
                throw e;
            }
        }
    }

    @Override
    public Registration unregister(String activityName, String email) {
        try (var ctx = LoggingContext.forActivity(activityName, email)) {
            try {
                String participant = email != null ? email.trim() : null;
                Activity updated = repository.update(activityName, current -> {
                    requireValidEmail(participant);
                    if (!current.hasParticipant(participant)) {
                        throw new NotSignedUpException();
                    }
                    return current.withoutParticipant(participant);
                });
                metrics.unregistrationRecorded(activityName);
                log.info("Unregistered participant, {} spots left", updated.spotsLeft());
                return new Registration(updated, participant);
            } catch (ActivityRegistryException e) {
                metrics.rejectionRecorded("unregister", e.getErrorCode());
                throw e;
            }
        }
    }

    // Runs after the activity lookup, so an unknown activity is reported first
    private static void requireValidEmail(String email) {
        if (email == null) {
            throw new InvalidParticipantException();
        }
        int at = email.indexOf('@');
        if (at <= 0 || at == email.length() - 1) {
            throw new InvalidParticipantException();
        }
        for (int i = 0; i < email.length(); i++) {
            char c = email.charAt(i);
            if (Character.isWhitespace(c) || Character.isISOControl(c) || FORBIDDEN_EMAIL_CHARS.indexOf(c) >= 0) {
                throw new InvalidParticipantException();
            }
        }
    }
}
