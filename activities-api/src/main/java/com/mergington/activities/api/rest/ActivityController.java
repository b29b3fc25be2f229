package com.mergington.activities.api.rest;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mergington.activities.core.model.Activity;
import com.mergington.activities.engine.service.ActivityService;
import com.mergington.activities.engine.service.Registration;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API for activity listings and registrations.
 * Path variables arrive URL-decoded, so {@code Chess%20Club} resolves to "Chess Club".
 * A missing {@code email} is left to the service, which reports an unknown activity first.
 */
@RestController
@RequestMapping("/activities")
public class ActivityController {

    private final ActivityService activityService;

    public ActivityController(ActivityService activityService) {
        this.activityService = activityService;
    }

    /**
     * List all activities keyed by name.
     */
    @GetMapping
    public ResponseEntity<Map<String, ActivityResponse>> listActivities() {
        Map<String, ActivityResponse> body = new LinkedHashMap<>();
        for (Activity activity : activityService.listActivities()) {
            body.put(activity.name(), ActivityResponse.from(activity));
        }
        return ResponseEntity.ok(body);
    }

    /**
     * Get a single activity.
     */
    @GetMapping("/{activityName}")
    public ResponseEntity<ActivityResponse> getActivity(@PathVariable String activityName) {
        return ResponseEntity.ok(ActivityResponse.from(activityService.getActivity(activityName)));
    }

    /**
     * Sign a student up for an activity.
     */
    @PostMapping("/{activityName}/signup")
    public ResponseEntity<MessageResponse> signup(
            @PathVariable String activityName,
            @RequestParam(required = false) String email) {
        
        Registration registration = activityService.signup(activityName, email);
        return ResponseEntity.ok(new MessageResponse(
            String.format("Signed up %s for %s", registration.participant(), activityName)));
    }

    /**
     * Remove a student from an activity.
     */
    @DeleteMapping("/{activityName}/unregister")
    public ResponseEntity<MessageResponse> unregister(
            @PathVariable String activityName,
            @RequestParam(required = false) String email) {
        
        Registration registration = activityService.unregister(activityName, email);
        return ResponseEntity.ok(new MessageResponse(
            String.format("Unregistered %s from %s", registration.participant(), activityName)));
    }

    // ========== DTOs ==========

    public record MessageResponse(String message) {}

    public record ActivityResponse(
        String description,
        String schedule,
        @JsonProperty("max_participants") int maxParticipants,
        List<String> participants
    ) {
        public static ActivityResponse from(Activity activity) {
            return new ActivityResponse(
                activity.description(),
                activity.schedule(),
                activity.maxParticipants(),
                activity.participants()
            );
        }
    }
}
