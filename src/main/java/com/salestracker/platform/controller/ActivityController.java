package com.salestracker.platform.controller;

import com.salestracker.platform.dto.CreateActivityRequest;
import com.salestracker.platform.model.Activity;
import com.salestracker.platform.model.DeleteOutcome;
import com.salestracker.platform.service.ActivityService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/activities")
public class ActivityController {

    private static final Logger logger = LoggerFactory.getLogger(ActivityController.class);

    private final ActivityService activityService;

    @Autowired
    public ActivityController(ActivityService activityService) {
        this.activityService = activityService;
    }

    /**
     * POST /api/activities
     */
    @PostMapping
    public ResponseEntity<Activity> createActivity(@Valid @RequestBody CreateActivityRequest request) {
        logger.info("Received POST request to create activity - userId: {}, type: {}, points: {}",
            request.getUserId(), request.getActivityType(), request.getPoints());

        try {
            Activity activity = activityService.createActivity(request);
            return ResponseEntity.status(HttpStatus.CREATED).body(activity);
        } catch (Exception e) {
            logger.error("Error creating activity - userId: {}, error: {}", request.getUserId(), e.getMessage(), e);
            throw e;
        }
    }

    /**
     * GET /api/activities/user/{userId}?date=yyyy-MM-dd
     */
    @GetMapping("/user/{userId}")
    public ResponseEntity<List<Activity>> getUserActivities(
            @PathVariable String userId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {

        logger.info("Received GET request for activities - userId: {}, date: {}", userId, date);
        return ResponseEntity.ok(activityService.getUserActivities(userId, date));
    }

    /**
     * GET /api/activities?startDate=...&endDate=...&userId=...
     */
    @GetMapping
    public ResponseEntity<List<Activity>> getActivitiesByDateRange(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) String userId) {

        logger.info("Received GET request for activities between {} and {} - userId: {}", startDate, endDate, userId);
        return ResponseEntity.ok(activityService.getActivitiesByDateRange(userId, startDate, endDate));
    }

    /**
     * DELETE /api/activities/{activityId}
     */
    @DeleteMapping("/{activityId}")
    public ResponseEntity<Void> deleteActivity(@PathVariable String activityId) {
        logger.info("Received DELETE request for activity {}", activityId);

        DeleteOutcome outcome = activityService.deleteActivity(activityId);
        if (outcome == DeleteOutcome.NOT_FOUND) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }
}
