package com.salestracker.platform.service;

import com.salestracker.platform.dto.CreateActivityRequest;
import com.salestracker.platform.exception.InvalidRequestException;
import com.salestracker.platform.exception.SalesTrackerException;
import com.salestracker.platform.model.Activity;
import com.salestracker.platform.model.DeleteOutcome;
import com.salestracker.platform.repository.ActivityRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Write path for activities. A create validates, stores, drops the affected cached aggregates and
 * publishes {@link ActivityCreatedEvent}; everything else happens asynchronously in listeners.
 */
@Service
public class ActivityService {

    private static final Logger logger = LoggerFactory.getLogger(ActivityService.class);

    static final int USER_ACTIVITY_LIMIT = 100;

    private final ActivityRepository activityRepository;
    private final UserService userService;
    private final UserStatsService userStatsService;
    private final AggregationService aggregationService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Autowired
    public ActivityService(
            ActivityRepository activityRepository,
            UserService userService,
            UserStatsService userStatsService,
            AggregationService aggregationService,
            ApplicationEventPublisher eventPublisher,
            Clock clock) {
        this.activityRepository = activityRepository;
        this.userService = userService;
        this.userStatsService = userStatsService;
        this.aggregationService = aggregationService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public Activity createActivity(CreateActivityRequest request) {
        validateCreateActivityRequest(request);

        userService.ensureUser(request.getUserId());

        Activity activity = Activity.builder()
            .activityId(UUID.randomUUID().toString())
            .userId(request.getUserId())
            .activityType(request.getActivityType())
            .title(request.getTitle().trim())
            .subtitle(request.getSubtitle())
            .points(request.getPoints())
            .date(request.getDate() != null ? request.getDate() : LocalDate.now(clock))
            .createdAt(clock.instant())
            .build();

        Activity saved = persistActivity(activity);
        logger.info("Stored activity {} for user {}: {} points on {}",
            saved.getActivityId(), saved.getUserId(), saved.getPoints(), saved.getDate());

        aggregationService.evictFor(saved.getDate());
        eventPublisher.publishEvent(new ActivityCreatedEvent(saved));
        return saved;
    }

    /**
     * Newest first, at most {@value #USER_ACTIVITY_LIMIT} entries.
     */
    public List<Activity> getUserActivities(String userId, LocalDate date) {
        if (userId == null || userId.isBlank()) {
            throw new InvalidRequestException("userId is required");
        }
        if (date != null) {
            return activityRepository.findByUserIdAndDate(userId, date, USER_ACTIVITY_LIMIT);
        }
        return activityRepository.findByUserId(userId, USER_ACTIVITY_LIMIT);
    }

    public List<Activity> getActivitiesByDateRange(String userId, LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null) {
            throw new InvalidRequestException("startDate and endDate are required");
        }
        if (endDate.isBefore(startDate)) {
            throw new InvalidRequestException("endDate cannot be before startDate");
        }
        return activityRepository.findByDateRange(userId, startDate, endDate);
    }

    public DeleteOutcome deleteActivity(String activityId) {
        Optional<Activity> existing = activityRepository.findById(activityId);
        if (existing.isEmpty()) {
            logger.info("Activity {} not found, nothing to delete", activityId);
            return DeleteOutcome.NOT_FOUND;
        }

        Activity activity = existing.get();
        activityRepository.deleteById(activityId);
        logger.info("Deleted activity {} of user {}", activityId, activity.getUserId());

        aggregationService.evictFor(activity.getDate());
        userStatsService.refreshUserStats(activity.getUserId());
        return DeleteOutcome.DELETED;
    }

    private void validateCreateActivityRequest(CreateActivityRequest request) {
        if (request == null) {
            throw new InvalidRequestException("Request cannot be null");
        }
        if (request.getUserId() == null || request.getUserId().isBlank()) {
            throw new InvalidRequestException("userId is required");
        }
        if (request.getActivityType() == null) {
            throw new InvalidRequestException("activityType is required");
        }
        if (request.getTitle() == null || request.getTitle().isBlank()) {
            throw new InvalidRequestException("title is required");
        }
        if (request.getPoints() == null) {
            throw new InvalidRequestException("points is required");
        }
        if (request.getPoints() < Activity.MIN_POINTS || request.getPoints() > Activity.MAX_POINTS) {
            throw new InvalidRequestException("points must be between " + Activity.MIN_POINTS
                + " and " + Activity.MAX_POINTS);
        }
    }

    private Activity persistActivity(Activity activity) {
        try {
            return activityRepository.save(activity);
        } catch (Exception e) {
            logger.error("Failed to store activity for user {}", activity.getUserId(), e);
            throw new SalesTrackerException("Failed to store activity", e);
        }
    }
}
