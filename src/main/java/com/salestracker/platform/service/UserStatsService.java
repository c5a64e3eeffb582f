package com.salestracker.platform.service;

import com.salestracker.platform.model.Activity;
import com.salestracker.platform.model.User;
import com.salestracker.platform.repository.ActivityRepository;
import com.salestracker.platform.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Recomputes the denormalised totals kept on the user record from that user's activities.
 * <p>
 * Refreshes of one user are serialised and read the activities inside the lock, so the last refresh
 * to run always sees every committed activity. Only the totals columns are written.
 */
@Service
public class UserStatsService {

    private static final Logger logger = LoggerFactory.getLogger(UserStatsService.class);

    private final ActivityRepository activityRepository;
    private final UserRepository userRepository;
    private final Clock clock;
    private final KeyedLocks userLocks = new KeyedLocks();

    @Autowired
    public UserStatsService(ActivityRepository activityRepository, UserRepository userRepository, Clock clock) {
        this.activityRepository = activityRepository;
        this.userRepository = userRepository;
        this.clock = clock;
    }

    /**
     * @return the refreshed user, or empty when the user is unknown or the refresh failed
     */
    public Optional<User> refreshUserStats(String userId) {
        try {
            return userLocks.withLock(userId, () -> refresh(userId));
        } catch (Exception e) {
            logger.error("Failed to refresh stats of user {}", userId, e);
            return Optional.empty();
        }
    }

    private Optional<User> refresh(String userId) {
        if (userRepository.findById(userId).isEmpty()) {
            logger.warn("Cannot refresh stats of unknown user {}", userId);
            return Optional.empty();
        }

        List<Activity> activities = activityRepository.findByUserId(userId, Integer.MAX_VALUE);
        long totalPoints = activities.stream().mapToLong(Activity::getPoints).sum();
        Instant lastActivityAt = activities.stream()
            .map(Activity::getCreatedAt)
            .max(Comparator.naturalOrder())
            .orElse(null);

        if (!userRepository.updateTotals(userId, totalPoints, activities.size(), lastActivityAt, clock.instant())) {
            logger.warn("User {} disappeared before its stats could be written", userId);
            return Optional.empty();
        }
        logger.debug("Refreshed stats of user {}: {} points over {} activities",
            userId, totalPoints, activities.size());
        return userRepository.findById(userId);
    }
}
