package com.salestracker.platform.service;

import com.salestracker.platform.config.AsyncConfig;
import com.salestracker.platform.model.Activity;
import com.salestracker.platform.notification.NotificationDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Work that follows a stored activity: user totals, streak, achievements, then the group fan-out.
 * Steps run in order so the notification sees fresh totals. A failing step is logged and the next
 * one still runs.
 */
@Component
public class ActivityPostProcessor {

    private static final Logger logger = LoggerFactory.getLogger(ActivityPostProcessor.class);

    private final UserStatsService userStatsService;
    private final StreakTracker streakTracker;
    private final AchievementService achievementService;
    private final NotificationDispatcher notificationDispatcher;

    @Autowired
    public ActivityPostProcessor(
            UserStatsService userStatsService,
            StreakTracker streakTracker,
            AchievementService achievementService,
            NotificationDispatcher notificationDispatcher) {
        this.userStatsService = userStatsService;
        this.streakTracker = streakTracker;
        this.achievementService = achievementService;
        this.notificationDispatcher = notificationDispatcher;
    }

    @Async(AsyncConfig.ACTIVITY_EXECUTOR)
    @EventListener
    public void onActivityCreated(ActivityCreatedEvent event) {
        process(event.getActivity());
    }

    void process(Activity activity) {
        String userId = activity.getUserId();

        userStatsService.refreshUserStats(userId);

        try {
            streakTracker.recordActivity(userId, activity.getDate());
        } catch (Exception e) {
            logger.error("Failed to advance streak of user {}", userId, e);
        }

        try {
            List<String> unlocked = achievementService.evaluateAchievements(userId);
            if (!unlocked.isEmpty()) {
                logger.info("Activity {} unlocked {} for user {}", activity.getActivityId(), unlocked, userId);
            }
        } catch (Exception e) {
            logger.error("Failed to evaluate achievements of user {}", userId, e);
        }

        try {
            notificationDispatcher.dispatchActivity(activity);
        } catch (Exception e) {
            logger.error("Failed to dispatch notifications for activity {}", activity.getActivityId(), e);
        }
    }
}
