package com.salestracker.platform.scheduling;

import com.salestracker.platform.notification.NotificationDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

@Component
public class DailyLeaderboardBroadcaster {

    private static final Logger logger = LoggerFactory.getLogger(DailyLeaderboardBroadcaster.class);

    private final NotificationDispatcher notificationDispatcher;
    private final Clock clock;

    @Autowired
    public DailyLeaderboardBroadcaster(NotificationDispatcher notificationDispatcher, Clock clock) {
        this.notificationDispatcher = notificationDispatcher;
        this.clock = clock;
    }

    /**
     * Posts today's leaderboard to the groups once a day, 18:00 engine time by default.
     */
    @Scheduled(cron = "${salestracker.notifications.daily-leaderboard-cron:0 0 18 * * *}",
        zone = "${salestracker.zone-id:Asia/Bangkok}")
    public void broadcast() {
        try {
            notificationDispatcher.broadcastDailyLeaderboard(LocalDate.now(clock));
        } catch (Exception e) {
            logger.error("Error broadcasting daily leaderboard", e);
        }
    }
}
