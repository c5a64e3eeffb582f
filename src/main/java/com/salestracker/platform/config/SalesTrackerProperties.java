package com.salestracker.platform.config;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "salestracker")
@Getter @Setter
public class SalesTrackerProperties {

    /**
     * Zone that defines "today" for activity dates, streaks and quota days.
     */
    private String zoneId = "Asia/Bangkok";

    private Cache cache = new Cache();
    private Quota quota = new Quota();
    private Notifications notifications = new Notifications();
    private Line line = new Line();

    @Getter @Setter
    public static class Cache {
        private Duration teamStatsTtl = Duration.ofHours(1);
        private Duration leaderboardTtl = Duration.ofMinutes(5);
        private Duration cleanupInterval = Duration.ofMinutes(10);
    }

    @Getter @Setter
    public static class Quota {
        private int retentionDays = 7;
        private Duration cleanupInterval = Duration.ofHours(6);
        private Policy defaultPolicy = new Policy(300, 280, 295);
        private Map<String, Policy> categories = new HashMap<>();

        public Policy policyFor(String category) {
            return categories.getOrDefault(category, defaultPolicy);
        }
    }

    /**
     * Daily ceiling for one message category. Non-urgent sends stop at the critical threshold,
     * urgent sends at the daily limit.
     */
    @Getter @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Policy {
        private long dailyLimit;
        private long warningThreshold;
        private long criticalThreshold;
    }

    @Getter @Setter
    public static class Notifications {
        private String activityCategory = "activity";
        private String leaderboardCategory = "leaderboard";
        private int leaderboardSize = 10;
        private String dailyLeaderboardCron = "0 0 18 * * *";
        private int executorPoolSize = 4;
        private int executorQueueCapacity = 500;
    }

    @Getter @Setter
    public static class Line {
        private String apiBaseUrl = "https://api.line.me";
        private String channelAccessToken = "";
        private Duration connectTimeout = Duration.ofSeconds(3);
        private Duration readTimeout = Duration.ofSeconds(5);
    }
}
