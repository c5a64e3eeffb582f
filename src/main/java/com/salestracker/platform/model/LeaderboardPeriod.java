package com.salestracker.platform.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

public enum LeaderboardPeriod {
    DAILY,
    WEEKLY,
    MONTHLY;

    public LocalDate startOf(LocalDate date) {
        switch (this) {
            case WEEKLY:
                return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTHLY:
                return date.withDayOfMonth(1);
            default:
                return date;
        }
    }

    public LocalDate endOf(LocalDate date) {
        switch (this) {
            case WEEKLY:
                return date.with(TemporalAdjusters.nextOrSame(DayOfWeek.SUNDAY));
            case MONTHLY:
                return date.with(TemporalAdjusters.lastDayOfMonth());
            default:
                return date;
        }
    }

    /**
     * Cache key for the period window containing {@code date}, normalised to the window start.
     */
    public String cacheKey(LocalDate date) {
        return "leaderboard_" + name().toLowerCase(Locale.ROOT) + "_" + startOf(date);
    }

    /**
     * Accepts the wire names used by clients: daily/weekly/monthly as well as today/week/month.
     */
    public static LeaderboardPeriod fromValue(String value) {
        if (value == null || value.isBlank()) {
            return DAILY;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "daily":
            case "today":
                return DAILY;
            case "weekly":
            case "week":
                return WEEKLY;
            case "monthly":
            case "month":
                return MONTHLY;
            default:
                throw new IllegalArgumentException("Unknown leaderboard period: " + value);
        }
    }
}
