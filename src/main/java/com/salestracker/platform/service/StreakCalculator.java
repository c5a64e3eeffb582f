package com.salestracker.platform.service;

import com.salestracker.platform.model.Streak;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Pure streak arithmetic over calendar days in the engine zone.
 */
public final class StreakCalculator {

    private StreakCalculator() {
    }

    /**
     * Applies one activity on {@code activityDate} to {@code current}. Activities dated before the
     * last recorded day leave the streak unchanged.
     */
    public static Streak advance(Streak current, LocalDate activityDate) {
        Streak streak = current != null ? current : Streak.empty();
        LocalDate lastDate = streak.getLastActivityDate();

        if (lastDate == null) {
            return new Streak(1, Math.max(1, streak.getLongestStreak()), activityDate);
        }

        long gap = ChronoUnit.DAYS.between(lastDate, activityDate);
        if (gap < 0) {
            return copyOf(streak);
        }

        int next;
        if (gap == 0) {
            next = Math.max(1, streak.getCurrentStreak());
        } else if (gap == 1) {
            next = streak.getCurrentStreak() + 1;
        } else {
            next = 1;
        }
        return new Streak(next, Math.max(streak.getLongestStreak(), next), activityDate);
    }

    /**
     * The streak as seen on {@code today}: a run whose last day is older than yesterday is broken.
     */
    public static Streak asOf(Streak stored, LocalDate today) {
        Streak streak = stored != null ? stored : Streak.empty();
        LocalDate lastDate = streak.getLastActivityDate();
        if (lastDate != null && lastDate.isBefore(today.minusDays(1))) {
            return new Streak(0, streak.getLongestStreak(), lastDate);
        }
        return copyOf(streak);
    }

    private static Streak copyOf(Streak streak) {
        return new Streak(streak.getCurrentStreak(), streak.getLongestStreak(), streak.getLastActivityDate());
    }
}
