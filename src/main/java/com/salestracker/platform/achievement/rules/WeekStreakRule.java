package com.salestracker.platform.achievement.rules;

import com.salestracker.platform.achievement.AchievementRule;
import com.salestracker.platform.model.User;
import org.springframework.stereotype.Component;

/**
 * Seven consecutive active days. Uses the longest run so a streak broken later still counts.
 */
@Component
public class WeekStreakRule implements AchievementRule {

    private static final int DAYS = 7;

    @Override
    public String getAchievementKey() {
        return "streak_7";
    }

    @Override
    public boolean isEarnedBy(User user) {
        return user.getStreak().getLongestStreak() >= DAYS;
    }
}
