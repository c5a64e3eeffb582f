package com.salestracker.platform.achievement.rules;

import com.salestracker.platform.achievement.AchievementRule;
import com.salestracker.platform.model.User;
import org.springframework.stereotype.Component;

/**
 * Lifetime points reach 1000.
 */
@Component
public class ThousandPointsRule implements AchievementRule {

    private static final long THRESHOLD = 1000;

    @Override
    public String getAchievementKey() {
        return "points_1000";
    }

    @Override
    public boolean isEarnedBy(User user) {
        return user.getTotalPoints() >= THRESHOLD;
    }
}
