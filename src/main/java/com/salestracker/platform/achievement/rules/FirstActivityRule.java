package com.salestracker.platform.achievement.rules;

import com.salestracker.platform.achievement.AchievementRule;
import com.salestracker.platform.model.User;
import org.springframework.stereotype.Component;

@Component
public class FirstActivityRule implements AchievementRule {

    @Override
    public String getAchievementKey() {
        return "first_activity";
    }

    @Override
    public boolean isEarnedBy(User user) {
        return user.getTotalActivities() >= 1;
    }
}
