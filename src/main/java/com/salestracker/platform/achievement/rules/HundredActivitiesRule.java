package com.salestracker.platform.achievement.rules;

import com.salestracker.platform.achievement.AchievementRule;
import com.salestracker.platform.model.User;
import org.springframework.stereotype.Component;

@Component
public class HundredActivitiesRule implements AchievementRule {

    @Override
    public String getAchievementKey() {
        return "activities_100";
    }

    @Override
    public boolean isEarnedBy(User user) {
        return user.getTotalActivities() >= 100;
    }
}
