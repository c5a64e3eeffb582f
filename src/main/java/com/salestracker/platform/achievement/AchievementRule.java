package com.salestracker.platform.achievement;

import com.salestracker.platform.model.User;

/**
 * One automatically awarded achievement. Implementations registered as beans are evaluated after
 * every new activity.
 */
public interface AchievementRule {

    /**
     * Stable achievement id stored with the unlock.
     */
    String getAchievementKey();

    /**
     * @param user user with refreshed totals and streak
     */
    boolean isEarnedBy(User user);
}
