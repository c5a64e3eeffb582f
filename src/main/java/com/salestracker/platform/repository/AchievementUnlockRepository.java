package com.salestracker.platform.repository;

import com.salestracker.platform.model.AchievementUnlock;

import java.util.List;

public interface AchievementUnlockRepository {
    List<AchievementUnlock> findByUserId(String userId);

    /**
     * Conditional write: stores the unlock only if the (user, achievement) pair is absent.
     *
     * @return true if this call created the unlock
     */
    boolean insertIfAbsent(AchievementUnlock unlock);
}
