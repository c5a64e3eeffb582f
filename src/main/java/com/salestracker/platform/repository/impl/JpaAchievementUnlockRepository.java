package com.salestracker.platform.repository.impl;

import com.salestracker.platform.model.AchievementUnlock;
import com.salestracker.platform.model.AchievementUnlockId;
import org.springframework.context.annotation.Profile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
@Profile("!local")
public interface JpaAchievementUnlockRepository extends JpaRepository<AchievementUnlock, AchievementUnlockId> {
    List<AchievementUnlock> findByUserIdOrderByUnlockedAtAsc(String userId);

    @Modifying
    @Query(value = "INSERT INTO achievement_unlocks (user_id, achievement_id, unlocked_at) "
        + "VALUES (:userId, :achievementId, :unlockedAt) ON CONFLICT DO NOTHING", nativeQuery = true)
    int insertIfAbsent(@Param("userId") String userId, @Param("achievementId") String achievementId,
                       @Param("unlockedAt") Instant unlockedAt);
}
