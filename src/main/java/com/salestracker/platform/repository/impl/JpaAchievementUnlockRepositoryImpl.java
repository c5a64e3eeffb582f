package com.salestracker.platform.repository.impl;

import com.salestracker.platform.model.AchievementUnlock;
import com.salestracker.platform.repository.AchievementUnlockRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
@Profile("!local")
public class JpaAchievementUnlockRepositoryImpl implements AchievementUnlockRepository {

    private final JpaAchievementUnlockRepository jpaRepository;

    @Autowired
    public JpaAchievementUnlockRepositoryImpl(JpaAchievementUnlockRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public List<AchievementUnlock> findByUserId(String userId) {
        return jpaRepository.findByUserIdOrderByUnlockedAtAsc(userId);
    }

    @Override
    @Transactional
    public boolean insertIfAbsent(AchievementUnlock unlock) {
        return jpaRepository.insertIfAbsent(
            unlock.getUserId(), unlock.getAchievementId(), unlock.getUnlockedAt()) == 1;
    }
}
