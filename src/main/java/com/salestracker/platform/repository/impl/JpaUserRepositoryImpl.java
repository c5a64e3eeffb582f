package com.salestracker.platform.repository.impl;

import com.salestracker.platform.model.Streak;
import com.salestracker.platform.model.User;
import com.salestracker.platform.repository.UserRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
@Profile("!local")
public class JpaUserRepositoryImpl implements UserRepository {

    private final JpaUserRepository jpaRepository;

    @Autowired
    public JpaUserRepositoryImpl(JpaUserRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public User save(User user) {
        return jpaRepository.save(user);
    }

    @Override
    public Optional<User> findById(String userId) {
        return jpaRepository.findById(userId);
    }

    @Override
    public List<User> findAll() {
        return jpaRepository.findAll();
    }

    @Override
    public long count() {
        return jpaRepository.count();
    }

    @Override
    @Transactional
    public boolean insertIfAbsent(User user) {
        return jpaRepository.insertIfAbsent(user.getUserId(), user.getDisplayName(), user.getPictureUrl(),
            user.getStatusMessage(), user.getEmail(), user.getCreatedAt(), user.getUpdatedAt()) == 1;
    }

    @Override
    @Transactional
    public boolean updateProfile(String userId, String displayName, String pictureUrl, String statusMessage,
                                 String email, Instant now) {
        boolean updated = jpaRepository.updateProfile(userId, displayName, pictureUrl, statusMessage, now) == 1;
        if (updated && email != null) {
            jpaRepository.updateEmail(userId, email);
        }
        return updated;
    }

    @Override
    @Transactional
    public boolean updateSettings(String userId, Map<String, Object> settings, Instant now) {
        return jpaRepository.updateSettings(userId, settings, now) == 1;
    }

    @Override
    @Transactional
    public boolean updateTotals(String userId, long totalPoints, long totalActivities, Instant lastActivityAt,
                                Instant now) {
        return jpaRepository.updateTotals(userId, totalPoints, totalActivities, lastActivityAt, now) == 1;
    }

    @Override
    @Transactional
    public boolean updateStreak(String userId, Streak streak, Instant now) {
        return jpaRepository.updateStreak(userId, streak.getCurrentStreak(), streak.getLongestStreak(),
            streak.getLastActivityDate(), now) == 1;
    }
}
