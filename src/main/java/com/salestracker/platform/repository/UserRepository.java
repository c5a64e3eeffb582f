package com.salestracker.platform.repository;

import com.salestracker.platform.model.Streak;
import com.salestracker.platform.model.User;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * User documents. Apart from {@link #save}, every write touches only the columns it names, so a
 * profile update never overwrites totals or streak written by another thread.
 */
public interface UserRepository {
    User save(User user);
    Optional<User> findById(String userId);
    List<User> findAll();
    long count();

    /**
     * @return true when the user was inserted, false when a user with that id already existed
     */
    boolean insertIfAbsent(User user);

    /**
     * Sets display name, picture and status message. A null {@code email} keeps the stored one.
     */
    boolean updateProfile(String userId, String displayName, String pictureUrl, String statusMessage,
                          String email, Instant now);

    boolean updateSettings(String userId, Map<String, Object> settings, Instant now);

    boolean updateTotals(String userId, long totalPoints, long totalActivities, Instant lastActivityAt, Instant now);

    boolean updateStreak(String userId, Streak streak, Instant now);
}
