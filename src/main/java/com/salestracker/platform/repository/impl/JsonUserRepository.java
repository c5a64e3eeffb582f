package com.salestracker.platform.repository.impl;

import com.salestracker.platform.model.Streak;
import com.salestracker.platform.model.User;
import com.salestracker.platform.repository.UserRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

@Repository
@Profile("local")
public class JsonUserRepository implements UserRepository {

    private final JsonDocumentCollection<User> users;

    public JsonUserRepository(@Value("${salestracker.storage.directory:./data}") String dataDirectory) {
        this.users = new JsonDocumentCollection<>(dataDirectory, "users", User.class, User::getUserId);
    }

    @Override
    public User save(User user) {
        validate(user);
        return users.save(user);
    }

    @Override
    public Optional<User> findById(String userId) {
        return users.findById(userId);
    }

    @Override
    public List<User> findAll() {
        return users.findAll();
    }

    @Override
    public long count() {
        return users.findAll().size();
    }

    @Override
    public boolean insertIfAbsent(User user) {
        validate(user);
        return users.withLock(() -> {
            if (users.findById(user.getUserId()).isPresent()) {
                return false;
            }
            users.putWithoutPersist(user);
            users.persist();
            return true;
        });
    }

    @Override
    public boolean updateProfile(String userId, String displayName, String pictureUrl, String statusMessage,
                                 String email, Instant now) {
        return modify(userId, user -> {
            user.setDisplayName(displayName);
            user.setPictureUrl(pictureUrl);
            user.setStatusMessage(statusMessage);
            if (email != null) {
                user.setEmail(email);
            }
            user.setUpdatedAt(now);
        });
    }

    @Override
    public boolean updateSettings(String userId, Map<String, Object> settings, Instant now) {
        return modify(userId, user -> {
            user.setSettings(new HashMap<>(settings));
            user.setUpdatedAt(now);
        });
    }

    @Override
    public boolean updateTotals(String userId, long totalPoints, long totalActivities, Instant lastActivityAt,
                                Instant now) {
        return modify(userId, user -> {
            user.setTotalPoints(totalPoints);
            user.setTotalActivities(totalActivities);
            user.setLastActivityAt(lastActivityAt);
            user.setUpdatedAt(now);
        });
    }

    @Override
    public boolean updateStreak(String userId, Streak streak, Instant now) {
        return modify(userId, user -> {
            user.setStreak(new Streak(streak.getCurrentStreak(), streak.getLongestStreak(),
                streak.getLastActivityDate()));
            user.setUpdatedAt(now);
        });
    }

    private boolean modify(String userId, Consumer<User> change) {
        return users.withLock(() -> {
            Optional<User> existing = users.findById(userId);
            if (existing.isEmpty()) {
                return false;
            }
            change.accept(existing.get());
            users.persist();
            return true;
        });
    }

    private static void validate(User user) {
        if (user == null || user.getUserId() == null || user.getUserId().isBlank()) {
            throw new IllegalArgumentException("UserId cannot be null or empty");
        }
    }
}
