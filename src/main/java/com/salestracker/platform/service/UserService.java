package com.salestracker.platform.service;

import com.salestracker.platform.dto.UpsertUserRequest;
import com.salestracker.platform.exception.InvalidRequestException;
import com.salestracker.platform.exception.UserNotFoundException;
import com.salestracker.platform.model.User;
import com.salestracker.platform.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

@Service
public class UserService {

    private static final Logger logger = LoggerFactory.getLogger(UserService.class);

    static final String PLACEHOLDER_DISPLAY_NAME = "Unknown User";

    private final UserRepository userRepository;
    private final Clock clock;
    private final KeyedLocks settingsLocks = new KeyedLocks();

    @Autowired
    public UserService(UserRepository userRepository, Clock clock) {
        this.userRepository = userRepository;
        this.clock = clock;
    }

    /**
     * Creates the user on first sight, otherwise refreshes the profile fields. Totals, streak and
     * settings are left untouched on update.
     */
    public User createOrUpdateUser(UpsertUserRequest request) {
        if (request == null || request.getUserId() == null || request.getUserId().isBlank()) {
            throw new InvalidRequestException("userId is required");
        }

        String userId = request.getUserId();
        Instant now = clock.instant();
        boolean created = userRepository.insertIfAbsent(User.builder()
            .userId(userId)
            .displayName(request.getDisplayName())
            .pictureUrl(request.getPictureUrl())
            .statusMessage(request.getStatusMessage())
            .email(request.getEmail())
            .createdAt(now)
            .updatedAt(now)
            .build());

        if (created) {
            logger.info("Created user {}", userId);
        } else {
            userRepository.updateProfile(userId, request.getDisplayName(), request.getPictureUrl(),
                request.getStatusMessage(), request.getEmail(), now);
            logger.info("Updated profile of user {}", userId);
        }
        return getUser(userId);
    }

    public User getUser(String userId) {
        return userRepository.findById(userId)
            .orElseThrow(() -> new UserNotFoundException(userId));
    }

    public User updateUserSettings(String userId, Map<String, Object> settings) {
        return settingsLocks.withLock(userId, () -> {
            User user = getUser(userId);
            Map<String, Object> merged = new HashMap<>(user.getSettings() != null ? user.getSettings() : Map.of());
            if (settings != null) {
                merged.putAll(settings);
            }
            userRepository.updateSettings(userId, merged, clock.instant());
            return getUser(userId);
        });
    }

    /**
     * Returns the user, creating a placeholder record when an activity arrives before the profile.
     * A profile written concurrently wins over the placeholder.
     */
    public User ensureUser(String userId) {
        Optional<User> existing = userRepository.findById(userId);
        if (existing.isPresent()) {
            return existing.get();
        }

        Instant now = clock.instant();
        User placeholder = User.builder()
            .userId(userId)
            .displayName(PLACEHOLDER_DISPLAY_NAME)
            .createdAt(now)
            .updatedAt(now)
            .build();
        if (userRepository.insertIfAbsent(placeholder)) {
            logger.info("Created placeholder user {} on first activity", userId);
        }
        return userRepository.findById(userId).orElse(placeholder);
    }
}
