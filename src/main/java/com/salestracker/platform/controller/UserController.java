package com.salestracker.platform.controller;

import com.salestracker.platform.dto.UnlockResult;
import com.salestracker.platform.dto.UpdateStreakRequest;
import com.salestracker.platform.dto.UpsertUserRequest;
import com.salestracker.platform.exception.UserNotFoundException;
import com.salestracker.platform.model.AchievementUnlock;
import com.salestracker.platform.model.Streak;
import com.salestracker.platform.model.UnlockStatus;
import com.salestracker.platform.model.User;
import com.salestracker.platform.service.AchievementService;
import com.salestracker.platform.service.StreakTracker;
import com.salestracker.platform.service.UserService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/users")
public class UserController {

    private static final Logger logger = LoggerFactory.getLogger(UserController.class);

    private final UserService userService;
    private final StreakTracker streakTracker;
    private final AchievementService achievementService;

    @Autowired
    public UserController(UserService userService, StreakTracker streakTracker, AchievementService achievementService) {
        this.userService = userService;
        this.streakTracker = streakTracker;
        this.achievementService = achievementService;
    }

    @PostMapping
    public ResponseEntity<User> createOrUpdateUser(@Valid @RequestBody UpsertUserRequest request) {
        logger.info("Received POST request to upsert user {}", request.getUserId());
        return ResponseEntity.ok(userService.createOrUpdateUser(request));
    }

    @GetMapping("/{userId}")
    public ResponseEntity<User> getUser(@PathVariable String userId) {
        logger.info("Received GET request for user {}", userId);
        return ResponseEntity.ok(userService.getUser(userId));
    }

    @PutMapping("/{userId}/settings")
    public ResponseEntity<User> updateSettings(@PathVariable String userId, @RequestBody Map<String, Object> settings) {
        logger.info("Received PUT request to update settings of user {}", userId);
        return ResponseEntity.ok(userService.updateUserSettings(userId, settings));
    }

    @GetMapping("/{userId}/streak")
    public ResponseEntity<Streak> getStreak(@PathVariable String userId) {
        logger.info("Received GET request for streak of user {}", userId);
        return ResponseEntity.ok(streakTracker.getUserStreak(userId));
    }

    @PutMapping("/{userId}/streak")
    public ResponseEntity<Streak> updateStreak(@PathVariable String userId,
                                               @Valid @RequestBody UpdateStreakRequest request) {
        logger.info("Received PUT request to set streak of user {} to {}", userId, request.getCurrentStreak());
        return streakTracker.updateUserStreak(userId, request.getCurrentStreak(),
                request.getLongestStreak(), request.getLastActivityDate())
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new UserNotFoundException(userId));
    }

    @GetMapping("/{userId}/achievements")
    public ResponseEntity<List<AchievementUnlock>> getAchievements(@PathVariable String userId) {
        logger.info("Received GET request for achievements of user {}", userId);
        return ResponseEntity.ok(achievementService.getUserAchievements(userId));
    }

    /**
     * 201 for a new unlock, 200 when already unlocked, 404 for an unknown user.
     */
    @PostMapping("/{userId}/achievements/{achievementId}")
    public ResponseEntity<UnlockResult> unlockAchievement(@PathVariable String userId,
                                                          @PathVariable String achievementId) {
        logger.info("Received POST request to unlock {} for user {}", achievementId, userId);

        UnlockResult result = achievementService.unlockAchievement(userId, achievementId);
        if (result.getStatus() == UnlockStatus.USER_NOT_FOUND) {
            throw new UserNotFoundException(userId);
        }
        HttpStatus status = result.isNewUnlock() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }
}
