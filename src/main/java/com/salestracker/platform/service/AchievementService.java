package com.salestracker.platform.service;

import com.salestracker.platform.achievement.AchievementRule;
import com.salestracker.platform.dto.UnlockResult;
import com.salestracker.platform.exception.InvalidRequestException;
import com.salestracker.platform.model.AchievementUnlock;
import com.salestracker.platform.model.UnlockStatus;
import com.salestracker.platform.model.User;
import com.salestracker.platform.repository.AchievementUnlockRepository;
import com.salestracker.platform.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Idempotent achievement unlocks. Each (user, achievement) pair is stored at most once; a repeated
 * unlock reports {@link UnlockStatus#ALREADY_UNLOCKED} and keeps the original timestamp.
 */
@Service
public class AchievementService {

    private static final Logger logger = LoggerFactory.getLogger(AchievementService.class);

    private final AchievementUnlockRepository unlockRepository;
    private final UserRepository userRepository;
    private final List<AchievementRule> rules;
    private final Clock clock;

    @Autowired
    public AchievementService(
            AchievementUnlockRepository unlockRepository,
            UserRepository userRepository,
            List<AchievementRule> rules,
            Clock clock) {
        this.unlockRepository = unlockRepository;
        this.userRepository = userRepository;
        this.rules = rules;
        this.clock = clock;
    }

    /**
     * Unlocked achievements of the user, oldest first. Empty for unknown users.
     */
    public List<AchievementUnlock> getUserAchievements(String userId) {
        List<AchievementUnlock> unlocks = new ArrayList<>(unlockRepository.findByUserId(userId));
        unlocks.sort(Comparator.comparing(AchievementUnlock::getUnlockedAt));
        return unlocks;
    }

    public UnlockResult unlockAchievement(String userId, String achievementId) {
        if (userId == null || userId.isBlank()) {
            throw new InvalidRequestException("userId is required");
        }
        if (achievementId == null || achievementId.isBlank()) {
            throw new InvalidRequestException("achievementId is required");
        }

        if (userRepository.findById(userId).isEmpty()) {
            logger.warn("Cannot unlock {} for unknown user {}", achievementId, userId);
            return new UnlockResult(userId, achievementId, UnlockStatus.USER_NOT_FOUND);
        }

        AchievementUnlock unlock = AchievementUnlock.builder()
            .userId(userId)
            .achievementId(achievementId)
            .unlockedAt(clock.instant())
            .build();

        if (unlockRepository.insertIfAbsent(unlock)) {
            logger.info("User {} unlocked achievement {}", userId, achievementId);
            return new UnlockResult(userId, achievementId, UnlockStatus.UNLOCKED);
        }
        return new UnlockResult(userId, achievementId, UnlockStatus.ALREADY_UNLOCKED);
    }

    /**
     * Runs every registered rule against the user's current totals and unlocks what was earned.
     *
     * @return ids of achievements unlocked by this call
     */
    public List<String> evaluateAchievements(String userId) {
        Optional<User> user = userRepository.findById(userId);
        if (user.isEmpty()) {
            return List.of();
        }

        Set<String> alreadyUnlocked = unlockRepository.findByUserId(userId).stream()
            .map(AchievementUnlock::getAchievementId)
            .collect(Collectors.toSet());

        List<String> unlocked = new ArrayList<>();
        for (AchievementRule rule : rules) {
            String key = rule.getAchievementKey();
            if (alreadyUnlocked.contains(key) || !rule.isEarnedBy(user.get())) {
                continue;
            }
            if (unlockAchievement(userId, key).isNewUnlock()) {
                unlocked.add(key);
            }
        }
        return unlocked;
    }
}
