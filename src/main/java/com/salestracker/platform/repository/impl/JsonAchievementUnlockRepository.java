package com.salestracker.platform.repository.impl;

import com.salestracker.platform.model.AchievementUnlock;
import com.salestracker.platform.repository.AchievementUnlockRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;

@Repository
@Profile("local")
public class JsonAchievementUnlockRepository implements AchievementUnlockRepository {

    private final JsonDocumentCollection<AchievementUnlock> unlocks;

    public JsonAchievementUnlockRepository(@Value("${salestracker.storage.directory:./data}") String dataDirectory) {
        this.unlocks = new JsonDocumentCollection<>(dataDirectory, "achievements", AchievementUnlock.class,
            unlock -> documentId(unlock.getUserId(), unlock.getAchievementId()));
    }

    /**
     * Both ids may contain any character, so the user id is length-prefixed to keep distinct pairs
     * on distinct keys.
     */
    static String documentId(String userId, String achievementId) {
        return userId.length() + ":" + userId + ":" + achievementId;
    }

    @Override
    public List<AchievementUnlock> findByUserId(String userId) {
        return unlocks.findAll().stream()
            .filter(unlock -> unlock.getUserId().equals(userId))
            .sorted(Comparator.comparing(AchievementUnlock::getUnlockedAt))
            .toList();
    }

    @Override
    public boolean insertIfAbsent(AchievementUnlock unlock) {
        String id = documentId(unlock.getUserId(), unlock.getAchievementId());
        return unlocks.withLock(() -> {
            if (unlocks.findById(id).isPresent()) {
                return false;
            }
            unlocks.putWithoutPersist(unlock);
            unlocks.persist();
            return true;
        });
    }
}
