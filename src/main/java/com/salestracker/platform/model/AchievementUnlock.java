package com.salestracker.platform.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "achievement_unlocks")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@IdClass(AchievementUnlockId.class)
public class AchievementUnlock {
    @Id
    @Column(name = "user_id", nullable = false)
    private String userId;

    @Id
    @Column(name = "achievement_id", nullable = false)
    private String achievementId;

    @Column(name = "unlocked_at", nullable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant unlockedAt;
}
