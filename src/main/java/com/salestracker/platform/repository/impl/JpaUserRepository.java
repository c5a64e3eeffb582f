package com.salestracker.platform.repository.impl;

import com.salestracker.platform.model.User;
import org.springframework.context.annotation.Profile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

@Repository
@Profile("!local")
public interface JpaUserRepository extends JpaRepository<User, String> {

    @Modifying
    @Query(value = "INSERT INTO users (user_id, display_name, picture_url, status_message, email, settings, "
        + "total_points, total_activities, current_streak, longest_streak, created_at, updated_at) "
        + "VALUES (:userId, :displayName, :pictureUrl, :statusMessage, :email, CAST('{}' AS jsonb), "
        + "0, 0, 0, 0, :createdAt, :updatedAt) ON CONFLICT DO NOTHING", nativeQuery = true)
    int insertIfAbsent(@Param("userId") String userId, @Param("displayName") String displayName,
                       @Param("pictureUrl") String pictureUrl, @Param("statusMessage") String statusMessage,
                       @Param("email") String email, @Param("createdAt") Instant createdAt,
                       @Param("updatedAt") Instant updatedAt);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE User u SET u.displayName = :displayName, u.pictureUrl = :pictureUrl, "
        + "u.statusMessage = :statusMessage, u.updatedAt = :now WHERE u.userId = :userId")
    int updateProfile(@Param("userId") String userId, @Param("displayName") String displayName,
                      @Param("pictureUrl") String pictureUrl, @Param("statusMessage") String statusMessage,
                      @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE User u SET u.email = :email WHERE u.userId = :userId")
    int updateEmail(@Param("userId") String userId, @Param("email") String email);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE User u SET u.settings = :settings, u.updatedAt = :now WHERE u.userId = :userId")
    int updateSettings(@Param("userId") String userId, @Param("settings") Map<String, Object> settings,
                       @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE User u SET u.totalPoints = :totalPoints, u.totalActivities = :totalActivities, "
        + "u.lastActivityAt = :lastActivityAt, u.updatedAt = :now WHERE u.userId = :userId")
    int updateTotals(@Param("userId") String userId, @Param("totalPoints") long totalPoints,
                     @Param("totalActivities") long totalActivities,
                     @Param("lastActivityAt") Instant lastActivityAt, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE User u SET u.streak.currentStreak = :currentStreak, u.streak.longestStreak = :longestStreak, "
        + "u.streak.lastActivityDate = :lastActivityDate, u.updatedAt = :now WHERE u.userId = :userId")
    int updateStreak(@Param("userId") String userId, @Param("currentStreak") int currentStreak,
                     @Param("longestStreak") int longestStreak,
                     @Param("lastActivityDate") LocalDate lastActivityDate, @Param("now") Instant now);
}
