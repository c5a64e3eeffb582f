package com.salestracker.platform.repository.impl;

import com.salestracker.platform.model.QuotaRecord;
import com.salestracker.platform.model.QuotaRecordId;
import org.springframework.context.annotation.Profile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;

@Repository
@Profile("!local")
public interface JpaQuotaRecordRepository extends JpaRepository<QuotaRecord, QuotaRecordId> {

    @Modifying
    @Query(value = "INSERT INTO notification_quota (category, quota_day, message_count, updated_at) "
        + "VALUES (:category, :day, 0, :now) ON CONFLICT DO NOTHING", nativeQuery = true)
    int insertIfAbsent(@Param("category") String category, @Param("day") LocalDate day, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE QuotaRecord q SET q.count = q.count + :count, q.lastTargetId = :targetId, q.updatedAt = :now "
        + "WHERE q.category = :category AND q.day = :day")
    int add(@Param("category") String category, @Param("day") LocalDate day, @Param("count") long count,
            @Param("targetId") String targetId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE QuotaRecord q SET q.count = q.count + :count, q.lastTargetId = :targetId, q.updatedAt = :now "
        + "WHERE q.category = :category AND q.day = :day AND q.count + :count <= :ceiling")
    int addWithinCeiling(@Param("category") String category, @Param("day") LocalDate day, @Param("count") long count,
                         @Param("ceiling") long ceiling, @Param("targetId") String targetId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE QuotaRecord q SET q.count = CASE WHEN q.count > :count THEN q.count - :count ELSE 0 END, "
        + "q.updatedAt = :now WHERE q.category = :category AND q.day = :day")
    int subtract(@Param("category") String category, @Param("day") LocalDate day, @Param("count") long count,
                 @Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM QuotaRecord q WHERE q.day < :cutoff")
    int deleteByDayBefore(@Param("cutoff") LocalDate cutoff);
}
