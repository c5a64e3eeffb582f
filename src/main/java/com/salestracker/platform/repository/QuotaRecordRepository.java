package com.salestracker.platform.repository;

import com.salestracker.platform.model.QuotaRecord;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Per (category, day) send counters. Both increment operations are atomic with respect to
 * concurrent callers.
 */
public interface QuotaRecordRepository {
    Optional<QuotaRecord> find(String category, LocalDate day);

    /**
     * Unconditionally adds {@code count} and returns the new counter value.
     */
    long increment(String category, LocalDate day, long count, String targetId, Instant now);

    /**
     * Adds {@code count} only if the result stays within {@code ceiling}.
     *
     * @return true when the units were granted
     */
    boolean incrementIfWithin(String category, LocalDate day, long count, long ceiling, String targetId, Instant now);

    void decrement(String category, LocalDate day, long count, Instant now);

    int deleteOlderThan(LocalDate cutoffDay);
}
