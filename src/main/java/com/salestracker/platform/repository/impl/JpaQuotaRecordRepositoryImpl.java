package com.salestracker.platform.repository.impl;

import com.salestracker.platform.model.QuotaRecord;
import com.salestracker.platform.model.QuotaRecordId;
import com.salestracker.platform.repository.QuotaRecordRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Counters are changed only through single UPDATE statements so the database row lock makes each
 * increment atomic; the ceiling check lives in the WHERE clause.
 */
@Repository
@Profile("!local")
public class JpaQuotaRecordRepositoryImpl implements QuotaRecordRepository {

    private final JpaQuotaRecordRepository jpaRepository;

    @Autowired
    public JpaQuotaRecordRepositoryImpl(JpaQuotaRecordRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public Optional<QuotaRecord> find(String category, LocalDate day) {
        return jpaRepository.findById(new QuotaRecordId(category, day));
    }

    @Override
    @Transactional
    public long increment(String category, LocalDate day, long count, String targetId, Instant now) {
        jpaRepository.insertIfAbsent(category, day, now);
        jpaRepository.add(category, day, count, targetId, now);
        return find(category, day).map(QuotaRecord::getCount).orElse(count);
    }

    @Override
    @Transactional
    public boolean incrementIfWithin(String category, LocalDate day, long count, long ceiling,
                                     String targetId, Instant now) {
        jpaRepository.insertIfAbsent(category, day, now);
        return jpaRepository.addWithinCeiling(category, day, count, ceiling, targetId, now) == 1;
    }

    @Override
    @Transactional
    public void decrement(String category, LocalDate day, long count, Instant now) {
        jpaRepository.subtract(category, day, count, now);
    }

    @Override
    @Transactional
    public int deleteOlderThan(LocalDate cutoffDay) {
        return jpaRepository.deleteByDayBefore(cutoffDay);
    }
}
