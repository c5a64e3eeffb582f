package com.salestracker.platform.repository.impl;

import com.salestracker.platform.model.QuotaRecord;
import com.salestracker.platform.repository.QuotaRecordRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
@Profile("local")
public class JsonQuotaRecordRepository implements QuotaRecordRepository {

    private final JsonDocumentCollection<QuotaRecord> records;

    public JsonQuotaRecordRepository(@Value("${salestracker.storage.directory:./data}") String dataDirectory) {
        this.records = new JsonDocumentCollection<>(dataDirectory, "quota", QuotaRecord.class,
            record -> documentId(record.getCategory(), record.getDay()));
    }

    private static String documentId(String category, LocalDate day) {
        return category + "_" + day;
    }

    @Override
    public Optional<QuotaRecord> find(String category, LocalDate day) {
        return records.findById(documentId(category, day));
    }

    @Override
    public long increment(String category, LocalDate day, long count, String targetId, Instant now) {
        return records.withLock(() -> {
            QuotaRecord record = findOrNew(category, day);
            record.setCount(record.getCount() + count);
            record.setLastTargetId(targetId);
            record.setUpdatedAt(now);
            records.putWithoutPersist(record);
            records.persist();
            return record.getCount();
        });
    }

    @Override
    public boolean incrementIfWithin(String category, LocalDate day, long count, long ceiling,
                                     String targetId, Instant now) {
        return records.withLock(() -> {
            QuotaRecord record = findOrNew(category, day);
            if (record.getCount() + count > ceiling) {
                return false;
            }
            record.setCount(record.getCount() + count);
            record.setLastTargetId(targetId);
            record.setUpdatedAt(now);
            records.putWithoutPersist(record);
            records.persist();
            return true;
        });
    }

    @Override
    public void decrement(String category, LocalDate day, long count, Instant now) {
        records.withLock(() -> {
            find(category, day).ifPresent(record -> {
                record.setCount(Math.max(0, record.getCount() - count));
                record.setUpdatedAt(now);
                records.persist();
            });
            return null;
        });
    }

    @Override
    public int deleteOlderThan(LocalDate cutoffDay) {
        return records.withLock(() -> {
            List<QuotaRecord> stale = records.findAll().stream()
                .filter(record -> record.getDay().isBefore(cutoffDay))
                .toList();
            if (stale.isEmpty()) {
                return 0;
            }
            stale.forEach(record -> records.removeWithoutPersist(documentId(record.getCategory(), record.getDay())));
            records.persist();
            return stale.size();
        });
    }

    private QuotaRecord findOrNew(String category, LocalDate day) {
        return find(category, day)
            .map(existing -> QuotaRecord.builder()
                .category(existing.getCategory())
                .day(existing.getDay())
                .count(existing.getCount())
                .lastTargetId(existing.getLastTargetId())
                .updatedAt(existing.getUpdatedAt())
                .build())
            .orElseGet(() -> QuotaRecord.builder().category(category).day(day).count(0).build());
    }
}
