package com.salestracker.platform.repository.impl;

import com.salestracker.platform.model.CacheEntry;
import com.salestracker.platform.repository.CacheEntryRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
@Profile("local")
public class JsonCacheEntryRepository implements CacheEntryRepository {

    private final JsonDocumentCollection<CacheEntry> entries;

    public JsonCacheEntryRepository(@Value("${salestracker.storage.directory:./data}") String dataDirectory) {
        this.entries = new JsonDocumentCollection<>(dataDirectory, "cache", CacheEntry.class, CacheEntry::getKey);
    }

    @Override
    public Optional<CacheEntry> findByKey(String key) {
        return entries.findById(key);
    }

    @Override
    public CacheEntry save(CacheEntry entry) {
        return entries.save(entry);
    }

    @Override
    public void deleteByKey(String key) {
        entries.delete(key);
    }

    @Override
    public int deleteExpired(Instant now) {
        return entries.withLock(() -> {
            List<CacheEntry> expired = entries.findAll().stream()
                .filter(entry -> entry.isExpiredAt(now))
                .toList();
            if (expired.isEmpty()) {
                return 0;
            }
            expired.forEach(entry -> entries.removeWithoutPersist(entry.getKey()));
            entries.persist();
            return expired.size();
        });
    }
}
