package com.salestracker.platform.repository;

import com.salestracker.platform.model.CacheEntry;

import java.time.Instant;
import java.util.Optional;

public interface CacheEntryRepository {
    Optional<CacheEntry> findByKey(String key);
    CacheEntry save(CacheEntry entry);
    void deleteByKey(String key);

    /**
     * Removes every entry whose expiry is at or before {@code now}.
     *
     * @return number of entries removed
     */
    int deleteExpired(Instant now);
}
