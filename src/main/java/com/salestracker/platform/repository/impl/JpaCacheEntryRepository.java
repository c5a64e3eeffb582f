package com.salestracker.platform.repository.impl;

import com.salestracker.platform.model.CacheEntry;
import org.springframework.context.annotation.Profile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
@Profile("!local")
public interface JpaCacheEntryRepository extends JpaRepository<CacheEntry, String> {

    @Modifying
    @Query("DELETE FROM CacheEntry c WHERE c.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
