package com.salestracker.platform.repository.impl;

import com.salestracker.platform.model.CacheEntry;
import com.salestracker.platform.repository.CacheEntryRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

@Repository
@Profile("!local")
public class JpaCacheEntryRepositoryImpl implements CacheEntryRepository {

    private final JpaCacheEntryRepository jpaRepository;

    @Autowired
    public JpaCacheEntryRepositoryImpl(JpaCacheEntryRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public Optional<CacheEntry> findByKey(String key) {
        return jpaRepository.findById(key);
    }

    @Override
    public CacheEntry save(CacheEntry entry) {
        return jpaRepository.save(entry);
    }

    @Override
    public void deleteByKey(String key) {
        if (jpaRepository.existsById(key)) {
            jpaRepository.deleteById(key);
        }
    }

    @Override
    @Transactional
    public int deleteExpired(Instant now) {
        return jpaRepository.deleteExpired(now);
    }
}
