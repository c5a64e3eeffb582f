package com.salestracker.platform.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salestracker.platform.exception.SalesTrackerException;
import com.salestracker.platform.model.CacheEntry;
import com.salestracker.platform.repository.CacheEntryRepository;
import com.salestracker.platform.repository.RedisRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Time-boxed cache for computed aggregates.
 * <p>
 * Entries live in the cache collection (authoritative) and, when Redis is reachable, in Redis as a
 * hot tier. Both tiers store the full {@link CacheEntry} so the expiry is always checked against the
 * injected clock before a payload is served. Misses on the same key are computed once; concurrent
 * callers wait for the in-flight computation.
 */
@Service
public class CacheService {

    private static final Logger logger = LoggerFactory.getLogger(CacheService.class);

    private final CacheEntryRepository cacheEntryRepository;
    private final RedisRepository redisRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, CompletableFuture<String>> inFlight = new ConcurrentHashMap<>();

    @Autowired
    public CacheService(
            CacheEntryRepository cacheEntryRepository,
            RedisRepository redisRepository,
            ObjectMapper objectMapper,
            Clock clock) {
        this.cacheEntryRepository = cacheEntryRepository;
        this.redisRepository = redisRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public <T> T getOrCompute(String key, Duration ttl, Class<T> type, Supplier<T> loader) {
        Optional<String> cached = readFresh(key);
        if (cached.isPresent()) {
            logger.debug("Cache hit for {}", key);
            return deserialize(cached.get(), type);
        }

        CompletableFuture<String> computation = new CompletableFuture<>();
        CompletableFuture<String> existing = inFlight.putIfAbsent(key, computation);
        if (existing != null) {
            logger.debug("Waiting for in-flight computation of {}", key);
            return deserialize(awaitPayload(existing), type);
        }

        try {
            logger.debug("Cache miss for {}, recomputing", key);
            String payload = serialize(loader.get());
            write(key, payload, ttl);
            computation.complete(payload);
            return deserialize(payload, type);
        } catch (RuntimeException e) {
            computation.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, computation);
        }
    }

    public void evict(String key) {
        try {
            cacheEntryRepository.deleteByKey(key);
        } catch (Exception e) {
            logger.warn("Failed to evict {} from cache storage", key, e);
        }
        try {
            redisRepository.delete(key);
        } catch (Exception e) {
            logger.warn("Failed to evict {} from Redis", key, e);
        }
    }

    /**
     * Deletes expired entries from the cache collection. Redis expires its copies on its own.
     *
     * @return number of entries removed
     */
    public int cleanupExpired() {
        int removed = cacheEntryRepository.deleteExpired(clock.instant());
        logger.info("Cleaned up {} expired cache entries", removed);
        return removed;
    }

    private Optional<String> readFresh(String key) {
        Instant now = clock.instant();

        Optional<CacheEntry> fromRedis = readFromRedis(key);
        if (fromRedis.isPresent() && !fromRedis.get().isExpiredAt(now)) {
            return Optional.of(fromRedis.get().getPayload());
        }

        try {
            return cacheEntryRepository.findByKey(key)
                .filter(entry -> !entry.isExpiredAt(now))
                .map(CacheEntry::getPayload);
        } catch (Exception e) {
            logger.warn("Failed to read {} from cache storage, treating as miss", key, e);
            return Optional.empty();
        }
    }

    private Optional<CacheEntry> readFromRedis(String key) {
        if (!redisRepository.isAvailable()) {
            return Optional.empty();
        }
        try {
            Optional<String> raw = redisRepository.get(key);
            if (raw.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(raw.get(), CacheEntry.class));
        } catch (Exception e) {
            logger.warn("Failed to read {} from Redis, falling back to storage", key, e);
            return Optional.empty();
        }
    }

    private void write(String key, String payload, Duration ttl) {
        Instant now = clock.instant();
        CacheEntry entry = CacheEntry.builder()
            .key(key)
            .payload(payload)
            .createdAt(now)
            .expiresAt(now.plus(ttl))
            .build();

        try {
            cacheEntryRepository.save(entry);
        } catch (Exception e) {
            logger.warn("Failed to store {} in cache storage, value served uncached", key, e);
        }

        if (!redisRepository.isAvailable()) {
            return;
        }
        try {
            redisRepository.set(key, objectMapper.writeValueAsString(entry), ttl.toMillis());
        } catch (Exception e) {
            logger.warn("Failed to store {} in Redis", key, e);
        }
    }

    private String awaitPayload(CompletableFuture<String> computation) {
        try {
            return computation.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    private String serialize(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SalesTrackerException("Failed to serialize cache payload", e);
        }
    }

    private <T> T deserialize(String payload, Class<T> type) {
        try {
            return objectMapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new SalesTrackerException("Failed to deserialize cache payload", e);
        }
    }
}
