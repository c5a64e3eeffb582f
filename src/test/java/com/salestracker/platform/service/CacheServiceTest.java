package com.salestracker.platform.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.salestracker.platform.dto.TeamStats;
import com.salestracker.platform.model.CacheEntry;
import com.salestracker.platform.repository.RedisRepository;
import com.salestracker.platform.repository.impl.JsonCacheEntryRepository;
import com.salestracker.platform.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CacheServiceTest {

    private static final Duration TTL = Duration.ofHours(1);

    @TempDir
    Path dataDirectory;

    @Mock
    private RedisRepository redisRepository;

    private JsonCacheEntryRepository cacheEntryRepository;
    private ObjectMapper objectMapper;
    private MutableClock clock;
    private CacheService cacheService;

    @BeforeEach
    void setUp() {
        cacheEntryRepository = new JsonCacheEntryRepository(dataDirectory.toString());
        objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        clock = MutableClock.at("2024-03-10T03:00:00Z");
        cacheService = new CacheService(cacheEntryRepository, redisRepository, objectMapper, clock);
    }

    private TeamStats stats(long totalPoints) {
        return TeamStats.builder().totalPoints(totalPoints).calculatedAt(clock.instant()).build();
    }

    @Test
    void testGetOrCompute_ServesCachedValueWithinTtl() {
        // Arrange
        AtomicInteger loads = new AtomicInteger();

        // Act
        TeamStats first = cacheService.getOrCompute("team_stats", TTL, TeamStats.class,
            () -> stats(100 + loads.incrementAndGet()));
        clock.advance(Duration.ofMinutes(59));
        TeamStats second = cacheService.getOrCompute("team_stats", TTL, TeamStats.class,
            () -> stats(100 + loads.incrementAndGet()));

        // Assert
        assertEquals(1, loads.get());
        assertEquals(first, second);
        assertEquals(101, second.getTotalPoints());
    }

    @Test
    void testGetOrCompute_RecomputesAtExpiry() {
        AtomicInteger loads = new AtomicInteger();

        cacheService.getOrCompute("team_stats", TTL, TeamStats.class, () -> stats(loads.incrementAndGet()));
        clock.advance(TTL);
        TeamStats refreshed = cacheService.getOrCompute("team_stats", TTL, TeamStats.class,
            () -> stats(loads.incrementAndGet()));

        assertEquals(2, loads.get());
        assertEquals(2, refreshed.getTotalPoints());
    }

    @Test
    void testEvict_ForcesRecompute() {
        AtomicInteger loads = new AtomicInteger();
        cacheService.getOrCompute("team_stats", TTL, TeamStats.class, () -> stats(loads.incrementAndGet()));

        cacheService.evict("team_stats");
        cacheService.getOrCompute("team_stats", TTL, TeamStats.class, () -> stats(loads.incrementAndGet()));

        assertEquals(2, loads.get());
        verify(redisRepository).delete("team_stats");
    }

    @Test
    void testGetOrCompute_LoaderFailureIsNotCached() {
        assertThrows(IllegalStateException.class, () -> cacheService.getOrCompute("team_stats", TTL,
            TeamStats.class, () -> {
                throw new IllegalStateException("storage down");
            }));

        assertTrue(cacheEntryRepository.findByKey("team_stats").isEmpty());
        TeamStats recovered = cacheService.getOrCompute("team_stats", TTL, TeamStats.class, () -> stats(7));
        assertEquals(7, recovered.getTotalPoints());
    }

    @Test
    void testGetOrCompute_ConcurrentMissesComputeOnce() throws Exception {
        // Arrange
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch loaderEntered = new CountDownLatch(1);
        CountDownLatch releaseLoader = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            // Act
            Future<TeamStats> first = executor.submit(() -> cacheService.getOrCompute("team_stats", TTL,
                TeamStats.class, () -> {
                    loads.incrementAndGet();
                    loaderEntered.countDown();
                    try {
                        releaseLoader.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return stats(42);
                }));
            assertTrue(loaderEntered.await(5, TimeUnit.SECONDS));

            Future<TeamStats> second = executor.submit(() -> cacheService.getOrCompute("team_stats", TTL,
                TeamStats.class, () -> stats(loads.incrementAndGet())));
            // Give the second caller time to find the in-flight computation
            Thread.sleep(100);
            releaseLoader.countDown();

            // Assert
            assertEquals(42, first.get(5, TimeUnit.SECONDS).getTotalPoints());
            assertEquals(42, second.get(5, TimeUnit.SECONDS).getTotalPoints());
            assertEquals(1, loads.get());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testGetOrCompute_ExpiredRedisCopyIsIgnored() throws Exception {
        // Arrange
        CacheEntry stale = CacheEntry.builder()
            .key("team_stats")
            .payload(objectMapper.writeValueAsString(stats(1)))
            .createdAt(clock.instant().minus(Duration.ofHours(2)))
            .expiresAt(clock.instant().minusSeconds(1))
            .build();
        when(redisRepository.isAvailable()).thenReturn(true);
        when(redisRepository.get("team_stats")).thenReturn(Optional.of(objectMapper.writeValueAsString(stale)));

        // Act
        TeamStats result = cacheService.getOrCompute("team_stats", TTL, TeamStats.class, () -> stats(2));

        // Assert
        assertEquals(2, result.getTotalPoints());
        verify(redisRepository).set(eq("team_stats"), anyString(), eq(TTL.toMillis()));
    }

    @Test
    void testGetOrCompute_RedisFailureFallsBackToStorage() {
        when(redisRepository.isAvailable()).thenReturn(true);
        when(redisRepository.get(anyString())).thenThrow(new RuntimeException("connection reset"));
        doThrow(new RuntimeException("connection reset")).when(redisRepository).set(anyString(), anyString(), anyLong());

        cacheService.getOrCompute("team_stats", TTL, TeamStats.class, () -> stats(5));
        TeamStats cached = cacheService.getOrCompute("team_stats", TTL, TeamStats.class, () -> stats(6));

        assertEquals(5, cached.getTotalPoints());
    }

    @Test
    void testCleanupExpired_RemovesOnlyExpiredEntries() {
        cacheService.getOrCompute("short", Duration.ofMinutes(5), TeamStats.class, () -> stats(1));
        cacheService.getOrCompute("long", TTL, TeamStats.class, () -> stats(2));
        clock.advance(Duration.ofMinutes(10));

        int removed = cacheService.cleanupExpired();

        assertEquals(1, removed);
        assertTrue(cacheEntryRepository.findByKey("short").isEmpty());
        assertTrue(cacheEntryRepository.findByKey("long").isPresent());
    }
}
