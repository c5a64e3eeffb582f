package com.salestracker.platform.repository.impl;

import com.salestracker.platform.repository.RedisRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Repository;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.params.SetParams;

import java.util.Optional;

/**
 * Hot tier in front of the cache collection. Every call is best effort: when Redis is disabled or
 * unreachable the repository reports itself unavailable and callers read from storage instead.
 * A connection failure switches the tier off until {@link #recheckConnection()} gets a reply again.
 */
@Repository
public class JedisRedisRepository implements RedisRepository {

    private static final Logger logger = LoggerFactory.getLogger(JedisRedisRepository.class);

    static final String CACHE_KEY_PREFIX = "salestracker:cache:";

    private JedisPool jedisPool;
    private volatile boolean available = false;

    @Value("${redis.enabled:true}")
    private boolean enabled;

    @Value("${redis.host:localhost}")
    private String redisHost;

    @Value("${redis.port:6379}")
    private int redisPort;

    @Value("${redis.password:}")
    private String redisPassword;

    @Value("${redis.ssl:false}")
    private boolean redisSsl;

    @Value("${redis.timeout:2000}")
    private int timeout;

    public JedisRedisRepository() {
    }

    JedisRedisRepository(JedisPool jedisPool) {
        this.jedisPool = jedisPool;
        this.enabled = true;
        this.available = true;
    }

    @PostConstruct
    public void init() {
        if (!enabled) {
            logger.info("Redis cache tier disabled, serving cache from storage only");
            return;
        }
        try {
            JedisPoolConfig poolConfig = new JedisPoolConfig();
            poolConfig.setMaxTotal(64);
            poolConfig.setMaxIdle(16);
            poolConfig.setMinIdle(4);
            poolConfig.setTestOnBorrow(true);

            DefaultJedisClientConfig.Builder clientConfigBuilder = DefaultJedisClientConfig.builder()
                .connectionTimeoutMillis(timeout)
                .socketTimeoutMillis(timeout);

            if (redisSsl) {
                clientConfigBuilder.ssl(true);
            }

            if (redisPassword != null && !redisPassword.isEmpty()) {
                clientConfigBuilder.password(redisPassword);
            }

            jedisPool = new JedisPool(poolConfig, new HostAndPort(redisHost, redisPort), clientConfigBuilder.build());

            try (Jedis jedis = jedisPool.getResource()) {
                jedis.ping();
                available = true;
                logger.info("Connected to Redis at {}:{}{}", redisHost, redisPort, redisSsl ? " (SSL enabled)" : "");
            }
        } catch (Exception e) {
            logger.warn("Failed to initialize Redis connection, continuing without cache tier: {}", e.getMessage());
            available = false;
        }
    }

    @PreDestroy
    public void destroy() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            jedisPool.close();
        }
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    /**
     * Brings the tier back once Redis answers again after a connection failure.
     */
    @Scheduled(fixedDelayString = "${redis.recheck-interval-ms:30000}")
    public void recheckConnection() {
        if (!enabled || available || jedisPool == null) {
            return;
        }
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.ping();
            available = true;
            logger.info("Redis at {}:{} is reachable again, re-enabling cache tier", redisHost, redisPort);
        } catch (Exception e) {
            logger.debug("Redis still unreachable: {}", e.getMessage());
        }
    }

    @Override
    public Optional<String> get(String key) {
        if (key == null || key.isBlank() || !available) {
            return Optional.empty();
        }

        try (Jedis jedis = jedisPool.getResource()) {
            return Optional.ofNullable(jedis.get(CACHE_KEY_PREFIX + key));
        } catch (JedisConnectionException e) {
            markUnavailable(e);
            return Optional.empty();
        } catch (Exception e) {
            logger.warn("Failed to read {} from Redis: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, String value, long ttlMillis) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Cache key cannot be null or empty");
        }
        long effectiveTtl = effectiveTtlMillis(ttlMillis);
        if (effectiveTtl == 0 || !available) {
            return;
        }

        try (Jedis jedis = jedisPool.getResource()) {
            jedis.set(CACHE_KEY_PREFIX + key, value, SetParams.setParams().px(effectiveTtl));
        } catch (JedisConnectionException e) {
            markUnavailable(e);
            throw new RuntimeException("Failed to write cache key to Redis: " + key, e);
        } catch (Exception e) {
            throw new RuntimeException("Failed to write cache key to Redis: " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        if (key == null || key.isBlank() || !available) {
            return;
        }

        try (Jedis jedis = jedisPool.getResource()) {
            jedis.del(CACHE_KEY_PREFIX + key);
        } catch (JedisConnectionException e) {
            markUnavailable(e);
            throw new RuntimeException("Failed to delete cache key from Redis: " + key, e);
        } catch (Exception e) {
            throw new RuntimeException("Failed to delete cache key from Redis: " + key, e);
        }
    }

    private void markUnavailable(Exception cause) {
        if (available) {
            logger.warn("Redis stopped responding, disabling cache tier until it answers again: {}",
                cause.getMessage());
        }
        available = false;
    }

    /**
     * TTL handed to Redis. Non-positive values mean the entry is already expired and must not be
     * written at all, since Redis rejects a zero PX.
     */
    static long effectiveTtlMillis(long ttlMillis) {
        return Math.max(0L, ttlMillis);
    }
}
