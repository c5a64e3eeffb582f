package com.salestracker.platform.repository;

import java.util.Optional;

public interface RedisRepository {
    Optional<String> get(String key);
    void set(String key, String value, long ttlMillis);
    void delete(String key);
    boolean isAvailable();
}
