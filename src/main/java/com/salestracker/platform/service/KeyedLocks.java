package com.salestracker.platform.service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per key, so read-compute-write sequences on the same user run one at a time while
 * different users proceed in parallel.
 */
class KeyedLocks {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
