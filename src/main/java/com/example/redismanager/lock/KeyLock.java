package com.example.redismanager.lock;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * How a manager guards its mutations: not at all, or with a distributed lock per key.
 */
public interface KeyLock {

    /**
     * Runs {@code action} while holding {@code resource}.
     *
     * @param ttl lock TTL for this call, or {@code null} for the configured default
     * @throws com.example.redismanager.error.ManagerException of kind
     *         {@code LOCK_INTERNAL} when the lock cannot be acquired or released
     */
    <T> T withLock(String resource, Duration ttl, Supplier<T> action);

    boolean isLocking();

    static KeyLock none() {
        return NoOpKeyLock.INSTANCE;
    }

    static KeyLock distributed(LockClient lockClient, Duration defaultTtl) {
        return new DistributedKeyLock(lockClient, defaultTtl);
    }
}
