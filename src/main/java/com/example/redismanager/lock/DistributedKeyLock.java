package com.example.redismanager.lock;

import com.example.redismanager.error.ErrorKind;
import com.example.redismanager.error.ManagerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Acquires the key's lock around every mutation and releases it on every exit path.
 * <p>
 * A failed release after a successful action is thrown, so the caller learns that the
 * lock may still be held until its TTL runs out. There is no rollback of the write.
 * When the action itself failed, the release failure is attached to that exception as
 * suppressed.
 */
public class DistributedKeyLock implements KeyLock {

    private static final Logger logger = LoggerFactory.getLogger(DistributedKeyLock.class);

    private final LockClient lockClient;
    private final Duration defaultTtl;

    public DistributedKeyLock(LockClient lockClient, Duration defaultTtl) {
        this.lockClient = Objects.requireNonNull(lockClient, "lockClient");
        if (defaultTtl == null || defaultTtl.isZero() || defaultTtl.isNegative()) {
            throw new IllegalArgumentException("default lock TTL is required when locking is enabled");
        }
        this.defaultTtl = defaultTtl;
    }

    public Duration getDefaultTtl() { return defaultTtl; }

    @Override
    public boolean isLocking() {
        return true;
    }

    @Override
    public <T> T withLock(String resource, Duration ttl, Supplier<T> action) {
        Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
        LockHandle handle;
        try {
            handle = lockClient.acquire(List.of(resource), effectiveTtl);
        } catch (RuntimeException e) {
            throw new ManagerException(ErrorKind.LOCK_INTERNAL,
                    "Failed to acquire lock " + resource + " (ttl " + effectiveTtl.toMillis() + "ms).", e);
        }

        T result;
        try {
            result = action.get();
        } catch (RuntimeException | Error e) {
            try {
                handle.release();
            } catch (RuntimeException releaseFailure) {
                logger.error("Lock {} could not be released after a failed operation", resource, releaseFailure);
                e.addSuppressed(releaseFailure);
            }
            throw e;
        }

        try {
            handle.release();
        } catch (RuntimeException e) {
            throw new ManagerException(ErrorKind.LOCK_INTERNAL,
                    "Error occurred while releasing the lock " + resource + ".", e);
        }
        return result;
    }
}
