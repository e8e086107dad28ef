package com.example.redismanager.lock;

import java.util.List;

/**
 * A held lock. Must be released once the guarded work is done.
 */
public interface LockHandle extends AutoCloseable {

    List<String> resources();

    /**
     * @throws LockException if the lock was already lost or the provider is unreachable
     */
    void release();

    @Override
    default void close() {
        release();
    }
}
