package com.example.redismanager.lock;

import java.time.Duration;
import java.util.List;

/**
 * Distributed mutual exclusion over named resources.
 */
public interface LockClient {

    /**
     * Acquires every resource in {@code resources} or none of them.
     *
     * @param resources resource names, e.g. {@code lock:namespace:key}
     * @param ttl       how long the lock is held before it expires on its own
     * @return a handle to release the lock with
     * @throws LockException if the lock could not be acquired within the retry budget
     */
    LockHandle acquire(List<String> resources, Duration ttl);
}
