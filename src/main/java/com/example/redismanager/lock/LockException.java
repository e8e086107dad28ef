package com.example.redismanager.lock;

/**
 * Raised by a {@link LockClient} when a lock cannot be acquired or released.
 */
public class LockException extends RuntimeException {

    public LockException(String message) {
        super(message);
    }

    public LockException(String message, Throwable cause) {
        super(message, cause);
    }
}
