package com.example.redismanager.kv;

/**
 * Condition attached to a {@code SET}.
 */
public enum SetMode {
    /** Set only if the key is absent. */
    NX,
    /** Set only if the key is present. */
    XX,
    /** Unconditional set. */
    ALWAYS
}
