package com.example.redismanager.kv;

import java.time.Duration;
import java.util.Optional;

/**
 * Backend operations the manager relies on. Transport failures are reported as
 * {@link org.springframework.dao.DataAccessException}.
 */
public interface KvClient {
    boolean exists(String key);
    Optional<String> get(String key);

    /**
     * Runs {@code SET key value [NX|XX] [PX expiry]} as one atomic unit. When the
     * condition refuses the write, neither the value nor the TTL of the key changes.
     */
    BatchResult setAndExpire(String key, String value, SetMode mode, Duration expiry);

    long delete(String key);
    long deleteByPattern(String pattern);
    void flushAll();
}
