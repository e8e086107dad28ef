package com.example.redismanager.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Single-instance Redis lock: {@code SET resource token NX PX ttl} to acquire,
 * compare-and-delete to release so an expired holder never removes a newer holder's lock.
 */
public class RedisLockClient implements LockClient {

    private static final Logger logger = LoggerFactory.getLogger(RedisLockClient.class);

    static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('del', KEYS[1]) "
                    + "else return 0 end",
            Long.class);

    private final StringRedisTemplate redis;
    private final LockSettings settings;

    public RedisLockClient(StringRedisTemplate redis, LockSettings settings) {
        this.redis = redis;
        this.settings = settings;
    }

    @Override
    public LockHandle acquire(List<String> resources, Duration ttl) {
        if (resources == null || resources.isEmpty()) {
            throw new IllegalArgumentException("resources must not be empty");
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("lock ttl must be positive, got " + ttl);
        }
        String token = UUID.randomUUID().toString();
        int attempts = settings.getRetryCount() + 1;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (tryAcquireAll(resources, token, ttl)) {
                logger.debug("Acquired lock {} on attempt {}", resources, attempt);
                return new RedisLockHandle(List.copyOf(resources), token);
            }
            if (attempt < attempts) {
                pause();
            }
        }
        throw new LockException("Could not acquire lock " + resources + " after " + attempts + " attempts");
    }

    private boolean tryAcquireAll(List<String> resources, String token, Duration ttl) {
        List<String> held = new ArrayList<>(resources.size());
        try {
            for (String resource : resources) {
                if (!Boolean.TRUE.equals(redis.opsForValue().setIfAbsent(resource, token, ttl))) {
                    releaseAll(held, token);
                    return false;
                }
                held.add(resource);
            }
            return true;
        } catch (DataAccessException e) {
            releaseQuietly(held, token);
            throw new LockException("Redis unavailable while acquiring lock " + resources, e);
        }
    }

    private void pause() {
        long delay = settings.getRetryDelay().toMillis();
        long jitter = settings.getRetryJitter().toMillis();
        if (jitter > 0) {
            delay += ThreadLocalRandom.current().nextLong(jitter + 1);
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockException("Interrupted while waiting for lock", e);
        }
    }

    /** @return resources whose lock was no longer held by {@code token} */
    private List<String> releaseAll(List<String> resources, String token) {
        List<String> lost = new ArrayList<>();
        for (String resource : resources) {
            Long removed = redis.execute(RELEASE_SCRIPT, List.of(resource), token);
            if (removed == null || removed == 0L) {
                lost.add(resource);
            }
        }
        return lost;
    }

    private void releaseQuietly(List<String> resources, String token) {
        try {
            releaseAll(resources, token);
        } catch (DataAccessException e) {
            logger.warn("Rollback of partially acquired lock {} failed, entries expire on their own", resources, e);
        }
    }

    private class RedisLockHandle implements LockHandle {
        private final List<String> resources;
        private final String token;

        RedisLockHandle(List<String> resources, String token) {
            this.resources = resources;
            this.token = token;
        }

        @Override
        public List<String> resources() {
            return resources;
        }

        @Override
        public void release() {
            List<String> lost;
            try {
                lost = releaseAll(resources, token);
            } catch (DataAccessException e) {
                throw new LockException("Redis unavailable while releasing lock " + resources, e);
            }
            if (!lost.isEmpty()) {
                throw new LockException("Lock " + lost + " expired or is held by another owner");
            }
            logger.debug("Released lock {}", resources);
        }
    }
}
