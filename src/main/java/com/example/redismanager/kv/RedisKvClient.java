package com.example.redismanager.kv;

import java.time.Duration;
import java.util.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.stereotype.Component;

@Component
public class RedisKvClient implements KvClient {

    private static final Logger logger = LoggerFactory.getLogger(RedisKvClient.class);

    private static final int SCAN_COUNT = 500;
    private static final int DELETE_CHUNK = 500;

    private final StringRedisTemplate redis;

    @Autowired
    public RedisKvClient(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(redis.hasKey(key));
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(key));
    }

    @Override
    public BatchResult setAndExpire(String key, String value, SetMode mode, Duration expiry) {
        List<Object> results = redis.execute(new SessionCallback<List<Object>>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                ValueOperations<String, String> values = ops.opsForValue();
                ops.multi();
                // expiry rides on the SET itself so a refused write leaves the existing TTL alone
                if (expiry == null) {
                    if (mode == SetMode.NX) {
                        values.setIfAbsent(key, value);
                    } else if (mode == SetMode.XX) {
                        values.setIfPresent(key, value);
                    } else {
                        values.set(key, value);
                    }
                } else {
                    if (mode == SetMode.NX) {
                        values.setIfAbsent(key, value, expiry);
                    } else if (mode == SetMode.XX) {
                        values.setIfPresent(key, value, expiry);
                    } else {
                        values.set(key, value, expiry);
                    }
                }
                return ops.exec();
            }
        });

        if (results == null || results.isEmpty()) {
            throw new DataAccessResourceFailureException(
                    "Transaction for key " + key + " was not executed, results: " + results);
        }
        Object setReply = results.get(0);
        // a plain SET cannot be refused, only the conditional modes report FALSE/nil
        boolean setApplied = mode == SetMode.ALWAYS
                ? !Boolean.FALSE.equals(setReply)
                : Boolean.TRUE.equals(setReply);
        if (expiry == null) {
            return BatchResult.of(setApplied);
        }
        return BatchResult.of(setApplied, setApplied);
    }

    @Override
    public long delete(String key) {
        Long removed = redis.delete(Collections.singleton(key));
        return removed == null ? 0L : removed;
    }

    @Override
    public long deleteByPattern(String pattern) {
        ScanOptions options = ScanOptions.scanOptions()
                .match(pattern)
                .count(SCAN_COUNT).build();
        long removed = 0;
        List<String> batch = new ArrayList<>(DELETE_CHUNK);
        try (Cursor<String> cursor = redis.scan(options)) {
            while (cursor.hasNext()) {
                batch.add(cursor.next());
                if (batch.size() >= DELETE_CHUNK) {
                    removed += deleteAll(batch);
                    batch.clear();
                }
            }
        }
        if (!batch.isEmpty()) {
            removed += deleteAll(batch);
        }
        logger.debug("Deleted {} keys matching {}", removed, pattern);
        return removed;
    }

    @Override
    public void flushAll() {
        redis.execute((RedisCallback<Object>) connection -> {
            connection.serverCommands().flushDb();
            return null;
        });
    }

    private long deleteAll(Collection<String> keys) {
        Long removed = redis.delete(keys);
        return removed == null ? 0L : removed;
    }
}
