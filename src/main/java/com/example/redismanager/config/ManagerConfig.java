package com.example.redismanager.config;

import com.example.redismanager.codec.ValueCodec;
import com.example.redismanager.kv.KvClient;
import com.example.redismanager.lock.LockSettings;
import com.example.redismanager.lock.RedisLockClient;
import com.example.redismanager.service.RedisManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

@Configuration
public class ManagerConfig {

    private static final Logger logger = LoggerFactory.getLogger(ManagerConfig.class);

    @Value("${app.manager.namespace:default}")
    private String namespace;

    @Value("${app.manager.default-expiry-ms:0}")
    private long defaultExpiryMs;

    @Value("${app.manager.max-retries:5}")
    private int maxRetries;

    @Value("${app.manager.locking.enabled:false}")
    private boolean lockingEnabled;

    @Value("${app.manager.locking.default-ttl-ms:0}")
    private long defaultLockTtlMs;

    @Value("${app.manager.locking.retry-count:10}")
    private int lockRetryCount;

    @Value("${app.manager.locking.retry-delay-ms:200}")
    private long lockRetryDelayMs;

    @Value("${app.manager.locking.retry-jitter-ms:200}")
    private long lockRetryJitterMs;

    @Bean
    public ValueCodec valueCodec() {
        return new ValueCodec();
    }

    @Bean
    public RedisManager redisManager(KvClient kvClient, StringRedisTemplate redis, ValueCodec valueCodec) {
        RedisManager.Builder builder = RedisManager.builder(kvClient)
                .namespace(namespace)
                .maxRetries(maxRetries)
                .valueCodec(valueCodec);
        if (defaultExpiryMs > 0) {
            builder.defaultExpiry(Duration.ofMillis(defaultExpiryMs));
        }
        if (lockingEnabled) {
            if (defaultLockTtlMs <= 0) {
                throw new IllegalStateException(
                        "app.manager.locking.default-ttl-ms must be set when app.manager.locking.enabled=true");
            }
            LockSettings settings = LockSettings.builder()
                    .retryCount(lockRetryCount)
                    .retryDelay(Duration.ofMillis(lockRetryDelayMs))
                    .retryJitter(Duration.ofMillis(lockRetryJitterMs))
                    .build();
            builder.locking(new RedisLockClient(redis, settings), Duration.ofMillis(defaultLockTtlMs));
        }
        RedisManager manager = builder.build();
        logger.info("Redis manager ready: namespace={}, expiry={}, maxRetries={}, locking={}",
                manager.namespace(), manager.defaultExpiry(), manager.maxRetries(), manager.isLocking());
        return manager;
    }
}
