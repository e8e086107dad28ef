package com.example.redismanager.service;

import com.example.redismanager.codec.PrefixCodec;
import com.example.redismanager.codec.ValueCodec;
import com.example.redismanager.error.ErrorKind;
import com.example.redismanager.error.ManagerException;
import com.example.redismanager.kv.BatchResult;
import com.example.redismanager.kv.KvClient;
import com.example.redismanager.kv.SetMode;
import com.example.redismanager.lock.KeyLock;
import com.example.redismanager.lock.LockClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Namespaced key-value access on top of Redis.
 * <p>
 * {@code add} only writes absent keys ({@code SET NX}), {@code update} only writes present
 * keys ({@code SET XX}) and {@code upsert} writes unconditionally. When a default expiry is
 * configured, the expiry is set in the same transaction as the value. Mutations run under
 * the key's distributed lock when the manager was built with {@link Builder#locking};
 * reads are never locked.
 * <p>
 * Backend failures are retried {@code maxRetries} times without delay. Conflicts
 * ({@link ErrorKind#KEY_EXISTS}, {@link ErrorKind#KEY_NOT_EXIST}) are never retried.
 * All failures surface as {@link ManagerException}.
 */
public class RedisManager {

    private static final Logger logger = LoggerFactory.getLogger(RedisManager.class);

    public static final String OK = "OK";

    private final KvClient kvClient;
    private final PrefixCodec prefixCodec;
    private final ValueCodec valueCodec;
    private final Duration defaultExpiry;
    private final int maxRetries;
    private final KeyLock keyLock;

    private RedisManager(Builder builder) {
        this.kvClient = builder.kvClient;
        this.prefixCodec = new PrefixCodec(builder.namespace);
        this.valueCodec = builder.valueCodec != null ? builder.valueCodec : new ValueCodec();
        this.defaultExpiry = builder.defaultExpiry;
        this.maxRetries = builder.maxRetries;
        this.keyLock = builder.keyLock;
    }

    public static Builder builder(KvClient kvClient) {
        return new Builder(kvClient);
    }

    public String namespace() { return prefixCodec.namespace(); }

    /** Expiry applied to every write, or {@code null} when entries never expire. */
    public Duration defaultExpiry() { return defaultExpiry; }

    public int maxRetries() { return maxRetries; }

    public boolean isLocking() { return keyLock.isLocking(); }

    public String add(String key, Object value) {
        return add(key, value, null);
    }

    /**
     * Stores {@code value} under {@code key} if the key does not exist yet.
     *
     * @param lockTtl lock TTL for this call, {@code null} for the default
     * @return {@link #OK}
     * @throws ManagerException {@code KEY_EXISTS} if the key already exists
     */
    public String add(String key, Object value, Duration lockTtl) {
        return write("add", key, value, SetMode.NX, lockTtl);
    }

    public String update(String key, Object value) {
        return update(key, value, null);
    }

    /**
     * Replaces the value of an existing key.
     *
     * @throws ManagerException {@code KEY_NOT_EXIST} if the key does not exist
     */
    public String update(String key, Object value, Duration lockTtl) {
        return write("update", key, value, SetMode.XX, lockTtl);
    }

    public String upsert(String key, Object value) {
        return upsert(key, value, null);
    }

    public String upsert(String key, Object value, Duration lockTtl) {
        return write("upsert", key, value, SetMode.ALWAYS, lockTtl);
    }

    public boolean delete(String key) {
        return delete(key, null);
    }

    /**
     * @return {@code true} if the key existed and was removed
     */
    public boolean delete(String key, Duration lockTtl) {
        String prefixedKey = prefixCodec.concat(key);
        return keyLock.withLock(prefixCodec.lockResource(prefixedKey), lockTtl, () -> {
            long removed = BoundedRetry.call(maxRetries, "delete key " + prefixedKey,
                    () -> kvClient.delete(prefixedKey));
            logger.debug("delete {} removed {}", prefixedKey, removed);
            return removed > 0;
        });
    }

    /**
     * @return the decoded value, or {@link Lookup#absent()} if the key does not exist
     */
    public Lookup get(String key) {
        String prefixedKey = prefixCodec.concat(key);
        Optional<String> wire = BoundedRetry.call(maxRetries, "get key " + prefixedKey,
                () -> kvClient.get(prefixedKey));
        return wire.map(w -> Lookup.of(valueCodec.parse(w))).orElse(Lookup.absent());
    }

    /**
     * Reads the value and converts it to {@code type}. Empty both when the key is
     * missing and when the stored value is {@code null}.
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        String prefixedKey = prefixCodec.concat(key);
        Optional<String> wire = BoundedRetry.call(maxRetries, "get key " + prefixedKey,
                () -> kvClient.get(prefixedKey));
        return wire.map(w -> valueCodec.parse(w, type));
    }

    public boolean has(String key) {
        String prefixedKey = prefixCodec.concat(key);
        return BoundedRetry.call(maxRetries, "check existence of key " + prefixedKey,
                () -> kvClient.exists(prefixedKey));
    }

    /**
     * Removes every key of this manager's namespace. Not isolated from concurrent writers.
     */
    public void clearNamespace() {
        String pattern = prefixCodec.pattern();
        long removed = BoundedRetry.call(maxRetries, "clear namespace " + namespace(),
                () -> kvClient.deleteByPattern(pattern));
        logger.info("Cleared namespace {} ({} keys)", namespace(), removed);
    }

    /**
     * Removes every key of the connected database, other namespaces included.
     */
    public void clearAll() {
        BoundedRetry.call(maxRetries, "clear all keys", () -> {
            kvClient.flushAll();
            return null;
        });
        logger.info("Cleared all keys (requested from namespace {})", namespace());
    }

    private String write(String operation, String key, Object value, SetMode mode, Duration lockTtl) {
        String prefixedKey = prefixCodec.concat(key);
        String wire = valueCodec.serialize(value);
        return keyLock.withLock(prefixCodec.lockResource(prefixedKey), lockTtl, () -> {
            BatchResult result = BoundedRetry.call(maxRetries, operation + " key " + prefixedKey,
                    () -> kvClient.setAndExpire(prefixedKey, wire, mode, defaultExpiry));
            if (!result.isSetApplied()) {
                throw conflict(mode, key, prefixedKey);
            }
            if (result.isExpireRequested() && !result.getExpireApplied()) {
                throw new ManagerException(ErrorKind.BACKEND_INTERNAL,
                        "Failed to " + operation + " key " + prefixedKey + ": value was written but expire of "
                                + defaultExpiry.toMillis() + "ms was not applied.");
            }
            logger.debug("{} {} -> {}", operation, prefixedKey, result);
            return OK;
        });
    }

    private static ManagerException conflict(SetMode mode, String key, String prefixedKey) {
        if (mode == SetMode.NX) {
            return ManagerException.keyExists(key);
        }
        if (mode == SetMode.XX) {
            return ManagerException.keyNotExist(key);
        }
        return new ManagerException(ErrorKind.BACKEND_INTERNAL, "Redis refused unconditional SET of " + prefixedKey + ".");
    }

    public static final class Builder {
        private final KvClient kvClient;
        private String namespace;
        private Duration defaultExpiry;
        private int maxRetries;
        private KeyLock keyLock = KeyLock.none();
        private ValueCodec valueCodec;

        private Builder(KvClient kvClient) {
            this.kvClient = Objects.requireNonNull(kvClient, "kvClient");
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder defaultExpiry(Duration defaultExpiry) {
            this.defaultExpiry = defaultExpiry;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Guards every mutation with a lock on {@code lock:<namespace>:<key>}.
         */
        public Builder locking(LockClient lockClient, Duration defaultLockTtl) {
            this.keyLock = KeyLock.distributed(lockClient, defaultLockTtl);
            return this;
        }

        public Builder valueCodec(ValueCodec valueCodec) {
            this.valueCodec = valueCodec;
            return this;
        }

        public RedisManager build() {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
            }
            if (defaultExpiry != null && (defaultExpiry.isZero() || defaultExpiry.isNegative())) {
                throw new IllegalArgumentException("defaultExpiry must be positive, got " + defaultExpiry);
            }
            return new RedisManager(this);
        }
    }
}
