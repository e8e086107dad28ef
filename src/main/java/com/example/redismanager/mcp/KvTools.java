package com.example.redismanager.mcp;

import com.example.redismanager.codec.ValueCodec;
import com.example.redismanager.error.ManagerException;
import com.example.redismanager.service.Lookup;
import com.example.redismanager.service.RedisManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Manager operations exposed as MCP tools. Values travel in the stored encoding: JSON
 * text, or the tagged form for big integers and byte buffers.
 */
@Service
public class KvTools {

    private static final Logger logger = LoggerFactory.getLogger(KvTools.class);

    private final RedisManager redisManager;
    private final ValueCodec valueCodec;

    public KvTools(RedisManager redisManager, ValueCodec valueCodec) {
        this.redisManager = redisManager;
        this.valueCodec = valueCodec;
    }

    @Tool(description = "Add a key only if it does not exist. value is JSON text; optional lockTtlMs")
    public Map<String,Object> kv_add(String key, String value, Long lockTtlMs) {
        return call(key, () -> Map.of("result", redisManager.add(key, decode(value), lockTtl(lockTtlMs))));
    }

    @Tool(description = "Update a key only if it already exists. value is JSON text; optional lockTtlMs")
    public Map<String,Object> kv_update(String key, String value, Long lockTtlMs) {
        return call(key, () -> Map.of("result", redisManager.update(key, decode(value), lockTtl(lockTtlMs))));
    }

    @Tool(description = "Set a key whether or not it exists. value is JSON text; optional lockTtlMs")
    public Map<String,Object> kv_upsert(String key, String value, Long lockTtlMs) {
        return call(key, () -> Map.of("result", redisManager.upsert(key, decode(value), lockTtl(lockTtlMs))));
    }

    @Tool(description = "Delete a key; reports whether it existed")
    public Map<String,Object> kv_delete(String key, Long lockTtlMs) {
        return call(key, () -> Map.of("deleted", redisManager.delete(key, lockTtl(lockTtlMs))));
    }

    @Tool(description = "Get the value of a key as JSON text; exists=false when the key is missing")
    public Map<String,Object> kv_get(String key) {
        return call(key, () -> {
            Lookup lookup = redisManager.get(key);
            Map<String,Object> result = new HashMap<>();
            result.put("exists", lookup.isPresent());
            result.put("value", lookup.isPresent() ? valueCodec.serialize(lookup.value()) : null);
            return result;
        });
    }

    @Tool(description = "Check whether a key exists")
    public Map<String,Object> kv_has(String key) {
        return call(key, () -> Map.of("exists", redisManager.has(key)));
    }

    @Tool(description = "Delete every key in this server's namespace")
    public Map<String,Object> kv_clear_namespace() {
        return call(null, () -> {
            redisManager.clearNamespace();
            return Map.of("namespace", redisManager.namespace());
        });
    }

    private Object decode(String value) {
        return value == null ? null : valueCodec.parse(value);
    }

    private static Duration lockTtl(Long lockTtlMs) {
        return (lockTtlMs == null || lockTtlMs <= 0) ? null : Duration.ofMillis(lockTtlMs);
    }

    private Map<String,Object> call(String key, Supplier<Map<String,Object>> operation) {
        Map<String, Object> response = new HashMap<>();
        response.put("key", key);
        try {
            response.putAll(operation.get());
            response.put("ok", true);
        } catch (ManagerException e) {
            logger.debug("Tool call for key {} failed with {}", key, e.getKind());
            response.put("ok", false);
            response.put("code", e.getCode());
            response.put("kind", e.getKind().name());
            response.put("message", e.getMessage());
        }
        return response;
    }
}
