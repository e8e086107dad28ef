package com.example.redismanager.controller;

import com.example.redismanager.service.RedisManager;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final RedisManager redisManager;

    public HealthController(RedisManager redisManager) {
        this.redisManager = redisManager;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "redis-manager");
        health.put("version", "1.0.0");
        health.put("namespace", redisManager.namespace());
        health.put("locking", redisManager.isLocking());

        try {
            redisManager.has("health-check");
            health.put("redis", "UP");
        } catch (Exception e) {
            health.put("status", "DEGRADED");
            health.put("redis", "DOWN");
            health.put("redisError", e.getMessage());
        }

        return ResponseEntity.ok(health);
    }

    @GetMapping("/actuator/health")
    public ResponseEntity<Map<String, Object>> actuatorHealth() {
        return health();
    }
}
