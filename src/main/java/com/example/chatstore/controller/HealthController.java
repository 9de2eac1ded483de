package com.example.chatstore.controller;

import com.example.chatstore.kv.KvClient;
import com.example.chatstore.store.EntityStore;
import com.example.chatstore.store.KeySchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private static final Logger logger = LoggerFactory.getLogger(HealthController.class);

    private static final String PROBE_ID = "health-check";

    private final KvClient kvClient;
    private final EntityStore entityStore;
    private final String serviceName;
    private final String version;

    public HealthController(KvClient kvClient,
                            EntityStore entityStore,
                            @Value("${spring.ai.mcp.server.name:chat-store}") String serviceName,
                            @Value("${spring.ai.mcp.server.version:0.1.0}") String version) {
        this.kvClient = kvClient;
        this.entityStore = entityStore;
        this.serviceName = serviceName;
        this.version = version;
    }

    /**
     * Reports DOWN with 503 when the primary store is unreachable. The cache is optional, so a Redis
     * failure only shows up in the body.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("service", serviceName);
        health.put("version", version);

        boolean storeUp = true;
        try {
            entityStore.get(KeySchema.user(PROBE_ID));
            health.put("mongodb", "UP");
        } catch (Exception e) {
            storeUp = false;
            health.put("mongodb", "DOWN");
            health.put("mongodbError", e.getMessage());
            logger.warn("Health probe of the store failed: {}", e.getMessage());
        }

        try {
            kvClient.get(PROBE_ID);
            health.put("redis", "UP");
        } catch (Exception e) {
            health.put("redis", "DOWN");
            health.put("redisError", e.getMessage());
        }

        health.put("status", storeUp ? "UP" : "DOWN");
        return ResponseEntity.status(storeUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(health);
    }

    @GetMapping("/actuator/health")
    public ResponseEntity<Map<String, Object>> actuatorHealth() {
        return health();
    }
}
