package com.example.chatstore.kv;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Read-through cache of {@code shareId -> chatId}. Share mappings are never mutated, so entries
 * only expire. The cache is optional: any Redis failure is logged and treated as a miss.
 */
@Component
public class ShareCache {

    private static final Logger logger = LoggerFactory.getLogger(ShareCache.class);

    static final String KEY_PREFIX = "share:";

    private final KvClient kvClient;
    private final Duration ttl;

    public ShareCache(KvClient kvClient, @Value("${app.share.cache-ttl-seconds:3600}") long ttlSeconds) {
        this.kvClient = kvClient;
        this.ttl = Duration.ofSeconds(ttlSeconds);
    }

    public Optional<String> chatIdFor(String shareId) {
        try {
            return kvClient.get(KEY_PREFIX + shareId);
        } catch (Exception e) {
            logger.warn("Share cache read failed for {}: {}", shareId, e.getMessage());
            return Optional.empty();
        }
    }

    public void remember(String shareId, String chatId) {
        try {
            kvClient.set(KEY_PREFIX + shareId, chatId, ttl);
        } catch (Exception e) {
            logger.warn("Share cache write failed for {}: {}", shareId, e.getMessage());
        }
    }

    public void forget(String shareId) {
        try {
            kvClient.del(KEY_PREFIX + shareId);
        } catch (Exception e) {
            logger.warn("Share cache evict failed for {}: {}", shareId, e.getMessage());
        }
    }
}
