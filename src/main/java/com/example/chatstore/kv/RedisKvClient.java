package com.example.chatstore.kv;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * String key/value access to Redis. Every key is written under {@code app.kv.namespace} so several
 * deployments can share one Redis database.
 */
@Component
public class RedisKvClient implements KvClient {

    private static final Logger logger = LoggerFactory.getLogger(RedisKvClient.class);

    private final StringRedisTemplate redis;
    private final String namespace;

    @Autowired
    public RedisKvClient(StringRedisTemplate redis, @Value("${app.kv.namespace:chatstore:}") String namespace) {
        this.redis = redis;
        this.namespace = namespace == null ? "" : namespace;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(namespaced(key)));
    }

    /**
     * A missing, zero or negative ttl stores the value without expiry.
     */
    @Override
    public void set(String key, String value, Duration ttl) {
        String fullKey = namespaced(key);
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            redis.opsForValue().set(fullKey, value);
        } else {
            redis.opsForValue().set(fullKey, value, ttl);
        }
        logger.trace("SET {} (ttl={})", fullKey, ttl);
    }

    @Override
    public void del(String key) {
        redis.delete(namespaced(key));
    }

    String namespaced(String key) {
        return namespace + key;
    }
}
