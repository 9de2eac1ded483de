package com.example.chatstore.kv;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisKvClientTest {

    @Mock
    private StringRedisTemplate redis;

    @Mock
    private ValueOperations<String, String> ops;

    private RedisKvClient kvClient;

    @BeforeEach
    void setUp() {
        kvClient = new RedisKvClient(redis, "test:");
    }

    @Test
    void testGet_UsesNamespace() {
        when(redis.opsForValue()).thenReturn(ops);
        when(ops.get("test:share:abc")).thenReturn("chat-1");

        assertEquals(Optional.of("chat-1"), kvClient.get("share:abc"));
    }

    @Test
    void testSet_WithTtl() {
        when(redis.opsForValue()).thenReturn(ops);

        kvClient.set("share:abc", "chat-1", Duration.ofMinutes(5));

        verify(ops).set("test:share:abc", "chat-1", Duration.ofMinutes(5));
    }

    @Test
    void testSet_ZeroTtlNeverExpires() {
        when(redis.opsForValue()).thenReturn(ops);

        kvClient.set("k", "v", Duration.ZERO);

        verify(ops).set("test:k", "v");
        verify(ops, never()).set(anyString(), anyString(), any(Duration.class));
    }

    @Test
    void testDel() {
        kvClient.del("share:abc");

        verify(redis).delete("test:share:abc");
    }
}
