package com.example.chatstore.controller;

import com.example.chatstore.error.StoreUnavailableException;
import com.example.chatstore.kv.KvClient;
import com.example.chatstore.store.EntityStore;
import com.example.chatstore.store.Key;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

    @Mock
    private KvClient kvClient;

    @Mock
    private EntityStore entityStore;

    private HealthController controller;

    @BeforeEach
    void setUp() {
        controller = new HealthController(kvClient, entityStore, "chat-store", "0.1.0");
    }

    @Test
    void testHealth_AllUp() {
        ResponseEntity<Map<String, Object>> response = controller.health();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("UP", response.getBody().get("status"));
        assertEquals("UP", response.getBody().get("mongodb"));
        assertEquals("UP", response.getBody().get("redis"));
    }

    @Test
    void testHealth_RedisDownIsDegradedButUp() {
        when(kvClient.get(anyString())).thenThrow(new RuntimeException("connection refused"));

        ResponseEntity<Map<String, Object>> response = controller.health();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("DOWN", response.getBody().get("redis"));
        assertEquals("connection refused", response.getBody().get("redisError"));
    }

    @Test
    void testHealth_StoreDown() {
        when(entityStore.get(any(Key.class))).thenThrow(new StoreUnavailableException("Store get failed", null));

        ResponseEntity<Map<String, Object>> response = controller.actuatorHealth();

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals("DOWN", response.getBody().get("status"));
        assertEquals("DOWN", response.getBody().get("mongodb"));
    }
}
