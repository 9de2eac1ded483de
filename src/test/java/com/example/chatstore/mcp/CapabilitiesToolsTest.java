package com.example.chatstore.mcp;

import org.junit.jupiter.api.Test;
import org.springframework.ai.tool.annotation.Tool;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class CapabilitiesToolsTest {

    @Test
    void testCapabilitiesList() {
        Map<String, Object> caps = new CapabilitiesTools("chat-store", "0.1.0", 20).capabilities_list();

        assertEquals(Map.of("name", "chat-store", "version", "0.1.0"), caps.get("server"));
        assertEquals(CapabilitiesTools.TOOL_NAMES.size(), caps.get("toolCount"));
        assertEquals(Map.of("maxChatsPerUser", 20), caps.get("limits"));
    }

    @Test
    void testListedNamesMatchAnnotatedTools() {
        Set<String> annotated = Stream.of(ChatTools.class, ShareTools.class, SettingsTools.class, CapabilitiesTools.class)
                .flatMap(type -> Arrays.stream(type.getDeclaredMethods()))
                .filter(method -> method.isAnnotationPresent(Tool.class))
                .map(Method::getName)
                .collect(Collectors.toSet());

        List<String> listed = CapabilitiesTools.TOOL_NAMES;
        assertEquals(annotated, Set.copyOf(listed));
        assertEquals(listed.size(), annotated.size());
    }
}
