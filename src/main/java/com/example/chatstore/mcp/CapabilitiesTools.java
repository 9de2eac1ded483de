package com.example.chatstore.mcp;

import org.springframework.ai.tool.annotation.Tool;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class CapabilitiesTools {

    static final List<String> TOOL_NAMES = List.of(
            "chat_create", "chat_get", "chat_list", "chat_rename", "chat_delete",
            "message_append", "message_list", "message_delete_after", "message_update_content",
            "feedback_submit",
            "share_create", "share_resolve", "share_fork",
            "settings_get", "settings_update",
            "capabilities_list");

    private final String serverName;
    private final String serverVersion;
    private final int maxChats;

    public CapabilitiesTools(@Value("${spring.ai.mcp.server.name:chat-store}") String serverName,
                             @Value("${spring.ai.mcp.server.version:0.1.0}") String serverVersion,
                             @Value("${app.store.max-chats:20}") int maxChats) {
        this.serverName = serverName;
        this.serverVersion = serverVersion;
        this.maxChats = maxChats;
    }

    @Tool(description = "List available tool names and counts for introspection")
    public Map<String, Object> capabilities_list() {
        // static list; asking the tool provider here would be a circular dependency
        return Map.of(
                "server", Map.of("name", serverName, "version", serverVersion),
                "tools", TOOL_NAMES,
                "toolCount", TOOL_NAMES.size(),
                "limits", Map.of("maxChatsPerUser", maxChats),
                "capabilities", Map.of(
                        "tools", true,
                        "resources", false,
                        "prompts", false,
                        "completion", false
                )
        );
    }
}
