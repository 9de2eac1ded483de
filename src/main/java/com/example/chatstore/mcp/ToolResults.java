package com.example.chatstore.mcp;

import com.example.chatstore.model.Chat;
import com.example.chatstore.model.Message;
import com.example.chatstore.model.MessagePart;
import com.example.chatstore.model.UserSettings;
import com.example.chatstore.store.ItemMapper;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Plain map views of entities for tool responses. Absent fields are omitted.
 */
final class ToolResults {

    private ToolResults() {
    }

    static Map<String, Object> chat(Chat chat) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", chat.getId());
        out.put("userId", chat.getUserId());
        out.put("title", chat.getTitle());
        out.put("modelId", chat.getModelId());
        out.put("isPublic", chat.isPublic());
        putIfPresent(out, "shareId", chat.getShareId());
        out.put("createdAt", Objects.toString(chat.getCreatedAt(), null));
        out.put("updatedAt", Objects.toString(chat.getUpdatedAt(), null));
        return out;
    }

    static Map<String, Object> message(Message message) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", message.getId());
        out.put("chatId", message.getChatId());
        out.put("role", message.getRole().getValue());
        out.put("content", message.getContent());
        if (message.getParts() != null) {
            out.put("parts", message.getParts().stream().map(ItemMapper::toMap).collect(Collectors.toList()));
        }
        putIfPresent(out, "regeneratedFrom", message.getRegeneratedFrom());
        out.put("createdAt", Objects.toString(message.getCreatedAt(), null));
        return out;
    }

    /**
     * Settings without secrets: tokens are reduced to a connected flag.
     */
    static Map<String, Object> settings(UserSettings settings) {
        Map<String, Object> out = new LinkedHashMap<>();
        putIfPresent(out, "theme", settings.getTheme() == null ? null : settings.getTheme().getValue());
        putIfPresent(out, "mcpEnabled", settings.getMcpEnabled());
        putIfPresent(out, "preferredModelId", settings.getPreferredModelId());
        putIfPresent(out, "externalUsername", settings.getExternalUsername());
        out.put("externalConnected", settings.isExternalConnected());
        return out;
    }

    static List<MessagePart> parts(List<Map<String, Object>> raw) {
        if (raw == null) {
            return null;
        }
        return raw.stream().map(ItemMapper::toPart).collect(Collectors.toList());
    }

    private static void putIfPresent(Map<String, Object> out, String name, Object value) {
        if (value != null) {
            out.put(name, value);
        }
    }
}
