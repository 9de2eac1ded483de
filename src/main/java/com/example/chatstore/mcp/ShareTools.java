package com.example.chatstore.mcp;

import com.example.chatstore.error.NotFoundException;
import com.example.chatstore.model.Chat;
import com.example.chatstore.service.MessageLog;
import com.example.chatstore.service.SharingService;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class ShareTools {

    private final SharingService sharingService;
    private final MessageLog messageLog;
    private final ChatAccess access;

    public ShareTools(SharingService sharingService, MessageLog messageLog, ChatAccess access) {
        this.sharingService = sharingService;
        this.messageLog = messageLog;
        this.access = access;
    }

    @Tool(description = "Make one of the user's chats publicly readable and return its share id")
    public Map<String, Object> share_create(String userId, String chatId) {
        access.requireOwned(chatId, userId);
        String shareId = sharingService.makePublic(chatId, userId);
        return Map.of("shareId", shareId, "shareUrl", "/share/" + shareId);
    }

    @Tool(description = "Read a publicly shared chat and its messages by share id")
    public Map<String, Object> share_resolve(String shareId) {
        Chat chat = sharingService.resolveShare(shareId)
                .orElseThrow(() -> new NotFoundException("PublicShare", shareId));
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("chat", ToolResults.chat(chat));
        out.put("messages", messageLog.list(chat.getId()).stream()
                .map(ToolResults::message)
                .collect(Collectors.toList()));
        return out;
    }

    @Tool(description = "Copy a publicly shared chat with its full history into a new chat owned by the user")
    public Map<String, Object> share_fork(String userId, String shareId) {
        return Map.of("newChatId", sharingService.forkShare(shareId, userId));
    }
}
