package com.example.chatstore.mcp;

import com.example.chatstore.error.ForbiddenException;
import com.example.chatstore.error.NotFoundException;
import com.example.chatstore.model.Chat;
import com.example.chatstore.service.ChatManager;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Ownership checks for the tool layer. The persistence services trust their callers, so every tool
 * that acts on a chat on behalf of a user goes through here first.
 */
@Component
public class ChatAccess {

    private final ChatManager chatManager;

    public ChatAccess(ChatManager chatManager) {
        this.chatManager = chatManager;
    }

    public Chat requireOwned(String chatId, String userId) {
        Chat chat = chatManager.get(chatId)
                .orElseThrow(() -> new NotFoundException("Chat", chatId));
        if (!Objects.equals(chat.getUserId(), userId)) {
            throw new ForbiddenException("Chat", chatId, userId);
        }
        return chat;
    }
}
