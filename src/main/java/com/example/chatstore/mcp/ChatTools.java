package com.example.chatstore.mcp;

import com.example.chatstore.error.NotFoundException;
import com.example.chatstore.model.Chat;
import com.example.chatstore.model.FeedbackRating;
import com.example.chatstore.model.Message;
import com.example.chatstore.model.MessagePart;
import com.example.chatstore.model.MessageRole;
import com.example.chatstore.service.ChatManager;
import com.example.chatstore.service.FeedbackService;
import com.example.chatstore.service.MessageLog;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

@Service
public class ChatTools {

    private static final int DEFAULT_LIST_LIMIT = 50;

    private final ChatManager chatManager;
    private final MessageLog messageLog;
    private final FeedbackService feedbackService;
    private final ChatAccess access;

    public ChatTools(ChatManager chatManager, MessageLog messageLog, FeedbackService feedbackService, ChatAccess access) {
        this.chatManager = chatManager;
        this.messageLog = messageLog;
        this.feedbackService = feedbackService;
        this.access = access;
    }

    @Tool(description = "Create a chat for the user; evicts the user's oldest chats beyond the retention cap")
    public Map<String, Object> chat_create(String userId, String title, String modelId) {
        return ToolResults.chat(chatManager.create(userId, title, modelId));
    }

    @Tool(description = "Get one of the user's chats with its full message log")
    public Map<String, Object> chat_get(String userId, String chatId) {
        Chat chat = access.requireOwned(chatId, userId);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("chat", ToolResults.chat(chat));
        out.put("messages", messages(chatId));
        return out;
    }

    @Tool(description = "List the user's chats, newest first")
    public Map<String, Object> chat_list(String userId, @ToolParam(required = false) Integer limit) {
        int lim = (limit == null || limit <= 0) ? DEFAULT_LIST_LIMIT : Math.min(limit, 100);
        List<Map<String, Object>> chats = chatManager.listByUser(userId, lim).stream()
                .map(ToolResults::chat)
                .collect(Collectors.toList());
        return Map.of("chats", chats);
    }

    @Tool(description = "Rename one of the user's chats")
    public Map<String, Object> chat_rename(String userId, String chatId, String title) {
        access.requireOwned(chatId, userId);
        return ToolResults.chat(chatManager.rename(chatId, title));
    }

    @Tool(description = "Delete one of the user's chats and all of its messages")
    public Map<String, Object> chat_delete(String userId, String chatId) {
        access.requireOwned(chatId, userId);
        chatManager.delete(chatId);
        return Map.of("ok", true);
    }

    @Tool(description = "Append a message to one of the user's chats. Without parts, the content becomes a single text part")
    public Map<String, Object> message_append(String userId,
                                              String chatId,
                                              String role,
                                              String content,
                                              @ToolParam(required = false) List<Map<String, Object>> parts,
                                              @ToolParam(required = false) String regeneratedFrom) {
        access.requireOwned(chatId, userId);
        List<MessagePart> messageParts = parts == null || parts.isEmpty()
                ? List.of(MessagePart.text(content))
                : ToolResults.parts(parts);
        Message stored = messageLog.append(chatId, Message.builder()
                .role(MessageRole.fromValue(role))
                .content(content)
                .parts(messageParts)
                .regeneratedFrom(regeneratedFrom)
                .build());
        return ToolResults.message(stored);
    }

    @Tool(description = "List the messages of one of the user's chats in order")
    public Map<String, Object> message_list(String userId, String chatId) {
        access.requireOwned(chatId, userId);
        return Map.of("messages", messages(chatId));
    }

    @Tool(description = "Delete every message after the given one, e.g. before regenerating from an edited message")
    public Map<String, Object> message_delete_after(String userId, String chatId, String messageId) {
        access.requireOwned(chatId, userId);
        messageLog.deleteAfter(chatId, messageId);
        return Map.of("ok", true);
    }

    @Tool(description = "Replace the content of an existing message without moving it")
    public Map<String, Object> message_update_content(String userId, String chatId, String messageId, String content) {
        access.requireOwned(chatId, userId);
        Message updated = messageLog.updateContent(chatId, messageId, content)
                .orElseThrow(() -> new NotFoundException("Message", messageId));
        return ToolResults.message(updated);
    }

    @Tool(description = "Rate an assistant message up or down with an optional comment")
    public Map<String, Object> feedback_submit(String userId,
                                               String chatId,
                                               String messageId,
                                               String rating,
                                               @ToolParam(required = false) String comment) {
        feedbackService.submit(chatId, messageId, userId, FeedbackRating.fromValue(rating), comment);
        return Map.of("ok", true);
    }

    private List<Map<String, Object>> messages(String chatId) {
        return messageLog.list(chatId).stream()
                .map(ToolResults::message)
                .collect(Collectors.toList());
    }
}
