package com.example.chatstore.service;

import com.example.chatstore.error.AlreadyExistsException;
import com.example.chatstore.error.NotFoundException;
import com.example.chatstore.model.Chat;
import com.example.chatstore.store.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Chat lifecycle and per-user retention.
 *
 * <p>Each user keeps at most {@code maxChats} chats. Creating one more evicts the oldest by creation time,
 * together with their messages. The count is recomputed from the index on every create instead of being
 * kept as a counter; two concurrent creates for one user may both pass the check and leave the user
 * briefly over the cap, which the next create corrects.
 */
@Service
public class ChatManager {

    private static final Logger logger = LoggerFactory.getLogger(ChatManager.class);

    static final String RESOURCE = "Chat";

    private final EntityStore store;
    private final MessageLog messageLog;
    private final FeedbackService feedbackService;
    private final IdGenerator ids;
    private final Clock clock;
    private final int maxChats;
    private final int retentionScanLimit;

    public ChatManager(EntityStore store,
                       MessageLog messageLog,
                       FeedbackService feedbackService,
                       IdGenerator ids,
                       Clock clock,
                       @Value("${app.store.max-chats:20}") int maxChats,
                       @Value("${app.store.retention-scan-limit:100}") int retentionScanLimit) {
        this.store = store;
        this.messageLog = messageLog;
        this.feedbackService = feedbackService;
        this.ids = ids;
        this.clock = clock;
        this.maxChats = maxChats;
        this.retentionScanLimit = retentionScanLimit;
    }

    public Chat create(String userId, String title, String modelId) {
        return create(ids.newId(), userId, title, modelId);
    }

    /**
     * Creates a chat under a caller-chosen id. An id that is already taken fails with
     * {@link AlreadyExistsException}, so an existing chat never changes owner.
     */
    public Chat create(String chatId, String userId, String title, String modelId) {
        // checked before eviction so a rejected create leaves the user's chats alone
        if (store.get(KeySchema.chat(chatId)).isPresent()) {
            throw new AlreadyExistsException(RESOURCE, chatId);
        }
        enforceRetention(userId);

        Instant now = KeySchema.storedPrecision(clock.instant());
        Chat chat = Chat.builder()
                .id(chatId)
                .userId(userId)
                .title(title)
                .modelId(modelId)
                .isPublic(false)
                .createdAt(now)
                .updatedAt(now)
                .build();
        store.put(ItemMapper.toItem(chat), true);
        logger.debug("Created chat {} for user {}", chatId, userId);
        return chat;
    }

    public Optional<Chat> get(String chatId) {
        return store.get(KeySchema.chat(chatId)).map(ItemMapper::toChat);
    }

    public Chat require(String chatId) {
        return get(chatId).orElseThrow(() -> new NotFoundException(RESOURCE, chatId));
    }

    /**
     * The user's chats, newest first.
     */
    public List<Chat> listByUser(String userId, int limit) {
        return store.queryIndex(KeySchema.userChatsIndexPartition(userId), KeySchema.CHAT_INDEX_PREFIX, SortOrder.DESC, limit)
                .stream()
                .map(ItemMapper::toChat)
                .collect(Collectors.toList());
    }

    public Chat rename(String chatId, String newTitle) {
        Map<String, FieldOp> ops = Map.of(
                ItemMapper.TITLE, FieldOp.set(newTitle),
                ItemMapper.UPDATED_AT, FieldOp.set(KeySchema.formatTimestamp(clock.instant())));
        return store.update(KeySchema.chat(chatId), ops)
                .map(ItemMapper::toChat)
                .orElseThrow(() -> new NotFoundException(RESOURCE, chatId));
    }

    /**
     * Deletes messages and feedback first and the chat record last. An interrupted delete leaves
     * orphaned children for {@link OrphanSweeper}, never a live chat with a missing history.
     */
    public void delete(String chatId) {
        messageLog.deleteAll(chatId);
        feedbackService.deleteAll(chatId);
        store.delete(KeySchema.chat(chatId));
        logger.debug("Deleted chat {}", chatId);
    }

    private void enforceRetention(String userId) {
        List<Chat> existing = listByUser(userId, retentionScanLimit);
        if (existing.size() < maxChats) {
            return;
        }
        int countToRemove = existing.size() + 1 - maxChats;
        List<Chat> oldest = existing.stream()
                .sorted(Comparator.comparing(Chat::getCreatedAt).thenComparing(Chat::getId))
                .limit(countToRemove)
                .collect(Collectors.toList());

        logger.info("Enforcing limit: deleting {} old chat(s) for user {}", oldest.size(), userId);
        for (Chat chat : oldest) {
            delete(chat.getId());
        }
    }
}
