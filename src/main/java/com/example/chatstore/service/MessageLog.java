package com.example.chatstore.service;

import com.example.chatstore.model.Message;
import com.example.chatstore.store.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Append-only, time-ordered message log of a chat. Records live in the chat's partition under
 * {@code MESSAGE#{createdAt}#{id}}, so the sort key alone gives the log order.
 */
@Service
public class MessageLog {

    private static final Logger logger = LoggerFactory.getLogger(MessageLog.class);

    private final EntityStore store;
    private final IdGenerator ids;
    private final Clock clock;

    public MessageLog(EntityStore store, IdGenerator ids, Clock clock) {
        this.store = store;
        this.ids = ids;
        this.clock = clock;
    }

    /**
     * Stores the message and moves the chat's {@code updatedAt} to the message time.
     * Missing id and timestamp are assigned here; re-appending the same stored message overwrites it in place.
     */
    public Message append(String chatId, Message message) {
        Objects.requireNonNull(message.getRole(), "role");
        Message stored = message.toBuilder()
                .chatId(chatId)
                .id(message.getId() != null ? message.getId() : ids.newMessageId())
                .createdAt(KeySchema.storedPrecision(message.getCreatedAt() != null ? message.getCreatedAt() : clock.instant()))
                .content(message.getContent() != null ? message.getContent() : "")
                .build();
        store.put(ItemMapper.toItem(stored), false);
        logger.debug("Appended message {} to chat {}", stored.getId(), chatId);

        touch(chatId, stored.getCreatedAt());
        return stored;
    }

    public List<Message> list(String chatId) {
        return listItems(chatId).stream()
                .map(ItemMapper::toMessage)
                .collect(Collectors.toList());
    }

    /**
     * Removes every message after the given one, keeping the message itself.
     * Unknown message ids leave the log untouched.
     */
    public void deleteAfter(String chatId, String messageId) {
        List<Map<String, Object>> items = listItems(chatId);
        int index = indexOf(items, messageId);
        if (index < 0) {
            logger.debug("Message {} not in chat {}, nothing deleted", messageId, chatId);
            return;
        }
        List<Map<String, Object>> tail = items.subList(index + 1, items.size());
        for (Map<String, Object> item : tail) {
            store.delete(ItemMapper.keyOf(item));
        }
        logger.info("Deleted {} message(s) after {} in chat {}", tail.size(), messageId, chatId);
    }

    /**
     * Rewrites the content of one message without moving it in the log.
     */
    public Optional<Message> updateContent(String chatId, String messageId, String newContent) {
        List<Map<String, Object>> items = listItems(chatId);
        int index = indexOf(items, messageId);
        if (index < 0) {
            logger.warn("Message not found: chat {} message {}", chatId, messageId);
            return Optional.empty();
        }
        Key key = ItemMapper.keyOf(items.get(index));
        return store.update(key, Map.of(ItemMapper.CONTENT, FieldOp.set(newContent == null ? "" : newContent)))
                .map(ItemMapper::toMessage);
    }

    public void deleteAll(String chatId) {
        List<Map<String, Object>> items = listItems(chatId);
        for (Map<String, Object> item : items) {
            store.delete(ItemMapper.keyOf(item));
        }
        if (!items.isEmpty()) {
            logger.debug("Deleted {} message(s) of chat {}", items.size(), chatId);
        }
    }

    private List<Map<String, Object>> listItems(String chatId) {
        return new ArrayList<>(store.queryByPrefix(KeySchema.chatPartition(chatId), KeySchema.MESSAGE_PREFIX, SortOrder.ASC, 0));
    }

    private void touch(String chatId, Instant at) {
        Optional<Map<String, Object>> chat = store.update(KeySchema.chat(chatId),
                Map.of(ItemMapper.UPDATED_AT, FieldOp.set(KeySchema.formatTimestamp(at))));
        if (chat.isEmpty()) {
            logger.warn("Appended message to chat {} which has no metadata record", chatId);
        }
    }

    private static int indexOf(List<Map<String, Object>> items, String messageId) {
        for (int i = 0; i < items.size(); i++) {
            if (Objects.equals(messageId, items.get(i).get(ItemMapper.ID))) {
                return i;
            }
        }
        return -1;
    }
}
