package com.example.chatstore.service;

import com.example.chatstore.model.Feedback;
import com.example.chatstore.model.FeedbackRating;
import com.example.chatstore.store.EntityStore;
import com.example.chatstore.store.ItemMapper;
import com.example.chatstore.store.KeySchema;
import com.example.chatstore.store.SortOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Thumbs up/down on assistant messages, one record per message kept in the chat's partition.
 */
@Service
public class FeedbackService {

    private static final Logger logger = LoggerFactory.getLogger(FeedbackService.class);

    private final EntityStore store;
    private final Clock clock;

    public FeedbackService(EntityStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public Feedback submit(String chatId, String messageId, String userId, FeedbackRating rating, String comment) {
        Feedback feedback = Feedback.builder()
                .chatId(chatId)
                .messageId(messageId)
                .userId(userId)
                .rating(rating)
                .comment(comment)
                .createdAt(KeySchema.storedPrecision(clock.instant()))
                .build();
        store.put(ItemMapper.toItem(feedback), false);
        logger.debug("Recorded {} feedback on message {} in chat {}", rating.getValue(), messageId, chatId);
        return feedback;
    }

    public Optional<Feedback> get(String chatId, String messageId) {
        return store.get(KeySchema.feedback(chatId, messageId)).map(ItemMapper::toFeedback);
    }

    public void deleteAll(String chatId) {
        List<Map<String, Object>> items =
                store.queryByPrefix(KeySchema.chatPartition(chatId), KeySchema.FEEDBACK_PREFIX, SortOrder.ASC, 0);
        for (Map<String, Object> item : items) {
            store.delete(ItemMapper.keyOf(item));
        }
    }
}
