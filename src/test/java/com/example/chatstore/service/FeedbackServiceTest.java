package com.example.chatstore.service;

import com.example.chatstore.model.Feedback;
import com.example.chatstore.model.FeedbackRating;
import com.example.chatstore.support.InMemoryEntityStore;
import com.example.chatstore.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FeedbackServiceTest {

    private FeedbackService feedbackService;

    @BeforeEach
    void setUp() {
        feedbackService = new FeedbackService(new InMemoryEntityStore(), MutableClock.at("2024-03-01T10:00:00Z"));
    }

    @Test
    void testSubmit_OneRecordPerMessage() {
        feedbackService.submit("chat-1", "msg-1", "user-1", FeedbackRating.UP, null);
        feedbackService.submit("chat-1", "msg-1", "user-1", FeedbackRating.DOWN, "actually wrong");

        Feedback feedback = feedbackService.get("chat-1", "msg-1").orElseThrow();
        assertEquals(FeedbackRating.DOWN, feedback.getRating());
        assertEquals("actually wrong", feedback.getComment());
    }

    @Test
    void testDeleteAll() {
        feedbackService.submit("chat-1", "msg-1", "user-1", FeedbackRating.UP, null);
        feedbackService.submit("chat-1", "msg-2", "user-1", FeedbackRating.UP, null);
        feedbackService.submit("chat-2", "msg-3", "user-1", FeedbackRating.UP, null);

        feedbackService.deleteAll("chat-1");

        assertTrue(feedbackService.get("chat-1", "msg-1").isEmpty());
        assertTrue(feedbackService.get("chat-1", "msg-2").isEmpty());
        assertTrue(feedbackService.get("chat-2", "msg-3").isPresent());
    }
}
