package com.example.chatstore.model;

import lombok.*;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Feedback {
    private String messageId;
    private String chatId;
    private String userId;
    private FeedbackRating rating;
    private String comment;
    private Instant createdAt;
}
