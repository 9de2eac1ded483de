package com.example.chatstore.model;

import lombok.*;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Chat {
    private String id;
    private String userId;
    private String title;
    private String modelId;
    // shareId is set exactly when the chat is public
    private boolean isPublic;
    private String shareId;
    private Instant createdAt;
    private Instant updatedAt;
}
