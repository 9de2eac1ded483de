package com.example.chatstore.model;

import lombok.*;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PublicShare {
    private String shareId;
    private String chatId;
    private String userId;
    private Instant createdAt;
}
