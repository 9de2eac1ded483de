package com.example.chatstore.model;

import lombok.*;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Message {
    private String id;
    private String chatId;
    private MessageRole role;
    private String content;
    private List<MessagePart> parts;
    // id of the message this one replaces after a regeneration
    private String regeneratedFrom;
    private Instant createdAt;
}
