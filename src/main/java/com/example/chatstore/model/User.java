package com.example.chatstore.model;

import lombok.*;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class User {
    private String id;
    private String email;
    private String name;
    private String credentialHash;
    private Instant createdAt;
    private Instant updatedAt;
}
