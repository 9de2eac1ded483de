package com.example.chatstore.model;

import lombok.*;

import java.time.Instant;

/**
 * Per-user preferences plus the credentials of the connected issue tracker account.
 * Any field may be null, meaning it is not present on the stored record.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class UserSettings {
    private String userId;
    private Theme theme;
    private Boolean mcpEnabled;
    private String preferredModelId;
    private String externalAccessToken;
    private String externalRefreshToken;
    private String externalTokenExpiry;
    private String externalUsername;
    private String externalUserId;
    private Instant updatedAt;

    public static UserSettings defaults(String userId) {
        return UserSettings.builder()
                .userId(userId)
                .theme(Theme.SYSTEM)
                .mcpEnabled(false)
                .build();
    }

    public boolean isExternalConnected() {
        return externalAccessToken != null;
    }
}
