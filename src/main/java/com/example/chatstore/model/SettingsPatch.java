package com.example.chatstore.model;

import lombok.Builder;
import lombok.Value;

/**
 * Partial update of {@link UserSettings}. Fields not mentioned in the builder stay unchanged.
 */
@Value
@Builder(toBuilder = true)
public class SettingsPatch {
    @Builder.Default FieldUpdate<Theme> theme = FieldUpdate.unchanged();
    @Builder.Default FieldUpdate<Boolean> mcpEnabled = FieldUpdate.unchanged();
    @Builder.Default FieldUpdate<String> preferredModelId = FieldUpdate.unchanged();
    @Builder.Default FieldUpdate<String> externalAccessToken = FieldUpdate.unchanged();
    @Builder.Default FieldUpdate<String> externalRefreshToken = FieldUpdate.unchanged();
    @Builder.Default FieldUpdate<String> externalTokenExpiry = FieldUpdate.unchanged();
    @Builder.Default FieldUpdate<String> externalUsername = FieldUpdate.unchanged();
    @Builder.Default FieldUpdate<String> externalUserId = FieldUpdate.unchanged();

    /**
     * Clears every credential of the external issue tracker account.
     */
    public static SettingsPatch disconnectExternal() {
        return SettingsPatch.builder()
                .externalAccessToken(FieldUpdate.clear())
                .externalRefreshToken(FieldUpdate.clear())
                .externalTokenExpiry(FieldUpdate.clear())
                .externalUsername(FieldUpdate.clear())
                .externalUserId(FieldUpdate.clear())
                .build();
    }
}
