package com.example.chatstore.service;

import com.example.chatstore.model.FieldUpdate;
import com.example.chatstore.model.SettingsPatch;
import com.example.chatstore.model.Theme;
import com.example.chatstore.model.UserSettings;
import com.example.chatstore.store.EntityStore;
import com.example.chatstore.store.FieldOp;
import com.example.chatstore.store.ItemMapper;
import com.example.chatstore.store.KeySchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The single {@code USER#{id} / SETTINGS} record of each user.
 */
@Service
public class SettingsStore {

    private static final Logger logger = LoggerFactory.getLogger(SettingsStore.class);

    private final EntityStore store;
    private final Clock clock;

    public SettingsStore(EntityStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Stored settings, or the defaults when the user has never saved any.
     */
    public UserSettings get(String userId) {
        return store.get(KeySchema.userSettings(userId))
                .map(ItemMapper::toSettings)
                .orElseGet(() -> UserSettings.defaults(userId));
    }

    /**
     * Applies the patch field by field and returns the settings as stored afterwards.
     * Creates the record on first use.
     */
    public UserSettings update(String userId, SettingsPatch patch) {
        Map<String, FieldOp> ops = new LinkedHashMap<>();
        ops.put(ItemMapper.USER_ID, FieldOp.set(userId));
        ops.put(ItemMapper.UPDATED_AT, FieldOp.set(KeySchema.formatTimestamp(clock.instant())));
        addOp(ops, ItemMapper.THEME, patch.getTheme().map(Theme::getValue));
        addOp(ops, ItemMapper.MCP_ENABLED, patch.getMcpEnabled());
        addOp(ops, ItemMapper.PREFERRED_MODEL_ID, patch.getPreferredModelId());
        addOp(ops, ItemMapper.EXTERNAL_ACCESS_TOKEN, patch.getExternalAccessToken());
        addOp(ops, ItemMapper.EXTERNAL_REFRESH_TOKEN, patch.getExternalRefreshToken());
        addOp(ops, ItemMapper.EXTERNAL_TOKEN_EXPIRY, patch.getExternalTokenExpiry());
        addOp(ops, ItemMapper.EXTERNAL_USERNAME, patch.getExternalUsername());
        addOp(ops, ItemMapper.EXTERNAL_USER_ID, patch.getExternalUserId());

        UserSettings updated = ItemMapper.toSettings(store.upsert(KeySchema.userSettings(userId), ops));
        logger.debug("Updated settings of user {}: {}", userId, ops.keySet());
        return updated;
    }

    private static void addOp(Map<String, FieldOp> ops, String field, FieldUpdate<?> update) {
        switch (update.getState()) {
            case SET:
                ops.put(field, FieldOp.set(update.getValue()));
                break;
            case CLEAR:
                ops.put(field, FieldOp.remove());
                break;
            default:
                break;
        }
    }
}
