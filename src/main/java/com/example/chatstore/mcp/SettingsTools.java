package com.example.chatstore.mcp;

import com.example.chatstore.model.FieldUpdate;
import com.example.chatstore.model.SettingsPatch;
import com.example.chatstore.model.Theme;
import com.example.chatstore.service.SettingsStore;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class SettingsTools {

    static final String THEME = "theme";
    static final String MCP_ENABLED = "mcpEnabled";
    static final String PREFERRED_MODEL_ID = "preferredModelId";
    static final String EXTERNAL_ACCOUNT = "externalAccount";
    private static final Set<String> CLEARABLE = Set.of(THEME, MCP_ENABLED, PREFERRED_MODEL_ID, EXTERNAL_ACCOUNT);

    private final SettingsStore settingsStore;

    public SettingsTools(SettingsStore settingsStore) {
        this.settingsStore = settingsStore;
    }

    @Tool(description = "Get the user's settings; credentials are reported only as a connected flag")
    public Map<String, Object> settings_get(String userId) {
        return ToolResults.settings(settingsStore.get(userId));
    }

    @Tool(description = "Update the user's settings. Omitted fields stay unchanged; fields named in 'clear' "
            + "(theme, mcpEnabled, preferredModelId, externalAccount) are removed")
    public Map<String, Object> settings_update(String userId,
                                               @ToolParam(required = false) String theme,
                                               @ToolParam(required = false) Boolean mcpEnabled,
                                               @ToolParam(required = false) String preferredModelId,
                                               @ToolParam(required = false) List<String> clear) {
        Set<String> toClear = clear == null ? Set.of() : Set.copyOf(clear);
        for (String field : toClear) {
            if (!CLEARABLE.contains(field)) {
                throw new IllegalArgumentException("Field cannot be cleared: " + field);
            }
        }

        SettingsPatch.SettingsPatchBuilder patch = toClear.contains(EXTERNAL_ACCOUNT)
                ? SettingsPatch.disconnectExternal().toBuilder()
                : SettingsPatch.builder();
        patch.theme(toUpdate(toClear.contains(THEME), theme == null ? null : Theme.fromValue(theme)))
                .mcpEnabled(toUpdate(toClear.contains(MCP_ENABLED), mcpEnabled))
                .preferredModelId(toUpdate(toClear.contains(PREFERRED_MODEL_ID), preferredModelId));

        return ToolResults.settings(settingsStore.update(userId, patch.build()));
    }

    private static <T> FieldUpdate<T> toUpdate(boolean clear, T value) {
        if (clear) {
            return FieldUpdate.clear();
        }
        return value == null ? FieldUpdate.unchanged() : FieldUpdate.set(value);
    }
}
