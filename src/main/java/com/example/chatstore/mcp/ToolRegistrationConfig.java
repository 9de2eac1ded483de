package com.example.chatstore.mcp;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;

@Configuration
public class ToolRegistrationConfig {

    private final ChatTools chatTools;
    private final ShareTools shareTools;
    private final SettingsTools settingsTools;
    private final CapabilitiesTools capTools;

    public ToolRegistrationConfig(ChatTools chatTools,
                                  ShareTools shareTools,
                                  SettingsTools settingsTools,
                                  CapabilitiesTools capTools) {
        this.chatTools = chatTools;
        this.shareTools = shareTools;
        this.settingsTools = settingsTools;
        this.capTools = capTools;
    }

    @Bean
    public ToolCallbackProvider toolCallbacks() {
        return MethodToolCallbackProvider.builder()
                .toolObjects(chatTools, shareTools, settingsTools, capTools)
                .build();
    }
}
