package com.example.redismanager.mcp;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;

@Configuration
public class ToolRegistrationConfig {

    private final KvTools kvTools;
    private final CapabilitiesTools capTools;

    public ToolRegistrationConfig(KvTools kvTools, CapabilitiesTools capTools) {
        this.kvTools = kvTools;
        this.capTools = capTools;
    }

    @Bean
    public ToolCallbackProvider toolCallbacks() {
        return MethodToolCallbackProvider.builder()
                .toolObjects(kvTools, capTools)
                .build();
    }
}
