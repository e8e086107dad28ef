package com.example.redismanager.mcp;

import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class CapabilitiesTools {

    @Tool(description = "List available tool names and server info for introspection")
    public Map<String,Object> capabilities_list() {
        return Map.of(
                "server", Map.of("name", "redis-manager", "version", "1.0.0"),
                "tools", List.of("kv_add", "kv_update", "kv_upsert", "kv_delete",
                        "kv_get", "kv_has", "kv_clear_namespace"),
                "capabilities", Map.of(
                    "tools", true,
                    "resources", false,
                    "prompts", false
                )
        );
    }
}
