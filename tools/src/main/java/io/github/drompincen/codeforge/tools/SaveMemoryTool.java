package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

public class SaveMemoryTool implements Tool {

    @Override public String name() { return "save_memory"; }
    @Override public String description() {
        return "Remember a fact about the project (a pattern, decision or preference) under a key";
    }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object()
                .string("key", "Unique key for the memory (e.g. color_scheme, nav_pattern)", true)
                .string("value", "Information to remember", true)
                .build();
    }

    @Override public ToolCategory category() { return ToolCategory.MEMORY; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        String key = args.requireString("key");
        String value = args.requireString("value");
        try {
            ctx.memories().save(ctx.projectId(), key, value);
            return ToolResult.success("Memory saved: " + key);
        } catch (RuntimeException e) {
            return ToolResult.failure("Failed to save memory: " + e.getMessage());
        }
    }
}
