package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Overwrites an existing memory. Unlike {@code save_memory} the key must already exist.
 */
public class UpdateMemoryTool implements Tool {

    @Override public String name() { return "update_memory"; }
    @Override public String description() { return "Update an existing memory with new information"; }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object()
                .string("key", "Key of the memory to update", true)
                .string("value", "New value of the memory", true)
                .build();
    }

    @Override public ToolCategory category() { return ToolCategory.MEMORY; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        String key = args.requireString("key");
        String value = args.requireString("value");
        try {
            if (ctx.memories().recall(ctx.projectId(), key).isEmpty()) {
                return ToolResult.failure("No memory found for key: " + key + ". Use save_memory to create it.");
            }
            ctx.memories().save(ctx.projectId(), key, value);
            return ToolResult.success("Memory updated: " + key);
        } catch (RuntimeException e) {
            return ToolResult.failure("Failed to update memory: " + e.getMessage());
        }
    }
}
