package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

public class DeleteMemoryTool implements Tool {

    @Override public String name() { return "delete_memory"; }
    @Override public String description() { return "Delete a previously saved memory"; }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object()
                .string("key", "Key of the memory to delete", true)
                .build();
    }

    @Override public ToolCategory category() { return ToolCategory.MEMORY; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        String key = args.requireString("key");
        try {
            if (ctx.memories().delete(ctx.projectId(), key)) {
                return ToolResult.success("Memory deleted: " + key);
            }
            return ToolResult.success("No memory found for key: " + key);
        } catch (RuntimeException e) {
            return ToolResult.failure("Failed to delete memory: " + e.getMessage());
        }
    }
}
