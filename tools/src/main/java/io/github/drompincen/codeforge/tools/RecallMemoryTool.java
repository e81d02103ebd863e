package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

public class RecallMemoryTool implements Tool {

    @Override public String name() { return "recall_memory"; }
    @Override public String description() { return "Retrieve a previously saved memory by key"; }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object()
                .string("key", "Key of the memory", true)
                .build();
    }

    @Override public ToolCategory category() { return ToolCategory.MEMORY; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        String key = args.requireString("key");
        try {
            return ToolResult.success(ctx.memories().recall(ctx.projectId(), key)
                    .orElse("No memory found for key: " + key));
        } catch (RuntimeException e) {
            return ToolResult.failure("Failed to recall memory: " + e.getMessage());
        }
    }
}
