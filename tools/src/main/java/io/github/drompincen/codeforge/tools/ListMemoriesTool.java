package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.stream.Collectors;

public class ListMemoriesTool implements Tool {

    @Override public String name() { return "list_memories"; }
    @Override public String description() { return "List all memories saved for this project"; }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object().build();
    }

    @Override public ToolCategory category() { return ToolCategory.MEMORY; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        Map<String, String> memories;
        try {
            memories = ctx.memories().list(ctx.projectId());
        } catch (RuntimeException e) {
            return ToolResult.failure("Failed to list memories: " + e.getMessage());
        }
        if (memories.isEmpty()) {
            return ToolResult.success("No memories saved for this project");
        }
        return ToolResult.success(memories.entrySet().stream()
                .map(e -> "• " + e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("\n")));
    }
}
