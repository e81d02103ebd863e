package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

public class FinishTaskTool implements Tool {

    @Override public String name() { return "finish_task"; }
    @Override public String description() {
        return "Mark the current task as complete. Call this once all requested work is done";
    }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object()
                .string("summary", "Brief summary of what was accomplished", true)
                .build();
    }

    @Override public ToolCategory category() { return ToolCategory.AGENT_CONTROL; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        String summary = args.requireString("summary");
        ctx.callback().onTaskFinished(summary);
        return ToolResult.success("Task completed: " + summary);
    }
}
