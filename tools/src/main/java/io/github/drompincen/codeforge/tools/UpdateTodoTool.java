package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.protocol.api.TodoItem;
import io.github.drompincen.codeforge.protocol.api.TodoStatus;
import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;
import java.util.UUID;

/**
 * Sets the status of a todo. Any transition is accepted, including reopening a completed item.
 */
public class UpdateTodoTool implements Tool {

    @Override public String name() { return "update_todo"; }
    @Override public String description() { return "Update the status of a todo item"; }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object()
                .string("todo_id", "Id of the todo, as returned by create_todo", true)
                .enumeration("status", "New status", true, "pending", "in_progress", "completed")
                .build();
    }

    @Override public ToolCategory category() { return ToolCategory.TODO; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        String rawId = args.requireString("todo_id").trim();
        String rawStatus = args.requireString("status");

        UUID id;
        try {
            id = UUID.fromString(rawId);
        } catch (IllegalArgumentException e) {
            return ToolResult.failure("Invalid todo id: " + rawId);
        }
        Optional<TodoStatus> status = TodoStatus.fromWire(rawStatus);
        if (status.isEmpty()) {
            return ToolResult.failure("Invalid status: " + rawStatus + ". Use pending, in_progress or completed");
        }
        Optional<TodoItem> updated = ctx.todos().update(ctx.projectId(), id, status.get());
        if (updated.isEmpty()) {
            return ToolResult.failure("Todo not found: " + rawId);
        }
        ctx.callback().onTodoUpdated(updated.get());
        return ToolResult.success("Todo updated: " + updated.get().title() + " -> " + status.get().wireName());
    }
}
