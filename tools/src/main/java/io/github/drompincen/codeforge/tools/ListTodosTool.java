package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.protocol.api.TodoItem;
import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public class ListTodosTool implements Tool {

    @Override public String name() { return "list_todos"; }
    @Override public String description() { return "List the todo items of the current task"; }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object().build();
    }

    @Override public ToolCategory category() { return ToolCategory.TODO; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        List<TodoItem> todos = ctx.todos().list(ctx.projectId());
        if (todos.isEmpty()) {
            return ToolResult.success("No todos for this task");
        }
        StringBuilder sb = new StringBuilder();
        for (TodoItem todo : todos) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(checkbox(todo)).append(' ').append(todo.title())
                    .append(" (id: ").append(todo.id()).append(", ").append(todo.status().wireName()).append(')');
            if (todo.description() != null && !todo.description().isBlank()) {
                sb.append("\n    ").append(todo.description());
            }
        }
        return ToolResult.success(sb.toString());
    }

    private static String checkbox(TodoItem todo) {
        switch (todo.status()) {
            case COMPLETED:
                return "[x]";
            case IN_PROGRESS:
                return "[~]";
            default:
                return "[ ]";
        }
    }
}
