package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.protocol.api.TodoItem;
import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

public class CreateTodoTool implements Tool {

    @Override public String name() { return "create_todo"; }
    @Override public String description() { return "Create a todo item to track a step of the current task"; }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object()
                .string("title", "Short title of the todo", true)
                .string("description", "What needs to be done", false)
                .build();
    }

    @Override public ToolCategory category() { return ToolCategory.TODO; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        String title = args.requireString("title");
        String description = args.optionalString("description").orElse("");
        TodoItem todo = ctx.todos().create(ctx.projectId(), title, description);
        ctx.callback().onTodoCreated(todo);
        return ToolResult.success("Created todo: " + todo.title() + " (id: " + todo.id() + ")");
    }
}
