package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.persistence.project.RepositoryResult;
import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

public class ReadFileTool implements Tool {

    @Override public String name() { return "read_file"; }
    @Override public String description() { return "Read the contents of a file in the project"; }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object()
                .string("path", "Path of the file, relative to the project root", true)
                .build();
    }

    @Override public ToolCategory category() { return ToolCategory.FILE; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        String path = args.requireString("path");
        RepositoryResult<String> content = ctx.projects().readFile(ctx.projectId(), path);
        if (content.isFailure()) {
            return ToolResult.failure("Failed to read file: " + content.error());
        }
        return ToolResult.success(content.value());
    }
}
