package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.persistence.project.RepositoryResult;
import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

public class CreateFolderTool implements Tool {

    @Override public String name() { return "create_folder"; }
    @Override public String description() { return "Create a folder, including missing parent folders"; }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object()
                .string("path", "Path of the folder to create", true)
                .build();
    }

    @Override public ToolCategory category() { return ToolCategory.FILE; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        String path = args.requireString("path");
        RepositoryResult<Void> created = ctx.projects().createFolder(ctx.projectId(), path);
        if (created.isFailure()) {
            return ToolResult.failure("Failed to create folder: " + created.error());
        }
        return ToolResult.success("Folder created successfully: " + path);
    }
}
