package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.persistence.project.RepositoryResult;
import io.github.drompincen.codeforge.protocol.api.FileChangeEvent;
import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

public class DeleteFileTool implements Tool {

    @Override public String name() { return "delete_file"; }
    @Override public String description() { return "Delete a file, or a folder and everything in it"; }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object()
                .string("path", "Path of the file or folder to delete", true)
                .build();
    }

    @Override public ToolCategory category() { return ToolCategory.FILE; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        String path = args.requireString("path");
        // folders have no content to report
        String before = ctx.projects().readFile(ctx.projectId(), path).orElse(null);
        RepositoryResult<Void> deleted = ctx.projects().deleteFile(ctx.projectId(), path);
        if (deleted.isFailure()) {
            return ToolResult.failure("Failed to delete file: " + deleted.error());
        }
        ctx.fileChanged(FileChangeEvent.deleted(path, before));
        return ToolResult.success("File deleted successfully: " + path);
    }
}
