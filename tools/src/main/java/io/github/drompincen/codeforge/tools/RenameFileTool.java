package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.persistence.project.RepositoryResult;
import io.github.drompincen.codeforge.protocol.api.FileChangeEvent;
import io.github.drompincen.codeforge.protocol.api.FileChangeType;
import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

public class RenameFileTool implements Tool {

    @Override public String name() { return "rename_file"; }
    @Override public String description() { return "Rename a file or folder within its current folder"; }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object()
                .string("old_path", "Current path of the file", true)
                .string("new_path", "New path of the file", true)
                .build();
    }

    @Override public ToolCategory category() { return ToolCategory.FILE; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        String oldPath = args.requireString("old_path");
        String newPath = args.requireString("new_path");
        String content = ctx.projects().readFile(ctx.projectId(), oldPath).orElse(null);
        RepositoryResult<Void> renamed = ctx.projects().renameFile(ctx.projectId(), oldPath, newPath);
        if (renamed.isFailure()) {
            return ToolResult.failure("Failed to rename file: " + renamed.error());
        }
        ctx.fileChanged(new FileChangeEvent(newPath, FileChangeType.RENAMED, content, content));
        return ToolResult.success("File renamed from '" + oldPath + "' to '" + newPath + "'");
    }
}
