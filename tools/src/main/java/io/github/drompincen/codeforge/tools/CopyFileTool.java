package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.persistence.project.RepositoryResult;
import io.github.drompincen.codeforge.protocol.api.FileChangeEvent;
import io.github.drompincen.codeforge.protocol.api.FileChangeType;
import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

public class CopyFileTool implements Tool {

    @Override public String name() { return "copy_file"; }
    @Override public String description() { return "Copy a file to a new location"; }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object()
                .string("source_path", "Path of the file to copy", true)
                .string("destination_path", "Path of the copy", true)
                .build();
    }

    @Override public ToolCategory category() { return ToolCategory.FILE; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        String source = args.requireString("source_path");
        String destination = args.requireString("destination_path");
        RepositoryResult<Void> copied = ctx.projects().copyFile(ctx.projectId(), source, destination);
        if (copied.isFailure()) {
            return ToolResult.failure("Failed to copy file: " + copied.error());
        }
        String content = ctx.projects().readFile(ctx.projectId(), destination).orElse(null);
        ctx.fileChanged(new FileChangeEvent(destination, FileChangeType.COPIED, null, content));
        return ToolResult.success("File copied from '" + source + "' to '" + destination + "'");
    }
}
