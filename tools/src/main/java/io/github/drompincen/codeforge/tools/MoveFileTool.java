package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.persistence.project.RepositoryResult;
import io.github.drompincen.codeforge.protocol.api.FileChangeEvent;
import io.github.drompincen.codeforge.protocol.api.FileChangeType;
import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

public class MoveFileTool implements Tool {

    @Override public String name() { return "move_file"; }
    @Override public String description() {
        return "Move a file to another location, creating missing destination folders";
    }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object()
                .string("source_path", "Current path of the file", true)
                .string("destination_path", "New path of the file", true)
                .build();
    }

    @Override public ToolCategory category() { return ToolCategory.FILE; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        String source = args.requireString("source_path");
        String destination = args.requireString("destination_path");
        String content = ctx.projects().readFile(ctx.projectId(), source).orElse(null);
        RepositoryResult<Void> moved = ctx.projects().moveFile(ctx.projectId(), source, destination);
        if (moved.isFailure()) {
            return ToolResult.failure("Failed to move file: " + moved.error());
        }
        ctx.fileChanged(new FileChangeEvent(destination, FileChangeType.MOVED, content, content));
        return ToolResult.success("File moved from '" + source + "' to '" + destination + "'");
    }
}
