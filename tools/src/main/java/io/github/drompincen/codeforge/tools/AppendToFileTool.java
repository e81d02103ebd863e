package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.persistence.project.RepositoryResult;
import io.github.drompincen.codeforge.protocol.api.FileChangeEvent;
import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

public class AppendToFileTool implements Tool {

    @Override public String name() { return "append_to_file"; }
    @Override public String description() {
        return "Append content to the end of a file, creating the file if it does not exist";
    }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object()
                .string("path", "Path of the file", true)
                .string("content", "Content to append", true)
                .build();
    }

    @Override public ToolCategory category() { return ToolCategory.FILE; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        String path = args.requireString("path");
        String content = args.requireString("content");

        RepositoryResult<String> current = ctx.projects().readFile(ctx.projectId(), path);
        if (current.isFailure()) {
            RepositoryResult<Void> created = ctx.projects().createFile(ctx.projectId(), path, content);
            if (created.isFailure()) {
                return ToolResult.failure("Failed to append to file: " + created.error());
            }
            ctx.fileChanged(FileChangeEvent.created(path, content));
            return ToolResult.success("File created with content: " + path);
        }

        String before = current.value();
        String separator = before.isEmpty() || before.endsWith("\n") ? "" : "\n";
        String after = before + separator + content;
        RepositoryResult<Void> written = ctx.projects().writeFile(ctx.projectId(), path, after);
        if (written.isFailure()) {
            return ToolResult.failure("Failed to append to file: " + written.error());
        }
        ctx.fileChanged(FileChangeEvent.modified(path, before, after));
        return ToolResult.success("Content appended to " + path);
    }
}
