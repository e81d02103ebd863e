package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.persistence.project.ProjectRepository;
import io.github.drompincen.codeforge.persistence.project.RepositoryResult;
import io.github.drompincen.codeforge.protocol.api.FileChangeEvent;
import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Creates a file or overwrites an existing one. Existence is checked with a read; a failed create
 * (the file appeared in between) falls back to an overwrite.
 */
public class WriteFileTool implements Tool {

    @Override public String name() { return "write_file"; }
    @Override public String description() {
        return "Write content to a file, creating it (and missing folders) if it does not exist";
    }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object()
                .string("path", "Path of the file, relative to the project root", true)
                .string("content", "Complete new content of the file", true)
                .build();
    }

    @Override public ToolCategory category() { return ToolCategory.FILE; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        String path = args.requireString("path");
        String content = args.requireString("content");
        ProjectRepository projects = ctx.projects();

        RepositoryResult<String> existing = projects.readFile(ctx.projectId(), path);
        if (existing.isSuccess()) {
            return overwrite(ctx, path, existing.value(), content);
        }
        RepositoryResult<Void> created = projects.createFile(ctx.projectId(), path, content);
        if (created.isSuccess()) {
            ctx.fileChanged(FileChangeEvent.created(path, content));
            return ToolResult.success("File created and written successfully: " + path);
        }
        return overwrite(ctx, path, null, content);
    }

    private ToolResult overwrite(ToolContext ctx, String path, String before, String content) {
        RepositoryResult<Void> written = ctx.projects().writeFile(ctx.projectId(), path, content);
        if (written.isFailure()) {
            return ToolResult.failure("Failed to write file: " + written.error());
        }
        ctx.fileChanged(FileChangeEvent.modified(path, before, content));
        return ToolResult.success("File updated successfully: " + path);
    }
}
