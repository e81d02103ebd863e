package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.persistence.project.RepositoryResult;
import io.github.drompincen.codeforge.protocol.api.FileChangeEvent;
import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Exact-match replacement inside one file. Every occurrence of {@code old_content} is replaced.
 */
public class PatchFileTool implements Tool {

    @Override public String name() { return "patch_file"; }
    @Override public String description() {
        return "Replace an exact piece of a file's content with new content; prefer this over rewriting whole files";
    }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object()
                .string("path", "Path of the file to patch", true)
                .string("old_content", "Exact content to find", true)
                .string("new_content", "Content to put in its place", true)
                .build();
    }

    @Override public ToolCategory category() { return ToolCategory.SEARCH; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        String path = args.requireString("path");
        String oldContent = args.requireString("old_content");
        String newContent = args.requireString("new_content");

        RepositoryResult<String> before = ctx.projects().readFile(ctx.projectId(), path);
        if (before.isFailure()) {
            return ToolResult.failure("Failed to patch file: " + before.error());
        }
        RepositoryResult<Void> patched = ctx.projects().patchFile(ctx.projectId(), path, oldContent, newContent);
        if (patched.isFailure()) {
            return ToolResult.failure("Failed to patch file: " + patched.error());
        }
        String after = ctx.projects().readFile(ctx.projectId(), path)
                .orElse(before.value().replace(oldContent, newContent));
        ctx.fileChanged(FileChangeEvent.modified(path, before.value(), after));
        return ToolResult.success("File patched successfully: " + path);
    }
}
