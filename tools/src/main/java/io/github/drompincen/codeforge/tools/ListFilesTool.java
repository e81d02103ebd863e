package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.persistence.project.RepositoryResult;
import io.github.drompincen.codeforge.protocol.api.FileTreeNode;
import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

public class ListFilesTool implements Tool {

    @Override public String name() { return "list_files"; }
    @Override public String description() {
        return "List the files and folders of the project as a tree, optionally below a folder";
    }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object()
                .string("path", "Folder to list; the project root when omitted", false)
                .build();
    }

    @Override public ToolCategory category() { return ToolCategory.FILE; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        String folder = ProjectFiles.normalize(args.optionalString("path").orElse(""));
        RepositoryResult<List<FileTreeNode>> tree = ctx.projects().getFileTree(ctx.projectId());
        if (tree.isFailure()) {
            return ToolResult.failure("Failed to list files: " + tree.error());
        }
        List<FileTreeNode> nodes = tree.value();
        if (!folder.isEmpty()) {
            Optional<FileTreeNode> node = ProjectFiles.find(nodes, folder);
            if (node.isEmpty() || !node.get().folder()) {
                return ToolResult.failure("Failed to list files: Folder not found: " + folder);
            }
            nodes = node.get().children();
        }
        String output = ProjectFiles.render(nodes);
        return ToolResult.success(output.isEmpty() ? "Directory is empty" : output);
    }
}
