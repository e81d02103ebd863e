package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.persistence.project.RepositoryResult;
import io.github.drompincen.codeforge.protocol.api.FileTreeNode;
import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

public class GetFileInfoTool implements Tool {

    @Override public String name() { return "get_file_info"; }
    @Override public String description() {
        return "Show metadata of a file or folder: type, size, extension and line count";
    }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object()
                .string("path", "Path of the file or folder", true)
                .build();
    }

    @Override public ToolCategory category() { return ToolCategory.FILE; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        String path = ProjectFiles.normalize(args.requireString("path"));
        RepositoryResult<List<FileTreeNode>> tree = ctx.projects().getFileTree(ctx.projectId());
        if (tree.isFailure()) {
            return ToolResult.failure("Failed to get file info: " + tree.error());
        }
        Optional<FileTreeNode> found = ProjectFiles.find(tree.value(), path);
        if (found.isEmpty()) {
            return ToolResult.failure("File not found: " + path);
        }
        FileTreeNode node = found.get();
        StringBuilder sb = new StringBuilder();
        sb.append("Path: ").append(node.path()).append('\n');
        if (node.folder()) {
            sb.append("Type: folder\n");
            sb.append("Items: ").append(node.children().size()).append('\n');
            sb.append("Files: ").append(ProjectFiles.files(node.children()).size());
            return ToolResult.success(sb.toString());
        }
        sb.append("Type: file\n");
        sb.append("Size: ").append(node.size()).append(" bytes\n");
        sb.append("Extension: ").append(node.extension().isEmpty() ? "(none)" : node.extension());
        RepositoryResult<String> content = ctx.projects().readFile(ctx.projectId(), path);
        if (content.isSuccess()) {
            sb.append("\nLines: ").append(ProjectFiles.lines(content.value()).size());
        }
        return ToolResult.success(sb.toString());
    }
}
