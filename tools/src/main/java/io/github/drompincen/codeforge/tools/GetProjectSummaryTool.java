package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.persistence.project.RepositoryResult;
import io.github.drompincen.codeforge.protocol.api.FileTreeNode;
import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

public class GetProjectSummaryTool implements Tool {

    @Override public String name() { return "get_project_summary"; }
    @Override public String description() {
        return "Summarize the project: file and folder counts, total size, file types and top-level layout";
    }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object().build();
    }

    @Override public ToolCategory category() { return ToolCategory.FILE; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        RepositoryResult<List<FileTreeNode>> tree = ctx.projects().getFileTree(ctx.projectId());
        if (tree.isFailure()) {
            return ToolResult.failure("Failed to summarize project: " + tree.error());
        }
        List<FileTreeNode> nodes = tree.value();
        if (nodes.isEmpty()) {
            return ToolResult.success("Project is empty");
        }
        List<FileTreeNode> files = ProjectFiles.files(nodes);
        long totalSize = files.stream().mapToLong(FileTreeNode::size).sum();
        Map<String, Long> byType = files.stream()
                .collect(Collectors.groupingBy(f -> f.extension().isEmpty() ? "(none)" : f.extension(),
                        TreeMap::new, Collectors.counting()));

        StringBuilder sb = new StringBuilder("Project summary\n");
        sb.append("Files: ").append(files.size()).append('\n');
        sb.append("Folders: ").append(ProjectFiles.countFolders(nodes)).append('\n');
        sb.append("Total size: ").append(totalSize).append(" bytes\n");
        sb.append("File types: ").append(byType.entrySet().stream()
                .map(e -> e.getKey() + " (" + e.getValue() + ")")
                .collect(Collectors.joining(", "))).append('\n');
        sb.append("Top level:");
        for (FileTreeNode node : nodes) {
            sb.append('\n').append(node.folder()
                    ? ProjectFiles.FOLDER_ICON + " " + node.name() + "/"
                    : ProjectFiles.FILE_ICON + " " + node.name());
        }
        return ToolResult.success(sb.toString());
    }
}
