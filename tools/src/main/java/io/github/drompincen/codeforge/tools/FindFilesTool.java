package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.persistence.project.GlobPattern;
import io.github.drompincen.codeforge.persistence.project.RepositoryResult;
import io.github.drompincen.codeforge.protocol.api.FileTreeNode;
import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Finds files by glob. Patterns without {@code /} match file names, others match paths relative
 * to the search folder.
 */
public class FindFilesTool implements Tool {

    static final int MAX_RESULTS = 100;

    @Override public String name() { return "find_files"; }
    @Override public String description() {
        return "Find files whose name or path matches a glob pattern such as *.css or src/**/*.js";
    }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object()
                .string("pattern", "Glob pattern (e.g. *.html, **/*.js, components/*.jsx)", true)
                .string("path", "Folder to search in; the project root when omitted", false)
                .build();
    }

    @Override public ToolCategory category() { return ToolCategory.FILE; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        String pattern = args.requireString("pattern");
        String base = ProjectFiles.normalize(args.optionalString("path").orElse(""));
        RepositoryResult<List<FileTreeNode>> tree = ctx.projects().getFileTree(ctx.projectId());
        if (tree.isFailure()) {
            return ToolResult.failure("Failed to find files: " + tree.error());
        }
        List<FileTreeNode> nodes = tree.value();
        if (!base.isEmpty()) {
            Optional<FileTreeNode> folder = ProjectFiles.find(nodes, base);
            if (folder.isEmpty() || !folder.get().folder()) {
                return ToolResult.failure("Folder not found: " + base);
            }
            nodes = folder.get().children();
        }

        GlobPattern glob = GlobPattern.compile(pattern);
        List<String> matches = ProjectFiles.files(nodes).stream()
                .map(FileTreeNode::path)
                .filter(p -> glob.matches(ProjectFiles.relativeTo(base, p)))
                .toList();
        if (matches.isEmpty()) {
            return ToolResult.success("No files found matching: " + pattern);
        }
        StringBuilder sb = new StringBuilder("Found ").append(matches.size())
                .append(" file(s) matching '").append(pattern).append("':");
        matches.stream().limit(MAX_RESULTS).forEach(p -> sb.append('\n').append(p));
        if (matches.size() > MAX_RESULTS) {
            sb.append("\n... and ").append(matches.size() - MAX_RESULTS).append(" more");
        }
        return ToolResult.success(sb.toString());
    }
}
