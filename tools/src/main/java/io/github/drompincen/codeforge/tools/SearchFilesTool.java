package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.persistence.project.GlobPattern;
import io.github.drompincen.codeforge.persistence.project.RepositoryResult;
import io.github.drompincen.codeforge.protocol.api.FileTreeNode;
import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Case-insensitive line search over the project. Unreadable files are skipped.
 */
public class SearchFilesTool implements Tool {

    private static final Logger log = LoggerFactory.getLogger(SearchFilesTool.class);

    @Override public String name() { return "search_files"; }
    @Override public String description() { return "Search for text across the files of the project"; }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object()
                .string("query", "Text to search for, case-insensitive", true)
                .string("file_pattern", "Optional glob to filter files (e.g. *.html, *.css)", false)
                .build();
    }

    @Override public ToolCategory category() { return ToolCategory.SEARCH; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        String query = args.requireString("query");
        GlobPattern glob = args.optionalNonBlank("file_pattern").map(GlobPattern::compile).orElse(null);
        RepositoryResult<List<FileTreeNode>> tree = ctx.projects().getFileTree(ctx.projectId());
        if (tree.isFailure()) {
            return ToolResult.failure("Search failed: " + tree.error());
        }

        String needle = query.toLowerCase(Locale.ROOT);
        StringBuilder results = new StringBuilder();
        for (FileTreeNode file : ProjectFiles.files(tree.value())) {
            if (glob != null && !glob.matches(file.path())) {
                continue;
            }
            RepositoryResult<String> content = ctx.projects().readFile(ctx.projectId(), file.path());
            if (content.isFailure()) {
                log.debug("Skipping {} during search: {}", file.path(), content.error());
                continue;
            }
            List<String> lines = ProjectFiles.lines(content.value());
            for (int i = 0; i < lines.size(); i++) {
                if (lines.get(i).toLowerCase(Locale.ROOT).contains(needle)) {
                    if (results.length() > 0) {
                        results.append('\n');
                    }
                    results.append(file.path()).append(':').append(i + 1).append(": ").append(lines.get(i).trim());
                }
            }
        }
        if (results.length() == 0) {
            return ToolResult.success("No matches found for: " + query);
        }
        return ToolResult.success(results.toString());
    }
}
