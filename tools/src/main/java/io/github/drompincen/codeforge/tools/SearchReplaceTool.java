package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.persistence.project.RepositoryResult;
import io.github.drompincen.codeforge.protocol.api.FileChangeEvent;
import io.github.drompincen.codeforge.protocol.api.FileChangeType;
import io.github.drompincen.codeforge.protocol.api.SearchReplaceResult;
import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

public class SearchReplaceTool implements Tool {

    @Override public String name() { return "search_replace"; }
    @Override public String description() { return "Search and replace text across files of the project"; }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object()
                .string("search", "Exact text to search for", true)
                .string("replace", "Replacement text", true)
                .string("file_pattern", "Optional glob to filter files (e.g. *.html, *.css)", false)
                .bool("dry_run", "Only report what would be replaced", false)
                .build();
    }

    @Override public ToolCategory category() { return ToolCategory.SEARCH; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        String search = args.requireString("search");
        String replace = args.requireString("replace");
        String filePattern = args.optionalNonBlank("file_pattern").orElse(null);
        boolean dryRun = args.optionalBoolean("dry_run", false);

        RepositoryResult<SearchReplaceResult> outcome =
                ctx.projects().searchAndReplace(ctx.projectId(), search, replace, filePattern, dryRun);
        if (outcome.isFailure()) {
            return ToolResult.failure("Search and replace failed: " + outcome.error());
        }
        SearchReplaceResult result = outcome.value();
        if (result.totalReplacements() == 0 && !result.isPartial()) {
            return ToolResult.success("No occurrences of '" + search + "' found");
        }

        StringBuilder sb = new StringBuilder(dryRun ? "Dry run: would replace " : "Replaced ")
                .append(result.totalReplacements()).append(" occurrence(s) in ")
                .append(result.filesModified()).append(" file(s):");
        for (SearchReplaceResult.FileReplacement file : result.files()) {
            sb.append("\n  ").append(file.path()).append(" (").append(file.count()).append(')');
            if (!dryRun) {
                ctx.fileChanged(new FileChangeEvent(file.path(), FileChangeType.MODIFIED, null, null));
            }
        }
        if (result.isPartial()) {
            sb.append("\nFailed to update ").append(result.failures().size()).append(" file(s):");
            for (SearchReplaceResult.FileFailure failure : result.failures()) {
                sb.append("\n  ").append(failure.path()).append(": ").append(failure.reason());
            }
            return ToolResult.failure("Search and replace was incomplete. " + sb);
        }
        return ToolResult.success(sb.toString());
    }
}
