package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.persistence.project.RepositoryResult;
import io.github.drompincen.codeforge.runtime.diff.LineDiff;
import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

public class DiffFilesTool implements Tool {

    @Override public String name() { return "diff_files"; }
    @Override public String description() {
        return "Compare two files line by line and list the lines that differ";
    }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object()
                .string("path1", "Path of the first file", true)
                .string("path2", "Path of the second file", true)
                .build();
    }

    @Override public ToolCategory category() { return ToolCategory.FILE; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        String path1 = args.requireString("path1");
        String path2 = args.requireString("path2");
        RepositoryResult<String> first = ctx.projects().readFile(ctx.projectId(), path1);
        if (first.isFailure()) {
            return ToolResult.failure("File not found: " + path1);
        }
        RepositoryResult<String> second = ctx.projects().readFile(ctx.projectId(), path2);
        if (second.isFailure()) {
            return ToolResult.failure("File not found: " + path2);
        }

        LineDiff.Result diff = LineDiff.compare(first.value(), second.value());
        if (diff.total() == 0) {
            return ToolResult.success("Files are identical: " + path1 + " and " + path2);
        }
        StringBuilder sb = new StringBuilder("Comparing ").append(path1).append(" and ").append(path2)
                .append(": ").append(diff.total()).append(" difference(s)");
        for (LineDiff.Difference d : diff.differences()) {
            sb.append("\nLine ").append(d.line()).append(':');
            if (d.before() != null) {
                sb.append("\n- ").append(d.before());
            }
            if (d.after() != null) {
                sb.append("\n+ ").append(d.after());
            }
        }
        if (diff.truncated()) {
            sb.append("\n... and ").append(diff.total() - diff.differences().size()).append(" more difference(s)");
        }
        return ToolResult.success(sb.toString());
    }
}
