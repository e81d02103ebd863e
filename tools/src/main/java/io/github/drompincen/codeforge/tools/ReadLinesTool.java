package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.persistence.project.RepositoryResult;
import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public class ReadLinesTool implements Tool {

    @Override public String name() { return "read_lines"; }
    @Override public String description() {
        return "Read a range of lines from a file (1-based, inclusive), prefixed with line numbers";
    }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object()
                .string("path", "Path of the file", true)
                .integer("start_line", "First line to read, starting at 1", true)
                .integer("end_line", "Last line to read, inclusive", true)
                .build();
    }

    @Override public ToolCategory category() { return ToolCategory.FILE; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        String path = args.requireString("path");
        int start = args.requireInt("start_line");
        int end = args.requireInt("end_line");

        RepositoryResult<String> content = ctx.projects().readFile(ctx.projectId(), path);
        if (content.isFailure()) {
            return ToolResult.failure("Failed to read file: " + content.error());
        }
        List<String> lines = ProjectFiles.lines(content.value());
        if (start < 1 || end < start || start > lines.size()) {
            return ToolResult.failure("Invalid line range: " + start + "-" + end
                    + " (file has " + lines.size() + " lines)");
        }
        int last = Math.min(end, lines.size());
        int width = String.valueOf(last).length();
        StringBuilder sb = new StringBuilder();
        for (int i = start; i <= last; i++) {
            if (i > start) {
                sb.append('\n');
            }
            sb.append(String.format("%" + width + "d: %s", i, lines.get(i - 1)));
        }
        return ToolResult.success(sb.toString());
    }
}
