package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.persistence.project.RepositoryResult;
import io.github.drompincen.codeforge.protocol.api.FileChangeEvent;
import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Inserts content before a 1-based line. {@code line_number} one past the last line appends.
 */
public class InsertAtLineTool implements Tool {

    @Override public String name() { return "insert_at_line"; }
    @Override public String description() {
        return "Insert content before the given line of a file (1-based); use one past the last line to append";
    }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object()
                .string("path", "Path of the file", true)
                .integer("line_number", "Line to insert before, starting at 1", true)
                .string("content", "Content to insert; may span several lines", true)
                .build();
    }

    @Override public ToolCategory category() { return ToolCategory.FILE; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        String path = args.requireString("path");
        int lineNumber = args.requireInt("line_number");
        String content = args.requireString("content");

        RepositoryResult<String> current = ctx.projects().readFile(ctx.projectId(), path);
        if (current.isFailure()) {
            return ToolResult.failure("Failed to insert content: " + current.error());
        }
        String before = current.value();
        List<String> lines = new ArrayList<>(ProjectFiles.lines(before));
        if (lineNumber < 1 || lineNumber > lines.size() + 1) {
            return ToolResult.failure("Line number out of range: " + lineNumber
                    + " (file has " + lines.size() + " lines)");
        }
        List<String> inserted = ProjectFiles.lines(content);
        if (inserted.isEmpty()) {
            inserted = List.of("");
        }
        lines.addAll(lineNumber - 1, inserted);
        String after = String.join("\n", lines) + (before.endsWith("\n") || before.isEmpty() ? "\n" : "");

        RepositoryResult<Void> written = ctx.projects().writeFile(ctx.projectId(), path, after);
        if (written.isFailure()) {
            return ToolResult.failure("Failed to insert content: " + written.error());
        }
        ctx.fileChanged(FileChangeEvent.modified(path, before, after));
        return ToolResult.success("Inserted " + inserted.size() + " line(s) at line " + lineNumber + " in " + path);
    }
}
