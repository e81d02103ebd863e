package io.github.drompincen.codeforge.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;

public interface Tool {

    String name();

    String description();

    /** JSON schema of the arguments object; validated once when the tool is registered. */
    JsonNode inputSchema();

    ToolCategory category();

    ToolResult execute(ToolContext ctx, ToolArguments args);
}
