package io.github.drompincen.codeforge.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

public record ToolDefinition(String type, FunctionDefinition function) {

    public record FunctionDefinition(String name, String description, JsonNode parameters) {}

    public static ToolDefinition function(String name, String description, JsonNode parameters) {
        return new ToolDefinition("function", new FunctionDefinition(name, description, parameters));
    }
}
