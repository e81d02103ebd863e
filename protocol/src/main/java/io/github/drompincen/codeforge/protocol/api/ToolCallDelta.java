package io.github.drompincen.codeforge.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Streaming fragment of a tool call. Fragments sharing {@code index} belong to the same call.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolCallDelta(Integer index, String id, String type, FunctionDelta function) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FunctionDelta(String name, String arguments) {}

    public static ToolCallDelta of(int index, String id, String name, String argumentsFragment) {
        return new ToolCallDelta(index, id, "function", new FunctionDelta(name, argumentsFragment));
    }

    public int slot() {
        return index != null ? index : 0;
    }

    public String functionName() {
        return function != null ? function.name() : null;
    }

    public String argumentsFragment() {
        return function != null ? function.arguments() : null;
    }
}
