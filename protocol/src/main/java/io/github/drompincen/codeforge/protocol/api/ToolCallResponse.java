package io.github.drompincen.codeforge.protocol.api;

/**
 * A finalized tool invocation. {@code arguments} is expected to hold a complete
 * JSON object but is not validated until execution.
 */
public record ToolCallResponse(String id, String name, String arguments) {

    public ToolCall toWire() {
        return new ToolCall(id, "function",
                new ToolCall.FunctionCall(name, arguments != null ? arguments : "{}"));
    }
}
