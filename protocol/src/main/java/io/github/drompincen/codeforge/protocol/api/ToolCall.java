package io.github.drompincen.codeforge.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Wire form of a complete tool call, as sent back in an assistant message
 * and as returned by a non-streaming completion.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolCall(String id, String type, FunctionCall function) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FunctionCall(String name, String arguments) {}

    public ToolCallResponse toResponse() {
        return new ToolCallResponse(id,
                function != null ? function.name() : null,
                function != null ? function.arguments() : null);
    }
}
