package io.github.drompincen.codeforge.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatMessage(
        String role,
        String content,
        @JsonProperty("tool_calls") List<ToolCall> toolCalls,
        @JsonProperty("tool_call_id") String toolCallId,
        String name
) {
    public static final String SYSTEM = "system";
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";
    public static final String TOOL = "tool";

    public static ChatMessage system(String content) {
        return new ChatMessage(SYSTEM, content, null, null, null);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(USER, content, null, null, null);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(ASSISTANT, content, null, null, null);
    }

    public static ChatMessage assistant(String content, List<ToolCallResponse> calls) {
        List<ToolCall> wire = calls.stream().map(ToolCallResponse::toWire).toList();
        return new ChatMessage(ASSISTANT, content == null || content.isEmpty() ? null : content,
                wire.isEmpty() ? null : wire, null, null);
    }

    public static ChatMessage toolResult(String toolCallId, String name, String content) {
        return new ChatMessage(TOOL, content, null, toolCallId, name);
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
