package io.github.drompincen.codeforge.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<ChatMessage> messages,
        boolean stream,
        Double temperature,
        @JsonProperty("max_tokens") Integer maxTokens,
        List<ToolDefinition> tools,
        @JsonProperty("tool_choice") String toolChoice
) {
    public ChatRequest {
        messages = messages != null ? List.copyOf(messages) : List.of();
        tools = tools == null || tools.isEmpty() ? null : List.copyOf(tools);
        if (tools != null && toolChoice == null) {
            toolChoice = "auto";
        }
        if (tools == null) {
            toolChoice = null;
        }
    }

    public static ChatRequest of(String model, List<ChatMessage> messages, Double temperature,
                                 Integer maxTokens, List<ToolDefinition> tools) {
        return new ChatRequest(model, messages, true, temperature, maxTokens, tools, null);
    }

    public ChatRequest withStream(boolean stream) {
        return new ChatRequest(model, messages, stream, temperature, maxTokens, tools, toolChoice);
    }

    public ChatRequest withMessages(List<ChatMessage> messages) {
        return new ChatRequest(model, messages, stream, temperature, maxTokens, tools, toolChoice);
    }
}
