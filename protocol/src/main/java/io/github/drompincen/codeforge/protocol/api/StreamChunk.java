package io.github.drompincen.codeforge.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One {@code data:} payload of a streaming chat completion.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StreamChunk(String id, String model, List<ChunkChoice> choices) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChunkChoice(
            Integer index,
            Delta delta,
            @JsonProperty("finish_reason") String finishReason
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Delta(
            String role,
            String content,
            @JsonProperty("reasoning_content") String reasoningContent,
            @JsonProperty("tool_calls") List<ToolCallDelta> toolCalls
    ) {}

    public ChunkChoice firstChoice() {
        if (choices == null || choices.isEmpty()) {
            return null;
        }
        return choices.get(0);
    }
}
