package io.github.drompincen.codeforge.runtime.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.codeforge.protocol.api.StreamChunk;
import io.github.drompincen.codeforge.protocol.api.ToolCallDelta;
import io.github.drompincen.codeforge.protocol.event.ErrorCategory;
import io.github.drompincen.codeforge.protocol.event.StreamEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes the lines of one server-sent-event chat completion stream into {@link StreamEvent}s.
 * Malformed payloads are logged and skipped. After {@code data: [DONE]} or an in-stream error
 * the decoder is terminated and ignores further input.
 * <p>
 * One instance per stream; not thread-safe.
 */
public class StreamEventDecoder {

    private static final Logger log = LoggerFactory.getLogger(StreamEventDecoder.class);

    static final String DATA_PREFIX = "data:";
    static final String DONE = "[DONE]";
    public static final String REASONING_OPEN = "<reasoning>";
    public static final String REASONING_CLOSE = "</reasoning>";

    private final ObjectMapper objectMapper;
    private final ProviderErrorMapper errorMapper;
    private final ToolCallAccumulator accumulator = new ToolCallAccumulator();
    private boolean terminated;
    private boolean inReasoning;

    public StreamEventDecoder(ObjectMapper objectMapper, ProviderErrorMapper errorMapper) {
        this.objectMapper = objectMapper;
        this.errorMapper = errorMapper;
    }

    public List<StreamEvent> decode(String line) {
        if (terminated || line == null) {
            return List.of();
        }
        String trimmed = line.strip();
        if (!trimmed.startsWith(DATA_PREFIX)) {
            // blank separators and ": keep-alive" comments
            return List.of();
        }
        String payload = trimmed.substring(DATA_PREFIX.length()).strip();
        if (payload.isEmpty()) {
            return List.of();
        }
        if (DONE.equals(payload)) {
            return finish();
        }

        JsonNode node;
        StreamChunk chunk;
        try {
            node = objectMapper.readTree(payload);
            if (node.hasNonNull("error")) {
                return fail(node.get("error"));
            }
            chunk = objectMapper.treeToValue(node, StreamChunk.class);
        } catch (JsonProcessingException e) {
            log.warn("Skipping malformed stream chunk: {}", e.getOriginalMessage());
            return List.of();
        }
        if (chunk == null) {
            log.warn("Skipping empty stream chunk: {}", payload);
            return List.of();
        }
        return decodeChunk(chunk);
    }

    /** Handles stream termination: closes open reasoning, flushes open tool calls, then completes. */
    public List<StreamEvent> finish() {
        if (terminated) {
            return List.of();
        }
        terminated = true;
        List<StreamEvent> events = new ArrayList<>();
        closeReasoning(events, "");
        if (accumulator.hasOpenSlots()) {
            events.add(new StreamEvent.ToolCalls(accumulator.finalizeOpenSlots()));
        }
        events.add(StreamEvent.completed());
        return events;
    }

    public boolean isTerminated() {
        return terminated;
    }

    private List<StreamEvent> decodeChunk(StreamChunk chunk) {
        StreamChunk.ChunkChoice choice = chunk.firstChoice();
        if (choice == null) {
            return List.of();
        }
        List<StreamEvent> events = new ArrayList<>();
        StreamChunk.Delta delta = choice.delta();
        if (delta != null) {
            String reasoning = delta.reasoningContent();
            if (reasoning != null && !reasoning.isEmpty()) {
                events.add(new StreamEvent.ContentDelta(inReasoning ? reasoning : REASONING_OPEN + reasoning));
                inReasoning = true;
            }
            String content = delta.content();
            if (content != null && !content.isEmpty()) {
                if (inReasoning) {
                    closeReasoning(events, "\n\n" + content);
                } else {
                    events.add(new StreamEvent.ContentDelta(content));
                }
            }
            if (delta.toolCalls() != null) {
                for (ToolCallDelta toolCall : delta.toolCalls()) {
                    if (toolCall == null) {
                        log.warn("Skipping null tool call fragment");
                        continue;
                    }
                    accumulator.accept(toolCall);
                }
            }
        }
        String finishReason = choice.finishReason();
        if (finishReason != null && !finishReason.isEmpty()) {
            closeReasoning(events, "");
            events.add(new StreamEvent.FinishReason(finishReason));
            if ("tool_calls".equals(finishReason) && accumulator.hasOpenSlots()) {
                events.add(new StreamEvent.ToolCalls(accumulator.finalizeOpenSlots()));
            }
        }
        return events;
    }

    private void closeReasoning(List<StreamEvent> events, String suffix) {
        if (inReasoning) {
            inReasoning = false;
            events.add(new StreamEvent.ContentDelta(REASONING_CLOSE + suffix));
        }
    }

    private List<StreamEvent> fail(JsonNode error) {
        terminated = true;
        String message = error.path("message").asText("");
        StreamEvent.Error mapped = message.isBlank()
                ? new StreamEvent.Error("Stream failed", ErrorCategory.PROVIDER_ERROR)
                : errorMapper.fromProviderMessage(message);
        log.warn("Provider reported an error mid-stream: {}", message);
        return List.of(mapped);
    }
}
