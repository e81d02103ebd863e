package io.github.drompincen.codeforge.runtime.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.codeforge.protocol.api.ToolCallResponse;
import io.github.drompincen.codeforge.protocol.event.ErrorCategory;
import io.github.drompincen.codeforge.protocol.event.StreamEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StreamEventDecoderTest {

    private StreamEventDecoder decoder;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper();
        decoder = new StreamEventDecoder(mapper, new ProviderErrorMapper(mapper));
    }

    @Test
    void contentDeltasThenCompletedOnDone() {
        List<StreamEvent> events = decodeAll(
                "data: {\"choices\":[{\"delta\":{\"role\":\"assistant\",\"content\":\"Hel\"}}]}",
                "",
                "data: {\"choices\":[{\"delta\":{\"content\":\"lo\"}}]}",
                "data: {\"choices\":[{\"delta\":{},\"finish_reason\":\"stop\"}]}",
                "data: [DONE]");

        assertThat(events).containsExactly(
                new StreamEvent.ContentDelta("Hel"),
                new StreamEvent.ContentDelta("lo"),
                new StreamEvent.FinishReason("stop"),
                new StreamEvent.Completed());
        assertThat(decoder.isTerminated()).isTrue();
    }

    @Test
    void commentsAndNonDataLinesAreIgnored() {
        assertThat(decodeAll(": OPENROUTER PROCESSING", "event: ping", "data:", "   ")).isEmpty();
    }

    @Test
    void malformedChunkIsSkippedAndStreamContinues() {
        List<StreamEvent> events = decodeAll(
                "data: {not json",
                "data: {\"choices\":[{\"delta\":{\"content\":\"ok\"}}]}");

        assertThat(events).containsExactly(new StreamEvent.ContentDelta("ok"));
        assertThat(decoder.isTerminated()).isFalse();
    }

    @Test
    void nullChunkIsSkippedAndStreamContinues() {
        List<StreamEvent> events = decodeAll(
                "data: null",
                "data: {\"choices\":[{\"delta\":{\"content\":\"ok\"}}]}");

        assertThat(events).containsExactly(new StreamEvent.ContentDelta("ok"));
        assertThat(decoder.isTerminated()).isFalse();
    }

    @Test
    void nullToolCallFragmentsAreSkipped() {
        List<StreamEvent> events = decodeAll(
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":[null]}}]}",
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":[null,{\"index\":0,\"id\":\"call_1\","
                        + "\"function\":{\"name\":\"list_todos\",\"arguments\":\"{}\"}}]}}]}",
                "data: [DONE]");

        assertThat(events).containsExactly(
                new StreamEvent.ToolCalls(List.of(new ToolCallResponse("call_1", "list_todos", "{}"))),
                new StreamEvent.Completed());
    }

    @Test
    void toolCallsAreEmittedAfterToolCallsFinishReason() {
        List<StreamEvent> events = decodeAll(
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"id\":\"call_1\",\"type\":\"function\","
                        + "\"function\":{\"name\":\"read_file\",\"arguments\":\"\"}}]}}]}",
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"function\":{\"arguments\":\"{\\\"path\\\":\"}}]}}]}",
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"function\":{\"arguments\":\"\\\"a.txt\\\"}\"}}]}}]}",
                "data: {\"choices\":[{\"delta\":{},\"finish_reason\":\"tool_calls\"}]}",
                "data: [DONE]");

        assertThat(events).containsExactly(
                new StreamEvent.FinishReason("tool_calls"),
                new StreamEvent.ToolCalls(List.of(new ToolCallResponse("call_1", "read_file", "{\"path\":\"a.txt\"}"))),
                new StreamEvent.Completed());
    }

    @Test
    void openToolCallsAreFlushedBeforeCompletedOnDone() {
        List<StreamEvent> events = decodeAll(
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"id\":\"call_1\","
                        + "\"function\":{\"name\":\"list_todos\",\"arguments\":\"{}\"}}]}}]}",
                "data: [DONE]");

        assertThat(events).containsExactly(
                new StreamEvent.ToolCalls(List.of(new ToolCallResponse("call_1", "list_todos", "{}"))),
                new StreamEvent.Completed());
    }

    @Test
    void reasoningContentIsWrappedInReasoningTags() {
        List<StreamEvent> events = decodeAll(
                "data: {\"choices\":[{\"delta\":{\"reasoning_content\":\"Let me \"}}]}",
                "data: {\"choices\":[{\"delta\":{\"reasoning_content\":\"think\"}}]}",
                "data: {\"choices\":[{\"delta\":{\"content\":\"Answer\"}}]}");

        assertThat(text(events)).isEqualTo("<reasoning>Let me think</reasoning>\n\nAnswer");
    }

    @Test
    void unterminatedReasoningIsClosedOnDone() {
        List<StreamEvent> events = decodeAll(
                "data: {\"choices\":[{\"delta\":{\"reasoning_content\":\"hmm\"}}]}",
                "data: [DONE]");

        assertThat(text(events)).isEqualTo("<reasoning>hmm</reasoning>");
        assertThat(events).last().isEqualTo(new StreamEvent.Completed());
    }

    @Test
    void inStreamErrorTerminatesTheDecoder() {
        List<StreamEvent> events = decodeAll(
                "data: {\"choices\":[{\"delta\":{\"content\":\"partial\"}}]}",
                "data: {\"error\":{\"message\":\"The model `foo` does not exist\",\"code\":404}}",
                "data: {\"choices\":[{\"delta\":{\"content\":\"ignored\"}}]}",
                "data: [DONE]");

        assertThat(events).containsExactly(
                new StreamEvent.ContentDelta("partial"),
                new StreamEvent.Error(ProviderErrorMapper.MODEL_NOT_FOUND, ErrorCategory.MODEL_NOT_FOUND));
        assertThat(decoder.isTerminated()).isTrue();
    }

    @Test
    void finishIsIdempotent() {
        assertThat(decoder.finish()).containsExactly(new StreamEvent.Completed());
        assertThat(decoder.finish()).isEmpty();
    }

    @Test
    void chunkWithoutChoicesIsIgnored() {
        assertThat(decodeAll("data: {\"id\":\"gen-1\",\"choices\":[]}")).isEmpty();
    }

    private List<StreamEvent> decodeAll(String... lines) {
        List<StreamEvent> events = new ArrayList<>();
        for (String line : lines) {
            events.addAll(decoder.decode(line));
        }
        return events;
    }

    private static String text(List<StreamEvent> events) {
        StringBuilder sb = new StringBuilder();
        for (StreamEvent event : events) {
            if (event instanceof StreamEvent.ContentDelta delta) {
                sb.append(delta.text());
            }
        }
        return sb.toString();
    }
}
