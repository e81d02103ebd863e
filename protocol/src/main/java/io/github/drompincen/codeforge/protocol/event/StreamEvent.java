package io.github.drompincen.codeforge.protocol.event;

import io.github.drompincen.codeforge.protocol.api.ToolCallResponse;

import java.util.List;

/**
 * Discrete event decoded from a streaming chat completion.
 * {@link Completed} and {@link Error} are terminal; a stream that ends without either was cancelled.
 */
public interface StreamEvent {

    default boolean isTerminal() {
        return false;
    }

    record Started() implements StreamEvent {}

    record ContentDelta(String text) implements StreamEvent {}

    record ToolCalls(List<ToolCallResponse> calls) implements StreamEvent {
        public ToolCalls {
            calls = List.copyOf(calls);
        }
    }

    record FinishReason(String reason) implements StreamEvent {}

    record Error(String message, ErrorCategory category) implements StreamEvent {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    record Completed() implements StreamEvent {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    static StreamEvent started() {
        return new Started();
    }

    static StreamEvent completed() {
        return new Completed();
    }
}
