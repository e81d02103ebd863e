package io.github.drompincen.codeforge.runtime.agent;

import io.github.drompincen.codeforge.protocol.api.ChatMessage;
import io.github.drompincen.codeforge.protocol.event.StreamEvent;

import java.util.List;

public record AgentRunResult(
        Status status,
        String transcript,
        List<ChatMessage> messages,
        String summary,
        StreamEvent.Error error,
        int iterations
) {
    public enum Status {
        /** The model answered without requesting tools. */
        COMPLETED,
        /** The model called {@code finish_task}. */
        FINISHED,
        CANCELLED,
        FAILED,
        MAX_ITERATIONS,
        /** Another run holds the project lock. */
        BUSY
    }

    public AgentRunResult {
        messages = messages != null ? List.copyOf(messages) : List.of();
    }

    static AgentRunResult busy() {
        return new AgentRunResult(Status.BUSY, "", List.of(), null, null, 0);
    }
}
