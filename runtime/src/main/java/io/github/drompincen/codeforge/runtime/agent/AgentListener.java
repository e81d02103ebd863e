package io.github.drompincen.codeforge.runtime.agent;

import io.github.drompincen.codeforge.protocol.api.ToolCallResponse;
import io.github.drompincen.codeforge.protocol.content.ContentBlock;
import io.github.drompincen.codeforge.protocol.event.StreamEvent;
import io.github.drompincen.codeforge.runtime.tools.ToolResult;

import java.util.List;

/**
 * Progress of an agent run, for live rendering. Called from the run's worker threads.
 */
public interface AgentListener {

    AgentListener NONE = new AgentListener() {};

    /** The transcript changed; {@code blocks} is its current segmentation. */
    default void onContent(String transcript, List<ContentBlock> blocks) {}

    default void onToolStarted(ToolCallResponse call) {}

    default void onToolFinished(ToolCallResponse call, ToolResult result) {}

    default void onError(StreamEvent.Error error) {}

    default void onComplete(AgentRunResult result) {}
}
