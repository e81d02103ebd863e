package io.github.drompincen.codeforge.runtime.tools;

import io.github.drompincen.codeforge.protocol.api.FileChangeEvent;
import io.github.drompincen.codeforge.protocol.api.TodoItem;

import java.util.List;
import java.util.Optional;

/**
 * Hooks into the presentation layer. All methods are optional.
 */
public interface ToolInteractionCallback {

    ToolInteractionCallback NONE = new ToolInteractionCallback() {};

    /**
     * Blocks until the user answers. An empty result means no answer is available.
     */
    default Optional<String> askUser(String question, List<String> options) {
        return Optional.empty();
    }

    /** Whether {@link #askUser} is backed by a user. */
    default boolean canAskUser() {
        return false;
    }

    default void onFileChanged(FileChangeEvent change) {}

    default void onTodoCreated(TodoItem todo) {}

    default void onTodoUpdated(TodoItem todo) {}

    default void onTaskFinished(String summary) {}
}
