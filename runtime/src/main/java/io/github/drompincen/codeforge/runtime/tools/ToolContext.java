package io.github.drompincen.codeforge.runtime.tools;

import io.github.drompincen.codeforge.persistence.memory.MemoryStorage;
import io.github.drompincen.codeforge.persistence.project.ProjectRepository;
import io.github.drompincen.codeforge.protocol.api.FileChangeEvent;
import io.github.drompincen.codeforge.runtime.todo.TodoStore;

public record ToolContext(
        String projectId,
        ProjectRepository projects,
        MemoryStorage memories,
        TodoStore todos,
        ToolInteractionCallback callback
) {
    public ToolContext {
        if (callback == null) {
            callback = ToolInteractionCallback.NONE;
        }
    }

    public void fileChanged(FileChangeEvent change) {
        callback.onFileChanged(change);
    }
}
