package io.github.drompincen.codeforge.runtime.todo;

import io.github.drompincen.codeforge.protocol.api.TodoItem;
import io.github.drompincen.codeforge.protocol.api.TodoStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process todo lists, one per project. Each list is owned by a {@link ProjectTodos}
 * whose methods are synchronized, so concurrent tool calls on one project are serialized
 * while different projects never contend.
 */
@Component
public class TodoStore {

    private static final Logger log = LoggerFactory.getLogger(TodoStore.class);

    private final Map<String, ProjectTodos> projects = new ConcurrentHashMap<>();

    public TodoItem create(String projectId, String title, String description) {
        TodoItem item = TodoItem.create(title, description);
        owner(projectId).add(item);
        log.debug("Created todo {} for project {}", item.id(), projectId);
        return item;
    }

    /** Any transition is allowed. Empty when the id is unknown for the project. */
    public Optional<TodoItem> update(String projectId, UUID id, TodoStatus status) {
        ProjectTodos todos = projects.get(projectId);
        return todos == null ? Optional.empty() : todos.update(id, status);
    }

    public List<TodoItem> list(String projectId) {
        ProjectTodos todos = projects.get(projectId);
        return todos == null ? List.of() : todos.snapshot();
    }

    public void clear(String projectId) {
        if (projects.remove(projectId) != null) {
            log.debug("Cleared todos for project {}", projectId);
        }
    }

    private ProjectTodos owner(String projectId) {
        return projects.computeIfAbsent(projectId, id -> new ProjectTodos());
    }

    private static final class ProjectTodos {

        private final List<TodoItem> items = new ArrayList<>();

        synchronized void add(TodoItem item) {
            items.add(item);
        }

        synchronized Optional<TodoItem> update(UUID id, TodoStatus status) {
            for (int i = 0; i < items.size(); i++) {
                if (items.get(i).id().equals(id)) {
                    TodoItem updated = items.get(i).withStatus(status);
                    items.set(i, updated);
                    return Optional.of(updated);
                }
            }
            return Optional.empty();
        }

        synchronized List<TodoItem> snapshot() {
            return List.copyOf(items);
        }
    }
}
