package io.github.drompincen.codeforge.protocol.api;

import java.util.UUID;

public record TodoItem(
        UUID id,
        String title,
        String description,
        TodoStatus status
) {
    public static TodoItem create(String title, String description) {
        return new TodoItem(UUID.randomUUID(), title, description != null ? description : "", TodoStatus.PENDING);
    }

    public TodoItem withStatus(TodoStatus status) {
        return new TodoItem(id, title, description, status);
    }
}
