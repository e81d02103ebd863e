package io.github.drompincen.codeforge.runtime.agent;

import io.github.drompincen.codeforge.persistence.memory.MemoryStorage;
import io.github.drompincen.codeforge.runtime.tools.Tool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.Map;

@Component
public class SystemPromptBuilder {

    private static final Logger log = LoggerFactory.getLogger(SystemPromptBuilder.class);

    static final String INSTRUCTIONS = """
            You are CodeForge, an AI coding agent working inside a single project.
            All paths are relative to the project root.

            Guidelines:
            1. Read files before changing them; prefer patch_file or insert_at_line for small edits.
            2. Use get_project_summary or list_files to orient yourself on larger tasks.
            3. Track multi-step work with create_todo and update_todo.
            4. Save durable facts about the project with save_memory.
            5. Ask the user with ask_user only when a decision is genuinely theirs.
            6. Call finish_task with a short summary when the task is complete.
            """;

    private final MemoryStorage memoryStorage;

    public SystemPromptBuilder(MemoryStorage memoryStorage) {
        this.memoryStorage = memoryStorage;
    }

    public String build(String projectId, Collection<Tool> tools) {
        StringBuilder sb = new StringBuilder(INSTRUCTIONS);
        sb.append("\nProject: ").append(projectId).append('\n');
        if (!tools.isEmpty()) {
            sb.append("\n## Available Tools\n");
            tools.stream()
                    .sorted(Comparator.comparing(Tool::name))
                    .forEach(t -> sb.append("- ").append(t.name()).append(": ").append(t.description()).append('\n'));
        }
        String memories = memoryContext(projectId);
        if (!memories.isEmpty()) {
            sb.append('\n').append(memories);
        }
        return sb.toString();
    }

    /** Project memories as a markdown section, or an empty string when there are none. */
    public String memoryContext(String projectId) {
        Map<String, String> entries;
        try {
            entries = memoryStorage.list(projectId);
        } catch (RuntimeException e) {
            log.warn("Could not load memories for project {}: {}", projectId, e.getMessage());
            return "";
        }
        if (entries.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("## Project Memories\n");
        entries.forEach((key, value) -> sb.append("- **").append(key).append("**: ").append(value).append('\n'));
        return sb.toString();
    }
}
