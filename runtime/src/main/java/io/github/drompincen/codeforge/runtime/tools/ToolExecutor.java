package io.github.drompincen.codeforge.runtime.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.codeforge.persistence.memory.MemoryStorage;
import io.github.drompincen.codeforge.persistence.project.ProjectRepository;
import io.github.drompincen.codeforge.protocol.api.ToolCallResponse;
import io.github.drompincen.codeforge.runtime.todo.TodoStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Executes finalized tool calls. Every outcome, including malformed arguments and unknown tools,
 * is returned as a {@link ToolResult}; nothing is thrown to the caller.
 */
@Service
public class ToolExecutor {

    private static final Logger log = LoggerFactory.getLogger(ToolExecutor.class);

    private final ToolRegistry registry;
    private final ProjectRepository projects;
    private final MemoryStorage memories;
    private final TodoStore todos;
    private final ObjectMapper objectMapper;
    private volatile ToolInteractionCallback defaultCallback = ToolInteractionCallback.NONE;

    public ToolExecutor(ToolRegistry registry, ProjectRepository projects, MemoryStorage memories,
                        TodoStore todos, ObjectMapper objectMapper) {
        this.registry = registry;
        this.projects = projects;
        this.memories = memories;
        this.todos = todos;
        this.objectMapper = objectMapper;
    }

    public void setInteractionCallback(ToolInteractionCallback callback) {
        this.defaultCallback = callback != null ? callback : ToolInteractionCallback.NONE;
    }

    public ToolResult execute(String projectId, ToolCallResponse call) {
        return execute(projectId, call, defaultCallback);
    }

    public ToolResult execute(String projectId, ToolCallResponse call, ToolInteractionCallback callback) {
        ObjectNode arguments;
        try {
            arguments = parseArguments(call.arguments());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Malformed arguments for tool {}: {}", call.name(), e.getMessage());
            return ToolResult.failure("Error executing tool: " + describe(e));
        }

        Optional<Tool> tool = registry.get(call.name());
        if (tool.isEmpty()) {
            log.warn("Model requested unknown tool: {}", call.name());
            return ToolResult.failure("Unknown tool: " + call.name());
        }

        for (String required : registry.requiredArguments(call.name())) {
            JsonNode value = arguments.get(required);
            if (value == null || value.isNull()) {
                return ToolResult.failure("Missing required argument: " + required);
            }
        }

        ToolContext ctx = new ToolContext(projectId, projects, memories, todos, callback);
        try {
            log.debug("Executing tool {} for project {}", call.name(), projectId);
            ToolResult result = tool.get().execute(ctx, ToolArguments.of(arguments));
            if (!result.success()) {
                log.debug("Tool {} failed: {}", call.name(), result.error());
            }
            return result;
        } catch (ToolArgumentException e) {
            return ToolResult.failure(e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Tool {} threw an exception", call.name(), e);
            return ToolResult.failure("Error executing tool: " + describe(e));
        }
    }

    private ObjectNode parseArguments(String raw) throws JsonProcessingException {
        if (raw == null || raw.isBlank()) {
            return objectMapper.createObjectNode();
        }
        JsonNode node = objectMapper.readTree(raw);
        if (node instanceof ObjectNode object) {
            return object;
        }
        throw new IllegalArgumentException("arguments must be a JSON object");
    }

    private static String describe(Exception e) {
        if (e instanceof JsonProcessingException jpe) {
            return jpe.getOriginalMessage();
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
