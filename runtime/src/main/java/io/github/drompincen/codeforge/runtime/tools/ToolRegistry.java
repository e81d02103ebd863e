package io.github.drompincen.codeforge.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.codeforge.protocol.api.ToolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Name to tool mapping. Schemas are checked here, once, so that dispatch can rely on them.
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);
    private static final Pattern NAME = Pattern.compile("[a-z][a-z0-9_]*");
    private static final Set<String> ARGUMENT_TYPES = Set.of("string", "boolean", "integer");

    private final Map<String, Tool> tools = new ConcurrentHashMap<>();
    private final Map<String, List<String>> requiredArguments = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadTools() {
        ServiceLoader<Tool> loader = ServiceLoader.load(Tool.class);
        for (Tool tool : loader) {
            register(tool);
        }
        log.info("Loaded {} tools via SPI", tools.size());
    }

    public void register(Tool tool) {
        List<String> required = validate(tool);
        if (tools.putIfAbsent(tool.name(), tool) != null) {
            throw new IllegalArgumentException("Tool already registered: " + tool.name());
        }
        requiredArguments.put(tool.name(), required);
        log.debug("Registered tool: {}", tool.name());
    }

    public Optional<Tool> get(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
    }

    public List<String> requiredArguments(String name) {
        return requiredArguments.getOrDefault(name, List.of());
    }

    public Collection<Tool> all() {
        return Collections.unmodifiableCollection(tools.values());
    }

    /** Definitions in name order, as sent in the {@code tools} field of a chat request. */
    public List<ToolDefinition> definitions() {
        return tools.values().stream()
                .sorted(Comparator.comparing(Tool::name))
                .map(t -> ToolDefinition.function(t.name(), t.description(), t.inputSchema()))
                .toList();
    }

    static List<String> validate(Tool tool) {
        String name = tool.name();
        if (name == null || !NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid tool name: " + name);
        }
        if (tool.description() == null || tool.description().isBlank()) {
            throw new IllegalArgumentException("Tool " + name + " has no description");
        }
        JsonNode schema = tool.inputSchema();
        if (schema == null || !"object".equals(schema.path("type").asText())) {
            throw new IllegalArgumentException("Tool " + name + " schema must be of type object");
        }
        JsonNode props = schema.path("properties");
        Iterator<Map.Entry<String, JsonNode>> fields = props.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String type = field.getValue().path("type").asText();
            if (!ARGUMENT_TYPES.contains(type)) {
                throw new IllegalArgumentException("Tool " + name + " argument '" + field.getKey()
                        + "' has unsupported type: " + type);
            }
        }
        List<String> required = new ArrayList<>();
        for (JsonNode entry : schema.path("required")) {
            String arg = entry.asText();
            if (!props.has(arg)) {
                throw new IllegalArgumentException("Tool " + name + " requires undeclared argument: " + arg);
            }
            required.add(arg);
        }
        return List.copyOf(required);
    }
}
