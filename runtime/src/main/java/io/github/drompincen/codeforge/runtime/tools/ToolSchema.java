package io.github.drompincen.codeforge.runtime.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builder for the {@code {"type":"object","properties":...,"required":[...]}} schemas tools declare.
 */
public final class ToolSchema {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ObjectNode schema = MAPPER.createObjectNode();
    private final ObjectNode props;
    private final ArrayNode required;

    private ToolSchema() {
        schema.put("type", "object");
        props = schema.putObject("properties");
        required = schema.putArray("required");
    }

    public static ToolSchema object() {
        return new ToolSchema();
    }

    public ToolSchema string(String name, String description, boolean isRequired) {
        return property(name, "string", description, isRequired);
    }

    public ToolSchema integer(String name, String description, boolean isRequired) {
        return property(name, "integer", description, isRequired);
    }

    public ToolSchema bool(String name, String description, boolean isRequired) {
        return property(name, "boolean", description, isRequired);
    }

    public ToolSchema enumeration(String name, String description, boolean isRequired, String... values) {
        property(name, "string", description, isRequired);
        ArrayNode allowed = ((ObjectNode) props.get(name)).putArray("enum");
        for (String value : values) {
            allowed.add(value);
        }
        return this;
    }

    private ToolSchema property(String name, String type, String description, boolean isRequired) {
        props.putObject(name).put("type", type).put("description", description);
        if (isRequired) {
            required.add(name);
        }
        return this;
    }

    public ObjectNode build() {
        return schema.deepCopy();
    }
}
