package io.github.drompincen.codeforge.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.StreamSupport;

/**
 * Typed view over the parsed arguments object of a tool call.
 */
public final class ToolArguments {

    private final ObjectNode node;

    private ToolArguments(ObjectNode node) {
        this.node = node;
    }

    public static ToolArguments of(ObjectNode node) {
        return new ToolArguments(node);
    }

    public static ToolArguments empty() {
        return new ToolArguments(JsonNodeFactory.instance.objectNode());
    }

    public boolean has(String name) {
        JsonNode value = node.get(name);
        return value != null && !value.isNull();
    }

    public String requireString(String name) {
        return optionalString(name).orElseThrow(() -> ToolArgumentException.missing(name));
    }

    public Optional<String> optionalString(String name) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        if (value.isValueNode()) {
            return Optional.of(value.asText());
        }
        throw ToolArgumentException.invalid(name, "a string");
    }

    /** Optional string that treats blank values as absent. */
    public Optional<String> optionalNonBlank(String name) {
        return optionalString(name).filter(s -> !s.isBlank());
    }

    public boolean optionalBoolean(String name, boolean defaultValue) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isTextual()) {
            String text = value.asText().trim().toLowerCase(Locale.ROOT);
            if (text.equals("true")) {
                return true;
            }
            if (text.equals("false")) {
                return false;
            }
        }
        throw ToolArgumentException.invalid(name, "a boolean");
    }

    public int requireInt(String name) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            throw ToolArgumentException.missing(name);
        }
        if (value.isIntegralNumber() && value.canConvertToInt()) {
            return value.intValue();
        }
        if (value.isTextual()) {
            try {
                return Integer.parseInt(value.asText().trim());
            } catch (NumberFormatException e) {
                throw ToolArgumentException.invalid(name, "an integer");
            }
        }
        throw ToolArgumentException.invalid(name, "an integer");
    }

    /** Comma-separated list, or a JSON array of strings. */
    public List<String> optionalList(String name) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (value.isArray()) {
            return StreamSupport.stream(value.spliterator(), false)
                    .map(JsonNode::asText)
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
        }
        return Arrays.stream(value.asText().split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    public ObjectNode asJson() {
        return node.deepCopy();
    }
}
