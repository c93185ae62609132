package com.sandboxgate.shared.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single tool invocation requested by the agent. Arguments may hold {@code null} values,
 * so they are copied into an unmodifiable insertion-ordered map rather than {@link Map#copyOf}.
 */
public record ToolCall(
    String toolName,
    Map<String, Object> arguments,
    String callId
) {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> ARGS_TYPE = new TypeReference<>() {};

    public ToolCall {
        Objects.requireNonNull(toolName, "toolName");
        arguments = arguments == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public ToolCall(String toolName, Map<String, Object> arguments) {
        this(toolName, arguments, null);
    }

    public static ToolCall fromJson(String toolName, JsonNode input, String callId) {
        if (input == null || input.isNull()) return new ToolCall(toolName, Map.of(), callId);
        if (!input.isObject()) {
            throw new IllegalArgumentException("Tool input must be a JSON object, got " + input.getNodeType());
        }
        return new ToolCall(toolName, MAPPER.convertValue(input, ARGS_TYPE), callId);
    }

    public ToolType toolType() {
        return ToolType.fromName(toolName);
    }

    public ToolRiskClass riskClass() {
        return toolType().riskClass();
    }

    public boolean isHighRisk() {
        return riskClass() == ToolRiskClass.HIGH;
    }

    /** First non-null argument among {@code keys}, as a string; {@code fallback} if none is set. */
    public String stringArg(String fallback, String... keys) {
        for (var key : keys) {
            var value = arguments.get(key);
            if (value != null) return String.valueOf(value);
        }
        return fallback;
    }

    public Integer intArg(String key) {
        var value = arguments.get(key);
        if (value == null) return null;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Argument '" + key + "' is not an integer: " + value);
        }
    }

    public boolean boolArg(String key) {
        var value = arguments.get(key);
        if (value instanceof Boolean) return (Boolean) value;
        return value != null && Boolean.parseBoolean(value.toString());
    }

    /** Path argument, accepting both {@code path} and {@code file_path}. */
    public String path() {
        return stringArg("", "path", "file_path");
    }
}
