package com.tracker.resolution.mcp;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * A tool that an agent can call: its name, a description, the JSON Schema of
 * its arguments and the handler that answers a call.
 *
 * <p>Handlers only resolve and validate. None of them creates or changes
 * anything in the tracker.</p>
 *
 * @param name        tool name, e.g. {@code validate_transition}
 * @param description what the tool answers
 * @param inputSchema JSON Schema of the arguments
 * @param handler     maps call arguments to a result map
 */
public record McpToolDefinition(
        String name,
        String description,
        Map<String, Object> inputSchema,
        Function<Map<String, Object>, Map<String, Object>> handler
) {
    public McpToolDefinition {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(description, "description is required");
        Objects.requireNonNull(handler, "handler is required");
        inputSchema = Map.copyOf(Objects.requireNonNull(inputSchema, "inputSchema is required"));
    }

    /**
     * Calls the handler. Missing arguments are passed as an empty map.
     */
    public Map<String, Object> invoke(Map<String, Object> arguments) {
        return handler.apply(arguments != null ? arguments : Map.of());
    }
}
