package com.crustdata.mcp.utils;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;

/**
 * Shared ObjectMapper singleton for JSON serialization.
 * Configured with NON_NULL inclusion and snake_case naming to match MCP conventions.
 * Map keys are written as given and in iteration order.
 */
public final class Json {
    private static final PropertyNamingStrategies.SnakeCaseStrategy SNAKE_CASE =
        (PropertyNamingStrategies.SnakeCaseStrategy) PropertyNamingStrategies.SNAKE_CASE;

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .setSerializationInclusion(JsonInclude.Include.NON_NULL)
        .setPropertyNamingStrategy(SNAKE_CASE);

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    private Json() {}

    /**
     * Convert a camelCase string to snake_case.
     * Single source of truth for naming conversion across the codebase.
     */
    public static String toSnakeCase(final String camel) {
        return SNAKE_CASE.translate(camel);
    }

    /**
     * Serialize an object to a JSON string.
     *
     * @param value the object to serialize
     * @return JSON string representation
     * @throws RuntimeException if serialization fails
     */
    public static String serialize(final Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("JSON serialization failed", e);
        }
    }

    /**
     * Parse a JSON object into an insertion-ordered map. Integers decode as Integer, Long or
     * BigInteger; fractional numbers as Double.
     *
     * @throws IllegalArgumentException if the text is not valid JSON or not a JSON object
     */
    public static Map<String, Object> readObject(final String json) {
        final JsonNode tree;
        try {
            tree = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON body: " + e.getOriginalMessage(), e);
        }
        if (tree == null || !tree.isObject()) {
            throw new IllegalArgumentException("Malformed JSON body: expected a JSON object");
        }
        return MAPPER.convertValue(tree, OBJECT_MAP);
    }

    /**
     * Convert a value (e.g. a JsonNode) to the given type using Jackson conversion.
     */
    public static <T> T convertValue(final JsonNode node, final Class<T> type) {
        return MAPPER.convertValue(node, type);
    }
}
