package com.pubsubrelay.core.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson mapper and checked-to-unchecked helpers.
 * <p>
 * Frames are written with {@link JsonInclude.Include#NON_NULL} so absent optional fields
 * ({@code id}, {@code ref}, {@code contextId}, ...) never appear on the wire.
 * </p>
 */
public final class JsonUtils {
    private JsonUtils() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String writeValueAsString(Object object) {
        try {
            return mapper().writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not JSON-serializable", e);
        }
    }

    public static byte[] writeValueAsBytes(Object object) {
        try {
            return mapper().writeValueAsBytes(object);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not JSON-serializable", e);
        }
    }

    /**
     * Parses a JSON document into a tree.
     *
     * @param json JSON text
     * @return parsed tree, never {@code null} ({@code MissingNode} for empty input)
     * @throws IllegalArgumentException if the text is not valid JSON
     */
    public static JsonNode readTree(String json) {
        try {
            return mapper().readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON", e);
        }
    }

    /**
     * Parses a stored JSON object column, tolerating SQL {@code NULL}.
     */
    public static ObjectNode readObjectOrNull(String json) {
        if (json == null) {
            return null;
        }
        JsonNode node = readTree(json);
        return node instanceof ObjectNode ? (ObjectNode) node : null;
    }

    public static ObjectNode newObject() {
        return mapper().createObjectNode();
    }

    /**
     * Metadata must be a plain JSON object: not an array, not a scalar, not null.
     */
    public static boolean isPlainObject(JsonNode node) {
        return node != null && node.isObject();
    }
}
