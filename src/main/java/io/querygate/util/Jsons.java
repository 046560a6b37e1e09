package io.querygate.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

public final class Jsons {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    // Sorted keys, no indentation: the form hashed for idempotency keys and output digests.
    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private Jsons() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize JSON", e);
        }
    }

    public static String toCompactJson(Object value) {
        try {
            return CANONICAL.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize JSON", e);
        }
    }

    /**
     * Serializes {@code value} with object keys sorted at every nesting level. Maps are sorted by the
     * mapper itself; values already converted to {@code JsonNode} are normalized first.
     */
    public static String canonical(Object value) {
        try {
            Object normalized = CANONICAL.convertValue(value, Object.class);
            return CANONICAL.writeValueAsString(normalized);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new RuntimeException("Failed to canonicalize JSON", e);
        }
    }
}
