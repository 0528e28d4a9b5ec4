package io.github.eutro.mirlens.core.explore;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.UncheckedIOException;

/**
 * JSON serialization of explorer documents and navigator snapshots.
 */
public class Json {
    private static final ObjectMapper MAPPER = createMapper();

    private Json() {
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Serialize an object to a JSON string.
     *
     * @param obj The object.
     * @return The JSON.
     * @throws UncheckedIOException If the object could not be serialized.
     */
    public static String toJson(Object obj) {
        try {
            return MAPPER.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + obj.getClass().getSimpleName(), e);
        }
    }

    /**
     * Parse a JSON string.
     *
     * @param json The JSON.
     * @param type The type to parse as.
     * @param <T>  The type to parse as.
     * @return The parsed object.
     * @throws UncheckedIOException If the JSON could not be parsed as the type.
     */
    public static <T> T fromJson(String json, Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to deserialize JSON to " + type.getSimpleName(), e);
        }
    }

    public static ObjectMapper getMapper() {
        return MAPPER;
    }
}
