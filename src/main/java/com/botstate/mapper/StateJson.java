package com.botstate.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Static utility for the JSON forms of every persisted state file.
 *
 * <p>The mapper is canonical: snake_case names, properties and map keys sorted,
 * ISO-8601 timestamps that keep their offset, decimals written plain and read back as
 * {@link java.math.BigDecimal}. Serializing an unchanged object therefore always yields
 * the same bytes, which is what snapshot change detection compares.
 *
 * <p>Documents ({@link #toDocument}) are pretty-printed with a trailing newline. Lines
 * ({@link #toLine}) are compact and never contain a newline.
 */
public final class StateJson {

    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .build();

    private static final ObjectMapper DOCUMENT_MAPPER = OBJECT_MAPPER.copy().enable(SerializationFeature.INDENT_OUTPUT);

    private StateJson() {}

    /** Shared mapper, for callers that need tree access. */
    public static ObjectMapper mapper() {
        return OBJECT_MAPPER;
    }

    /** Serialize a whole-file document (pretty-printed, newline-terminated, UTF-8). */
    public static byte[] toDocument(Object value) {
        try {
            return (DOCUMENT_MAPPER.writeValueAsString(value) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON serialization failed: " + value.getClass().getSimpleName(), e);
        }
    }

    /** Serialize one JSON-lines record, without the line terminator. */
    public static String toLine(Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON serialization failed: " + value.getClass().getSimpleName(), e);
        }
    }

    /** Deserialize a JSON-lines record. Malformed input surfaces as {@link IOException}. */
    public static <T> T fromLine(String line, Class<T> type) throws IOException {
        return OBJECT_MAPPER.readValue(line, type);
    }

    /** Deserialize a whole-file document. Malformed input surfaces as {@link IOException}. */
    public static <T> T fromDocument(byte[] content, Class<T> type) throws IOException {
        return OBJECT_MAPPER.readValue(content, type);
    }
}
