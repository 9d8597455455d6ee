package com.funcpool.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.funcpool.exception.SchemaException;

import java.nio.file.Path;

/**
 * JSON encoding of pool files: indented, UTF-8, unknown fields tolerated on read.
 */
public final class PoolJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private PoolJson() {
    }

    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value) + "\n";
        } catch (JsonProcessingException e) {
            throw new SchemaException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    public static <T> T read(Path file, Class<T> type) {
        String text = PoolFiles.read(file);
        try {
            return MAPPER.readValue(text, type);
        } catch (JsonProcessingException e) {
            throw new SchemaException("Invalid JSON in " + file + ": " + e.getOriginalMessage(), e);
        }
    }

    public static JsonNode readTree(Path file) {
        String text = PoolFiles.read(file);
        try {
            return MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new SchemaException("Invalid JSON in " + file + ": " + e.getOriginalMessage(), e);
        }
    }
}
