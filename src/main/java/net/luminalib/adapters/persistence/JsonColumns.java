package net.luminalib.adapters.persistence;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Reads and writes string sets stored in {@code jsonb} columns.
 */
final class JsonColumns {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    JsonColumns(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    String write(Set<String> values) {
        try {
            return objectMapper.writeValueAsString(values == null ? List.of() : List.copyOf(values));
        } catch (JacksonException exception) {
            throw new IllegalStateException("Failed to serialize string set column", exception);
        }
    }

    Set<String> readSet(String json) {
        if (json == null || json.isBlank()) {
            return Set.of();
        }
        try {
            return new LinkedHashSet<>(objectMapper.readValue(json, STRING_LIST));
        } catch (JacksonException exception) {
            throw new IllegalStateException("Failed to deserialize string set column", exception);
        }
    }
}
