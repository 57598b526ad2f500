package com.lineage.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLDataException;
import java.util.Map;

/**
 * JSON encoding for TEXT columns holding open-shaped values.
 */
public class JsonColumns {

    private static final Logger log = LoggerFactory.getLogger(JsonColumns.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public JsonColumns() {
        this(defaultMapper());
    }

    public JsonColumns(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultMapper() {
        return JsonMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public ObjectMapper mapper() {
        return objectMapper;
    }

    /**
     * Encodes a value; null stays SQL NULL.
     *
     * @throws SQLDataException when the value cannot be serialized, so the
     *         calling store operation reports it like any other write failure
     */
    public String write(Object value) throws SQLDataException {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SQLDataException("Failed to serialize column value: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Decodes any JSON value. Text that is not JSON is returned as-is, since
     * older rows stored plain strings.
     */
    public Object readValue(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            return json;
        }
    }

    public Map<String, Object> readMap(String json) {
        return read(json, MAP_TYPE);
    }

    public <T> T read(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.debug("Ignoring unreadable {} column: {}", type.getSimpleName(), e.getMessage());
            return null;
        }
    }

    public <T> T read(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.debug("Ignoring unreadable column: {}", e.getMessage());
            return null;
        }
    }
}
