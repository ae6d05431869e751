package com.fiscalbook.ledger.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fiscalbook.ledger.exception.StorageException;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Reads and writes the denormalised records kept in text columns.
 */
@Component
@Profile("!memory")
public class JsonColumns {

    private final ObjectMapper objectMapper;

    public JsonColumns(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialise " + value.getClass().getSimpleName(), e);
        }
    }

    public <T> T read(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to read stored " + type.getSimpleName(), e);
        }
    }
}
