package com.company.alerting.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads and writes the JSON text columns (labels, matchers, levels, members, config).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonColumns {

    private final ObjectMapper objectMapper;

    public String write(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize column value " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * A corrupt column reads as null rather than failing the whole row.
     */
    public <T> T read(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable JSON column ({}): {}", type.getType(), e.getOriginalMessage());
            return null;
        }
    }

    public <T> T read(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable JSON column ({}): {}", type.getSimpleName(), e.getOriginalMessage());
            return null;
        }
    }
}
