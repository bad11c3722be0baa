package com.backend.artscan.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes the free-form {@code description_json} column with the application's {@link ObjectMapper}.
 */
@Component
@RequiredArgsConstructor
public class DescriptionJson {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public String write(Map<String, Object> description) {
        if (description == null || description.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(description);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Description is not serialisable", e);
        }
    }

    public Map<String, Object> read(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt description_json column", e);
        }
    }
}
