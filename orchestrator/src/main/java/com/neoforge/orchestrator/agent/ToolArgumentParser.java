package com.neoforge.orchestrator.agent;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * Decodes the JSON argument string of a tool call.
 */
public class ToolArgumentParser {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ToolArgumentParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Empty when the text is not a JSON object. A null or blank string means "no arguments".
     */
    public Optional<Map<String, Object>> parse(String argumentsJson) {
        if (argumentsJson == null || argumentsJson.isBlank()) {
            return Optional.of(Map.of());
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(argumentsJson, MAP_TYPE);
            return Optional.ofNullable(parsed);
        } catch (IOException e) {
            return Optional.empty();
        }
    }
}
