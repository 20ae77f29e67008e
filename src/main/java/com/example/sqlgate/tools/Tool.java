package com.example.sqlgate.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

public interface Tool {
    String getName();

    String getDescription();

    ObjectNode getInputSchema();

    JsonNode call(JsonNode arguments) throws Exception;

    default String requireText(JsonNode arguments, String field) {
        JsonNode value = arguments.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new IllegalArgumentException("'" + field + "' is required");
        }
        return value.asText();
    }

    default String optionalText(JsonNode arguments, String field) {
        JsonNode value = arguments.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }
}
