package com.quantpulsar.spantrace.chat;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raised from schema type constructors; carries the field relative to the type being built.
 */
class SchemaViolation extends IllegalArgumentException {

    private final String field;

    SchemaViolation(String field, String message) {
        super(message);
        this.field = field;
    }

    String getField() {
        return field;
    }

    static <T> T require(T value, String field) {
        if (value == null) {
            throw new SchemaViolation(field, "field required");
        }
        if (value instanceof String s && s.isBlank()) {
            throw new SchemaViolation(field, "must not be blank");
        }
        return value;
    }

    static JsonNode nullToAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode() ? null : node;
    }
}
