package com.quantpulsar.spantrace.chat;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ChatSchemaValidator} binding each element onto the {@link ChatMessage} and
 * {@link ChatTool} types with Jackson.
 *
 * <p>Unknown properties are dropped; the normalized output omits null fields.
 *
 * @author Quantpulsar 2025-2026
 */
public class JacksonChatSchemaValidator implements ChatSchemaValidator {

    private static final TypeReference<Map<String, Object>> TREE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public JacksonChatSchemaValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    @Override
    public List<Map<String, Object>> validateMessages(List<?> messages) {
        return validate(messages, ChatMessage.class, "ChatMessage", "role");
    }

    @Override
    public List<Map<String, Object>> validateTools(List<?> tools) {
        return validate(tools, ChatTool.class, "ChatTool", "type");
    }

    private <T> List<Map<String, Object>> validate(List<?> elements, Class<T> type, String schema, String tag) {
        Objects.requireNonNull(elements, schema + " list");

        // Bind everything before producing any output
        List<T> validated = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            Object element = elements.get(i);
            if (type.isInstance(element)) {
                validated.add(type.cast(element));
                continue;
            }
            if (!(element instanceof Map<?, ?>)) {
                throw new SchemaValidationException(schema, i, null,
                        "expected an object, got " + (element == null ? "null" : element.getClass().getSimpleName()),
                        null);
            }
            try {
                validated.add(objectMapper.convertValue(element, type));
            } catch (IllegalArgumentException e) {
                throw toValidationError(schema, tag, i, e);
            }
        }

        List<Map<String, Object>> normalized = new ArrayList<>(validated.size());
        for (T value : validated) {
            normalized.add(objectMapper.convertValue(value, TREE));
        }
        return Collections.unmodifiableList(normalized);
    }

    private static SchemaValidationException toValidationError(String schema, String tag, int index,
                                                                IllegalArgumentException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        String path = cause instanceof JsonMappingException mapping ? describePath(mapping.getPath()) : null;

        if (cause instanceof InvalidTypeIdException invalidType) {
            String detail = invalidType.getTypeId() == null
                    ? "field required"
                    : "unsupported value '" + invalidType.getTypeId() + "'";
            return new SchemaValidationException(schema, index, join(path, tag), detail, e);
        }

        SchemaViolation violation = findViolation(e);
        if (violation != null) {
            return new SchemaValidationException(schema, index, join(path, violation.getField()),
                    violation.getMessage(), e);
        }

        String detail = cause instanceof JsonMappingException mapping ? mapping.getOriginalMessage() : cause.getMessage();
        return new SchemaValidationException(schema, index, path, detail, e);
    }

    private static SchemaViolation findViolation(Throwable throwable) {
        Throwable current = throwable;
        while (current != null) {
            if (current instanceof SchemaViolation violation) {
                return violation;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return null;
    }

    private static String describePath(List<JsonMappingException.Reference> references) {
        if (references == null || references.isEmpty()) {
            return null;
        }
        StringBuilder path = new StringBuilder();
        for (JsonMappingException.Reference reference : references) {
            if (reference.getFieldName() != null) {
                if (path.length() > 0) {
                    path.append('.');
                }
                path.append(reference.getFieldName());
            } else if (reference.getIndex() >= 0) {
                path.append('[').append(reference.getIndex()).append(']');
            }
        }
        return path.length() > 0 ? path.toString() : null;
    }

    private static String join(String path, String field) {
        if (path == null) {
            return field;
        }
        return field == null ? path : path + "." + field;
    }
}
