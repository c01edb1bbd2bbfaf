package com.quantpulsar.spantrace.otel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantpulsar.spantrace.span.SpanAttributeKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Encodes span attribute values as OpenTelemetry string attributes and back.
 *
 * <p>Structured keys are always stored as JSON, strings included, so they decode to the same
 * tree. Other keys keep primitive values and fall back to JSON for anything else.
 */
class AttributeCodec {

    private static final Logger log = LoggerFactory.getLogger(AttributeCodec.class);

    static final Set<String> JSON_KEYS = Set.of(
            SpanAttributeKeys.INPUTS,
            SpanAttributeKeys.OUTPUTS,
            SpanAttributeKeys.CHAT_USAGE,
            SpanAttributeKeys.CHAT_MESSAGES,
            SpanAttributeKeys.CHAT_TOOLS);

    private final ObjectMapper objectMapper;

    AttributeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return a String, Long, Double or Boolean suitable for an OpenTelemetry attribute
     */
    Object encode(String key, Object value) {
        if (!JSON_KEYS.contains(key)) {
            if (value instanceof String || value instanceof Boolean || value instanceof Double) {
                return value;
            }
            if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
                return ((Number) value).longValue();
            }
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Attribute {} is not JSON serializable, recording its string form: {}", key, e.getOriginalMessage());
            return String.valueOf(value);
        }
    }

    Object decode(String key, Object value) {
        if (!JSON_KEYS.contains(key) || !(value instanceof String json)) {
            return value;
        }
        try {
            return objectMapper.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            log.debug("Attribute {} is not valid JSON, keeping the raw string", key);
            return value;
        }
    }
}
