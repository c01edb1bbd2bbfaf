package com.quantpulsar.spantrace.chat;

import java.util.List;
import java.util.Map;

/**
 * Validates structured chat attributes against their schemas.
 *
 * <p>Implementations return the normalized form of valid input, ready to be stored as a span
 * attribute, and reject the whole list if any element is invalid.
 *
 * @author Quantpulsar 2025-2026
 */
public interface ChatSchemaValidator {

    /**
     * Validates chat messages.
     *
     * @param messages JSON-like message objects
     * @return normalized messages, in input order
     * @throws SchemaValidationException if any message is invalid
     */
    List<Map<String, Object>> validateMessages(List<?> messages);

    /**
     * Validates chat tool definitions.
     *
     * @param tools JSON-like tool objects
     * @return normalized tools, in input order
     * @throws SchemaValidationException if any tool is invalid
     */
    List<Map<String, Object>> validateTools(List<?> tools);
}
