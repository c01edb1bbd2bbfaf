package com.quantpulsar.spantrace.chat;

import com.quantpulsar.spantrace.span.SpanAttributeKeys;
import com.quantpulsar.spantrace.span.TraceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Attaches validated chat messages and tool definitions to a span.
 *
 * <p>Writes are all-or-nothing: if any element fails validation a
 * {@link SchemaValidationException} is thrown and the span keeps its previous attributes.
 *
 * @author Quantpulsar 2025-2026
 */
public class ChatAttributeWriter {

    private static final Logger log = LoggerFactory.getLogger(ChatAttributeWriter.class);

    private final ChatSchemaValidator validator;

    public ChatAttributeWriter(ChatSchemaValidator validator) {
        this.validator = validator;
    }

    /**
     * Replaces the chat messages of a span.
     *
     * @param span     the span, typically of type {@code CHAT_MODEL}
     * @param messages the messages
     * @throws SchemaValidationException if a message is invalid
     */
    public void setChatMessages(TraceSpan span, List<?> messages) {
        setChatMessages(span, messages, false);
    }

    /**
     * Sets or extends the chat messages of a span.
     *
     * @param span     the span
     * @param messages the messages
     * @param append   if true, the messages are added after those already on the span
     * @throws SchemaValidationException if a message is invalid
     */
    public void setChatMessages(TraceSpan span, List<?> messages, boolean append) {
        List<Map<String, Object>> validated = validator.validateMessages(messages);

        List<Object> value = new ArrayList<>();
        if (append) {
            Object existing = span.getAttribute(SpanAttributeKeys.CHAT_MESSAGES);
            if (existing instanceof List<?> existingMessages) {
                value.addAll(existingMessages);
            } else if (existing != null) {
                log.warn("Replacing non-list chat messages on span {} ({}) instead of appending",
                        span.getName(), span.getSpanId());
            }
        }
        value.addAll(validated);

        span.setAttribute(SpanAttributeKeys.CHAT_MESSAGES, Collections.unmodifiableList(value));
        log.debug("{} {} chat message(s) on span {} ({})",
                append ? "Appended" : "Set", validated.size(), span.getName(), span.getSpanId());
    }

    /**
     * Replaces the chat tool definitions of a span.
     *
     * @param span  the span
     * @param tools the tool definitions
     * @throws SchemaValidationException if a tool is invalid or of an unsupported type
     */
    public void setChatTools(TraceSpan span, List<?> tools) {
        List<Map<String, Object>> validated = validator.validateTools(tools);
        span.setAttribute(SpanAttributeKeys.CHAT_TOOLS, validated);
        log.debug("Set {} chat tool(s) on span {} ({})", validated.size(), span.getName(), span.getSpanId());
    }
}
