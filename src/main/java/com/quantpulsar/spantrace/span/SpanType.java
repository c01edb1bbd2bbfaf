package com.quantpulsar.spantrace.span;

/**
 * Kind of work a span represents.
 *
 * @author Quantpulsar 2025-2026
 */
public enum SpanType {
    LLM,
    CHAIN,
    AGENT,
    TOOL,
    CHAT_MODEL,
    RETRIEVER,
    PARSER,
    EMBEDDING,
    RERANKER,
    UNKNOWN;

    /**
     * Reads the span type attribute of a span.
     *
     * @param span the span
     * @return the recorded type, or {@link #UNKNOWN} if absent or unrecognized
     */
    public static SpanType of(TraceSpan span) {
        Object value = span.getAttribute(SpanAttributeKeys.SPAN_TYPE);
        if (value instanceof String name) {
            for (SpanType type : values()) {
                if (type.name().equals(name)) {
                    return type;
                }
            }
        }
        return UNKNOWN;
    }
}
