package com.quantpulsar.spantrace.span;

import java.util.Map;

/**
 * A single recorded unit of execution within a trace.
 *
 * <p>The span id is fixed for the lifetime of the span. The name may be rewritten once,
 * after the trace is complete, by {@link com.quantpulsar.spantrace.naming.SpanNameDeduplicator}.
 * Attribute values are JSON-like trees: strings, numbers, booleans, lists and maps.
 *
 * @author Quantpulsar 2025-2026
 */
public interface TraceSpan {

    String getSpanId();

    String getTraceId();

    String getName();

    void setName(String name);

    /**
     * Returns the attribute stored under the given key.
     *
     * @param key the attribute key
     * @return the attribute value, or null if the span does not carry it
     */
    Object getAttribute(String key);

    /**
     * Stores an attribute, replacing any previous value under the same key.
     *
     * @param key   the attribute key
     * @param value the attribute value
     */
    void setAttribute(String key, Object value);

    /**
     * Read-only view of all attributes in insertion order.
     *
     * @return the attributes
     */
    Map<String, Object> getAttributes();
}
