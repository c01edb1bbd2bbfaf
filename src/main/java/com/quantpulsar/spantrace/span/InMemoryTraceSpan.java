package com.quantpulsar.spantrace.span;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Default {@link TraceSpan} keeping its attributes in memory.
 *
 * @author Quantpulsar 2025-2026
 */
public class InMemoryTraceSpan implements TraceSpan {

    private final String spanId;
    private final String traceId;
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private String name;

    public InMemoryTraceSpan(String spanId, String traceId, String name) {
        this.spanId = Objects.requireNonNull(spanId, "spanId");
        this.traceId = Objects.requireNonNull(traceId, "traceId");
        this.name = Objects.requireNonNull(name, "name");
    }

    public InMemoryTraceSpan(String spanId, String traceId, String name, Map<String, Object> attributes) {
        this(spanId, traceId, name);
        if (attributes != null) {
            this.attributes.putAll(attributes);
        }
    }

    @Override
    public String getSpanId() {
        return spanId;
    }

    @Override
    public String getTraceId() {
        return traceId;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void setName(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    @Override
    public void setAttribute(String key, Object value) {
        attributes.put(key, value);
    }

    @Override
    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    @Override
    public String toString() {
        return "InMemoryTraceSpan{spanId=" + spanId + ", traceId=" + traceId + ", name=" + name + "}";
    }
}
