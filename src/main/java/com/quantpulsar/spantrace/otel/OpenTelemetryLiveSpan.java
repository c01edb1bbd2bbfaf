package com.quantpulsar.spantrace.otel;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantpulsar.spantrace.span.TraceSpan;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link TraceSpan} over a live OpenTelemetry span.
 *
 * <p>The local attribute tree is authoritative for reads. Every write is mirrored to the
 * OpenTelemetry span, structured values as JSON strings.
 *
 * @author Quantpulsar 2025-2026
 */
public class OpenTelemetryLiveSpan implements TraceSpan {

    private final Span span;
    private final AttributeCodec codec;
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private String name;

    public OpenTelemetryLiveSpan(Span span, String name, ObjectMapper objectMapper) {
        this(span, name, new AttributeCodec(objectMapper));
    }

    OpenTelemetryLiveSpan(Span span, String name, AttributeCodec codec) {
        this.span = span;
        this.name = name;
        this.codec = codec;
    }

    /** The underlying OpenTelemetry span, e.g. to make it current or end it. */
    public Span getSpan() {
        return span;
    }

    public void end() {
        span.end();
    }

    @Override
    public String getSpanId() {
        return span.getSpanContext().getSpanId();
    }

    @Override
    public String getTraceId() {
        return span.getSpanContext().getTraceId();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void setName(String name) {
        this.name = name;
        span.updateName(name);
    }

    @Override
    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    @Override
    public void setAttribute(String key, Object value) {
        attributes.put(key, value);
        if (value == null) {
            return;
        }
        Object encoded = codec.encode(key, value);
        if (encoded instanceof Long number) {
            span.setAttribute(AttributeKey.longKey(key), number);
        } else if (encoded instanceof Double number) {
            span.setAttribute(AttributeKey.doubleKey(key), number);
        } else if (encoded instanceof Boolean flag) {
            span.setAttribute(AttributeKey.booleanKey(key), flag);
        } else {
            span.setAttribute(AttributeKey.stringKey(key), (String) encoded);
        }
    }

    @Override
    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }
}
