package com.quantpulsar.spantrace.span;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An ordered collection of spans representing one recorded execution.
 *
 * <p>Spans are kept in creation order. Once {@link #markFinalized()} has been called the
 * record accepts no more spans.
 *
 * @author Quantpulsar 2025-2026
 */
public class TraceRecord {

    private final String traceId;
    private final List<TraceSpan> spans = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private volatile boolean finalized;

    public TraceRecord(String traceId) {
        this.traceId = Objects.requireNonNull(traceId, "traceId");
    }

    /** Creates a record with a freshly generated trace id. */
    public static TraceRecord create() {
        return new TraceRecord(SpanIds.newTraceId());
    }

    public String getTraceId() {
        return traceId;
    }

    /**
     * Creates a span and appends it to this trace. Its id encodes its ordinal.
     *
     * @param name the span name
     * @return the new span
     */
    public synchronized TraceSpan startSpan(String name) {
        InMemoryTraceSpan span = new InMemoryTraceSpan(SpanIds.encodeSpanId(spans.size()), traceId, name);
        addSpan(span);
        return span;
    }

    /**
     * Appends an externally created span.
     *
     * @param span the span, which must belong to this trace
     */
    public synchronized void addSpan(TraceSpan span) {
        if (finalized) {
            throw new IllegalStateException("Trace " + traceId + " is already finalized");
        }
        if (!traceId.equals(span.getTraceId())) {
            throw new IllegalArgumentException(
                    "Span " + span.getSpanId() + " belongs to trace " + span.getTraceId() + ", not " + traceId);
        }
        spans.add(span);
    }

    /** Spans in creation order. */
    public synchronized List<TraceSpan> getSpans() {
        return Collections.unmodifiableList(new ArrayList<>(spans));
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public void putMetadata(String key, Object value) {
        metadata.put(key, value);
    }

    public boolean isFinalized() {
        return finalized;
    }

    public void markFinalized() {
        this.finalized = true;
    }
}
