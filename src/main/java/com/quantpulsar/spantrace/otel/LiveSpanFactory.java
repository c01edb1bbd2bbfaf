package com.quantpulsar.spantrace.otel;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.trace.Tracer;

/**
 * Starts {@link OpenTelemetryLiveSpan}s from a tracer.
 *
 * @author Quantpulsar 2025-2026
 */
public class LiveSpanFactory {

    private final Tracer tracer;
    private final AttributeCodec codec;

    public LiveSpanFactory(Tracer tracer, ObjectMapper objectMapper) {
        this.tracer = tracer;
        this.codec = new AttributeCodec(objectMapper);
    }

    /**
     * Starts a span as a child of the current OpenTelemetry context.
     *
     * @param name the span name
     * @return the started span
     */
    public OpenTelemetryLiveSpan start(String name) {
        return new OpenTelemetryLiveSpan(tracer.spanBuilder(name).startSpan(), name, codec);
    }
}
