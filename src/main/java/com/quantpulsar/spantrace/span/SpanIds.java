package com.quantpulsar.spantrace.span;

import io.opentelemetry.api.trace.SpanId;
import io.opentelemetry.api.trace.TraceId;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Span and trace id encoding, following the OpenTelemetry hex formats.
 *
 * @author Quantpulsar 2025-2026
 */
public final class SpanIds {

    private SpanIds() {
    }

    /**
     * Encodes a span ordinal as a 16 character lowercase hex string.
     *
     * @param ordinal the ordinal of the span within its trace
     * @return the encoded span id
     */
    public static String encodeSpanId(long ordinal) {
        return SpanId.fromLong(ordinal);
    }

    /** Generates a random 32 character trace id. */
    public static String newTraceId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        String traceId;
        do {
            traceId = TraceId.fromLongs(random.nextLong(), random.nextLong());
        } while (!TraceId.isValid(traceId));
        return traceId;
    }
}
