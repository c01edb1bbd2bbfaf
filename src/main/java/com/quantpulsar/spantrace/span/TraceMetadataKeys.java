package com.quantpulsar.spantrace.span;

/**
 * Trace-level metadata keys written when a trace is finalized.
 *
 * @author Quantpulsar 2025-2026
 */
public final class TraceMetadataKeys {

    /** Aggregated token usage over all spans of the trace. */
    public static final String TOKEN_USAGE = "spantrace.trace.tokenUsage";

    /** Request id of the execution context the trace ran in. */
    public static final String REQUEST_ID = "spantrace.trace.requestId";

    private TraceMetadataKeys() {
    }
}
