package com.quantpulsar.spantrace.otel;

import com.quantpulsar.spantrace.span.TraceRecord;

/**
 * Receives traces once they are complete and finalized.
 *
 * @author Quantpulsar 2025-2026
 */
@FunctionalInterface
public interface TraceRecordListener {

    void onTraceFinalized(TraceRecord trace);
}
