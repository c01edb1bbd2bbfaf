package com.quantpulsar.spantrace.otel;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantpulsar.spantrace.TraceFinalizer;
import com.quantpulsar.spantrace.span.InMemoryTraceSpan;
import com.quantpulsar.spantrace.span.TraceRecord;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.common.Clock;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.ReadWriteSpan;
import io.opentelemetry.sdk.trace.ReadableSpan;
import io.opentelemetry.sdk.trace.SpanProcessor;
import io.opentelemetry.sdk.trace.data.SpanData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects ended OpenTelemetry spans per trace and, when the local root span ends, turns them into
 * a finalized {@link TraceRecord}.
 *
 * <p>A span is the local root when it has no parent or its parent came from another process.
 * Spans are ordered by start time. Structured attributes written by
 * {@link OpenTelemetryLiveSpan} are decoded back into trees before finalization.
 *
 * <p>Spans waiting for their root are held for at most {@code pendingTraceTimeout} and for at most
 * {@code maxPendingTraces} traces; beyond that the oldest are discarded with a warning.
 *
 * @author Quantpulsar 2025-2026
 */
public class TraceCollectingSpanProcessor implements SpanProcessor {

    private static final Logger log = LoggerFactory.getLogger(TraceCollectingSpanProcessor.class);

    /** Default time a trace may wait for its root span. */
    public static final Duration DEFAULT_PENDING_TRACE_TIMEOUT = Duration.ofMinutes(10);

    /** Default number of traces that may wait for their root span at once. */
    public static final int DEFAULT_MAX_PENDING_TRACES = 10_000;

    private static final long SWEEP_INTERVAL_NANOS = TimeUnit.SECONDS.toNanos(1);

    private final TraceFinalizer traceFinalizer;
    private final AttributeCodec codec;
    private final TraceRecordListener listener;
    private final long pendingTimeoutNanos;
    private final int maxPendingTraces;
    private final Clock clock;

    // Ended spans of traces whose root span is still open
    private final Map<String, PendingTrace> pendingTraces = new ConcurrentHashMap<>();
    private final AtomicLong nextSweepNanos;

    public TraceCollectingSpanProcessor(TraceFinalizer traceFinalizer,
                                        ObjectMapper objectMapper,
                                        TraceRecordListener listener) {
        this(traceFinalizer, objectMapper, listener, DEFAULT_PENDING_TRACE_TIMEOUT, DEFAULT_MAX_PENDING_TRACES,
                Clock.getDefault());
    }

    /**
     * Creates the processor.
     *
     * @param traceFinalizer      finalizes each collected trace
     * @param objectMapper        decodes structured attributes
     * @param listener            receives finalized traces
     * @param pendingTraceTimeout how long ended spans may wait for their root span
     * @param maxPendingTraces    how many traces may wait for their root span at once
     * @param clock               time source for expiry
     */
    public TraceCollectingSpanProcessor(TraceFinalizer traceFinalizer,
                                        ObjectMapper objectMapper,
                                        TraceRecordListener listener,
                                        Duration pendingTraceTimeout,
                                        int maxPendingTraces,
                                        Clock clock) {
        if (maxPendingTraces < 1) {
            throw new IllegalArgumentException("maxPendingTraces must be positive: " + maxPendingTraces);
        }
        this.traceFinalizer = traceFinalizer;
        this.codec = new AttributeCodec(objectMapper);
        this.listener = listener;
        this.pendingTimeoutNanos = pendingTraceTimeout.toNanos();
        this.maxPendingTraces = maxPendingTraces;
        this.clock = clock;
        this.nextSweepNanos = new AtomicLong(clock.nanoTime() + SWEEP_INTERVAL_NANOS);
    }

    @Override
    public void onStart(Context parentContext, ReadWriteSpan span) {
    }

    @Override
    public boolean isStartRequired() {
        return false;
    }

    @Override
    public void onEnd(ReadableSpan span) {
        SpanData data = span.toSpanData();
        String traceId = data.getTraceId();
        long now = clock.nanoTime();
        evictExpired(now);

        if (!isLocalRoot(data.getParentSpanContext())) {
            if (!pendingTraces.containsKey(traceId) && pendingTraces.size() >= maxPendingTraces) {
                evictOldest();
            }
            pendingTraces.computeIfAbsent(traceId, id -> new PendingTrace(now)).add(data);
            return;
        }

        PendingTrace pending = pendingTraces.remove(traceId);
        List<SpanData> collected = pending != null ? pending.snapshot() : new ArrayList<>();
        collected.add(data);

        TraceRecord trace = toTraceRecord(traceId, collected);
        try {
            traceFinalizer.finalizeTrace(trace);
            listener.onTraceFinalized(trace);
        } catch (RuntimeException e) {
            log.warn("Failed to finalize trace {} ({} span(s))", traceId, trace.getSpans().size(), e);
        }
    }

    @Override
    public boolean isEndRequired() {
        return true;
    }

    @Override
    public CompletableResultCode shutdown() {
        if (!pendingTraces.isEmpty()) {
            log.warn("Discarding {} trace(s) whose root span never ended", pendingTraces.size());
            pendingTraces.clear();
        }
        return CompletableResultCode.ofSuccess();
    }

    public int getPendingTraceCount() {
        return pendingTraces.size();
    }

    private static boolean isLocalRoot(SpanContext parent) {
        return !parent.isValid() || parent.isRemote();
    }

    private void evictExpired(long now) {
        long next = nextSweepNanos.get();
        if (now - next < 0 || !nextSweepNanos.compareAndSet(next, now + SWEEP_INTERVAL_NANOS)) {
            return;
        }
        pendingTraces.forEach((traceId, pending) -> {
            if (now - pending.firstSeenNanos >= pendingTimeoutNanos && pendingTraces.remove(traceId, pending)) {
                log.warn("Discarding {} span(s) of trace {}: root span did not end within {} ms",
                        pending.size(), traceId, TimeUnit.NANOSECONDS.toMillis(pendingTimeoutNanos));
            }
        });
    }

    private void evictOldest() {
        pendingTraces.entrySet().stream()
                .min(Comparator.comparingLong(entry -> entry.getValue().firstSeenNanos))
                .ifPresent(oldest -> {
                    if (pendingTraces.remove(oldest.getKey(), oldest.getValue())) {
                        log.warn("Discarding {} span(s) of trace {}: more than {} traces awaiting their root span",
                                oldest.getValue().size(), oldest.getKey(), maxPendingTraces);
                    }
                });
    }

    private TraceRecord toTraceRecord(String traceId, List<SpanData> collected) {
        collected.sort(Comparator.comparingLong(SpanData::getStartEpochNanos));

        TraceRecord trace = new TraceRecord(traceId);
        for (SpanData data : collected) {
            Map<String, Object> attributes = new LinkedHashMap<>();
            data.getAttributes().forEach((key, value) ->
                    attributes.put(key.getKey(), codec.decode(key.getKey(), value)));
            trace.addSpan(new InMemoryTraceSpan(data.getSpanId(), traceId, data.getName(), attributes));
        }
        return trace;
    }

    private static final class PendingTrace {

        private final long firstSeenNanos;
        private final List<SpanData> spans = new ArrayList<>();

        private PendingTrace(long firstSeenNanos) {
            this.firstSeenNanos = firstSeenNanos;
        }

        synchronized void add(SpanData data) {
            spans.add(data);
        }

        synchronized int size() {
            return spans.size();
        }

        synchronized List<SpanData> snapshot() {
            return new ArrayList<>(spans);
        }
    }
}
