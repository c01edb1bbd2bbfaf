package com.quantpulsar.spantrace;

import com.quantpulsar.spantrace.naming.SpanNameDeduplicator;
import com.quantpulsar.spantrace.span.SpanAttributeKeys;
import com.quantpulsar.spantrace.span.TraceMetadataKeys;
import com.quantpulsar.spantrace.span.TraceRecord;
import com.quantpulsar.spantrace.span.TraceSpan;
import com.quantpulsar.spantrace.usage.TokenUsageAggregator;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Normalizes a completed trace: deduplicates span names, totals token usage into the trace
 * metadata and lifts the request id of the spans to the trace.
 *
 * <p>Runs once per trace, after every span of the trace has ended. Each run is recorded as a
 * {@value #OBSERVATION_NAME} observation.
 *
 * @author Quantpulsar 2025-2026
 */
public class TraceFinalizer {

    private static final Logger log = LoggerFactory.getLogger(TraceFinalizer.class);

    /** Name of the observation wrapping each finalization. */
    public static final String OBSERVATION_NAME = "spantrace.trace.finalize";

    private final SpanNameDeduplicator deduplicator;
    private final TokenUsageAggregator aggregator;
    private final ObservationRegistry observationRegistry;
    private final SpanTraceProperties properties;

    public TraceFinalizer(SpanNameDeduplicator deduplicator,
                          TokenUsageAggregator aggregator,
                          ObservationRegistry observationRegistry,
                          SpanTraceProperties properties) {
        this.deduplicator = deduplicator;
        this.aggregator = aggregator;
        this.observationRegistry = observationRegistry != null ? observationRegistry : ObservationRegistry.NOOP;
        this.properties = properties;
    }

    /**
     * Finalizes a trace. Calling it again on a finalized trace does nothing.
     *
     * @param trace the trace, no longer receiving spans
     */
    public void finalizeTrace(TraceRecord trace) {
        if (trace.isFinalized()) {
            log.debug("Trace {} already finalized, skipping", trace.getTraceId());
            return;
        }

        List<TraceSpan> spans = trace.getSpans();
        Observation observation = Observation.createNotStarted(OBSERVATION_NAME, observationRegistry);
        observation.lowCardinalityKeyValue("spantrace.deduplicate", String.valueOf(properties.isDeduplicateSpanNames()));
        observation.lowCardinalityKeyValue("spantrace.aggregate_usage", String.valueOf(properties.isAggregateTokenUsage()));
        observation.highCardinalityKeyValue("spantrace.trace.id", trace.getTraceId());
        observation.highCardinalityKeyValue("spantrace.trace.span_count", String.valueOf(spans.size()));
        observation.start();

        try (Observation.Scope ignored = observation.openScope()) {
            if (properties.isDeduplicateSpanNames()) {
                deduplicator.deduplicate(spans);
            }

            if (properties.isAggregateTokenUsage()) {
                Map<String, Long> usage = aggregator.aggregate(spans);
                if (!usage.isEmpty()) {
                    trace.putMetadata(TraceMetadataKeys.TOKEN_USAGE, usage);
                }
            }

            for (TraceSpan span : spans) {
                if (span.getAttribute(SpanAttributeKeys.REQUEST_ID) instanceof String requestId) {
                    trace.putMetadata(TraceMetadataKeys.REQUEST_ID, requestId);
                    break;
                }
            }

            trace.markFinalized();
            log.debug("Finalized trace {} with {} span(s)", trace.getTraceId(), spans.size());
        } catch (RuntimeException e) {
            observation.error(e);
            throw e;
        } finally {
            observation.stop();
        }
    }
}
