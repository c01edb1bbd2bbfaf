package com.quantpulsar.spantrace;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for span normalization and introspection.
 *
 * @author Quantpulsar 2025-2026
 */
@ConfigurationProperties(prefix = "spantrace")
public class SpanTraceProperties {

    /**
     * Default constructor.
     */
    public SpanTraceProperties() {
    }

    /** Enable/disable span tracing support. */
    private boolean enabled = true;

    /** Record bound call arguments as span inputs. */
    private boolean captureInputs = true;

    /** Rename colliding span names when a trace is finalized. */
    private boolean deduplicateSpanNames = true;

    /** Sum span token usage into trace metadata when a trace is finalized. */
    private boolean aggregateTokenUsage = true;

    /** Tag spans with the request id of the current execution context. */
    private boolean tagRequestId = true;

    /** Tracer instrumentation name. */
    private String tracerName = "spantrace";

    /** How long ended spans wait for their root span before being discarded. */
    private Duration pendingTraceTimeout = Duration.ofMinutes(10);

    /** Maximum number of traces waiting for their root span. */
    private int maxPendingTraces = 10_000;

    // Getters and Setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isCaptureInputs() {
        return captureInputs;
    }

    public void setCaptureInputs(boolean captureInputs) {
        this.captureInputs = captureInputs;
    }

    public boolean isDeduplicateSpanNames() {
        return deduplicateSpanNames;
    }

    public void setDeduplicateSpanNames(boolean deduplicateSpanNames) {
        this.deduplicateSpanNames = deduplicateSpanNames;
    }

    public boolean isAggregateTokenUsage() {
        return aggregateTokenUsage;
    }

    public void setAggregateTokenUsage(boolean aggregateTokenUsage) {
        this.aggregateTokenUsage = aggregateTokenUsage;
    }

    public boolean isTagRequestId() {
        return tagRequestId;
    }

    public void setTagRequestId(boolean tagRequestId) {
        this.tagRequestId = tagRequestId;
    }

    public String getTracerName() {
        return tracerName;
    }

    public void setTracerName(String tracerName) {
        this.tracerName = tracerName;
    }

    public Duration getPendingTraceTimeout() {
        return pendingTraceTimeout;
    }

    public void setPendingTraceTimeout(Duration pendingTraceTimeout) {
        this.pendingTraceTimeout = pendingTraceTimeout;
    }

    public int getMaxPendingTraces() {
        return maxPendingTraces;
    }

    public void setMaxPendingTraces(int maxPendingTraces) {
        this.maxPendingTraces = maxPendingTraces;
    }
}
