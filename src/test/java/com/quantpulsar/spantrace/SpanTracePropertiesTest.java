package com.quantpulsar.spantrace;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for SpanTraceProperties configuration.
 */
class SpanTracePropertiesTest {

    // Everything on by default
    @Test
    void defaultValues_shouldBeCorrect() {
        SpanTraceProperties props = new SpanTraceProperties();

        assertThat(props.isEnabled()).isTrue();
        assertThat(props.isCaptureInputs()).isTrue();
        assertThat(props.isDeduplicateSpanNames()).isTrue();
        assertThat(props.isAggregateTokenUsage()).isTrue();
        assertThat(props.isTagRequestId()).isTrue();
        assertThat(props.getTracerName()).isEqualTo("spantrace");
        assertThat(props.getPendingTraceTimeout()).isEqualTo(Duration.ofMinutes(10));
        assertThat(props.getMaxPendingTraces()).isEqualTo(10_000);
    }

    @Test
    void setters_shouldUpdateValues() {
        SpanTraceProperties props = new SpanTraceProperties();

        props.setEnabled(false);
        props.setCaptureInputs(false);
        props.setDeduplicateSpanNames(false);
        props.setAggregateTokenUsage(false);
        props.setTagRequestId(false);
        props.setTracerName("checkout-service");
        props.setPendingTraceTimeout(Duration.ofSeconds(45));
        props.setMaxPendingTraces(100);

        assertThat(props.isEnabled()).isFalse();
        assertThat(props.isCaptureInputs()).isFalse();
        assertThat(props.isDeduplicateSpanNames()).isFalse();
        assertThat(props.isAggregateTokenUsage()).isFalse();
        assertThat(props.isTagRequestId()).isFalse();
        assertThat(props.getTracerName()).isEqualTo("checkout-service");
        assertThat(props.getPendingTraceTimeout()).isEqualTo(Duration.ofSeconds(45));
        assertThat(props.getMaxPendingTraces()).isEqualTo(100);
    }
}
