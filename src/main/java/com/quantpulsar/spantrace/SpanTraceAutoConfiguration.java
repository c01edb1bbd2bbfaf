package com.quantpulsar.spantrace;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantpulsar.spantrace.chat.ChatAttributeWriter;
import com.quantpulsar.spantrace.chat.ChatSchemaValidator;
import com.quantpulsar.spantrace.chat.JacksonChatSchemaValidator;
import com.quantpulsar.spantrace.context.ExecutionContextAccessor;
import com.quantpulsar.spantrace.context.ExecutionContextResolver;
import com.quantpulsar.spantrace.context.OpenTelemetryExecutionContextAccessor;
import com.quantpulsar.spantrace.inputs.ArgumentBinder;
import com.quantpulsar.spantrace.inputs.CompositeSignatureResolver;
import com.quantpulsar.spantrace.inputs.ReflectiveSignatureResolver;
import com.quantpulsar.spantrace.inputs.SignatureRegistry;
import com.quantpulsar.spantrace.naming.SpanNameDeduplicator;
import com.quantpulsar.spantrace.otel.LiveSpanFactory;
import com.quantpulsar.spantrace.otel.TraceCollectingSpanProcessor;
import com.quantpulsar.spantrace.otel.TraceRecordListener;
import com.quantpulsar.spantrace.usage.TokenUsageAggregator;
import io.micrometer.observation.ObservationRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.sdk.common.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Auto-configuration for span normalization and introspection.
 * Wires the components the call-interception layer uses through {@link SpanInstrumentation}.
 *
 * @author Quantpulsar 2025-2026
 * @see SpanTraceProperties
 */
@AutoConfiguration(
        afterName = {
                "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration",
                "org.springframework.boot.actuate.autoconfigure.observation.ObservationAutoConfiguration"
        }
)
@EnableConfigurationProperties(SpanTraceProperties.class)
@ConditionalOnProperty(prefix = "spantrace", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SpanTraceAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SpanTraceAutoConfiguration.class);

    /**
     * Default constructor.
     */
    public SpanTraceAutoConfiguration() {
    }

    /**
     * Registry for signatures declared at instrumentation time.
     *
     * @return an empty registry
     */
    @Bean
    @ConditionalOnMissingBean
    public SignatureRegistry signatureRegistry() {
        return new SignatureRegistry();
    }

    /**
     * Creates the argument binder. Registered signatures take precedence over reflection.
     *
     * @param signatureRegistry the signature registry
     * @return the argument binder
     */
    @Bean
    @ConditionalOnMissingBean
    public ArgumentBinder argumentBinder(SignatureRegistry signatureRegistry) {
        return new ArgumentBinder(new CompositeSignatureResolver(
                List.of(signatureRegistry, new ReflectiveSignatureResolver())));
    }

    /**
     * Creates the chat schema validator on the application's ObjectMapper, if any.
     *
     * @param objectMapperProvider the ObjectMapper provider
     * @return the validator
     */
    @Bean
    @ConditionalOnMissingBean
    public ChatSchemaValidator chatSchemaValidator(ObjectProvider<ObjectMapper> objectMapperProvider) {
        return new JacksonChatSchemaValidator(objectMapperProvider.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public ChatAttributeWriter chatAttributeWriter(ChatSchemaValidator chatSchemaValidator) {
        return new ChatAttributeWriter(chatSchemaValidator);
    }

    /**
     * Creates the request id resolver. Without an accessor every lookup resolves to null.
     *
     * @param accessorProvider the execution context accessor provider
     * @return the resolver
     */
    @Bean
    @ConditionalOnMissingBean
    public ExecutionContextResolver executionContextResolver(ObjectProvider<ExecutionContextAccessor> accessorProvider) {
        ExecutionContextAccessor accessor = accessorProvider.getIfAvailable();
        if (accessor == null) {
            log.warn("No ExecutionContextAccessor available, spans will not be tagged with request ids");
        }
        return new ExecutionContextResolver(accessor);
    }

    @Bean
    @ConditionalOnMissingBean
    public SpanNameDeduplicator spanNameDeduplicator() {
        return new SpanNameDeduplicator();
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenUsageAggregator tokenUsageAggregator() {
        return new TokenUsageAggregator();
    }

    /**
     * Creates the trace finalizer, observed through the ObservationRegistry when present.
     *
     * @param deduplicator                the span name deduplicator
     * @param aggregator                  the token usage aggregator
     * @param observationRegistryProvider the ObservationRegistry provider
     * @param properties                  the span trace properties
     * @return the finalizer
     */
    @Bean
    @ConditionalOnMissingBean
    public TraceFinalizer traceFinalizer(SpanNameDeduplicator deduplicator,
                                         TokenUsageAggregator aggregator,
                                         ObjectProvider<ObservationRegistry> observationRegistryProvider,
                                         SpanTraceProperties properties) {
        return new TraceFinalizer(deduplicator, aggregator,
                observationRegistryProvider.getIfAvailable(() -> ObservationRegistry.NOOP), properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public SpanInstrumentation spanInstrumentation(ArgumentBinder argumentBinder,
                                                   ExecutionContextResolver executionContextResolver,
                                                   ChatAttributeWriter chatAttributeWriter,
                                                   TraceFinalizer traceFinalizer,
                                                   SpanTraceProperties properties) {
        log.info("Configuring span instrumentation (capture-inputs={}, deduplicate-span-names={}, aggregate-token-usage={})",
                properties.isCaptureInputs(), properties.isDeduplicateSpanNames(), properties.isAggregateTokenUsage());
        return new SpanInstrumentation(argumentBinder, executionContextResolver, chatAttributeWriter,
                traceFinalizer, properties);
    }

    /**
     * OpenTelemetry integration: execution context storage and live spans.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "io.opentelemetry.context.Context")
    static class OpenTelemetryConfiguration {

        @Bean
        @ConditionalOnMissingBean
        ExecutionContextAccessor executionContextAccessor() {
            return new OpenTelemetryExecutionContextAccessor();
        }

        /**
         * Creates the live span factory on the configured OpenTelemetry instance.
         *
         * @param openTelemetryProvider the OpenTelemetry provider
         * @param objectMapperProvider  the ObjectMapper provider
         * @param properties            the span trace properties
         * @return the factory
         */
        @Bean
        @ConditionalOnMissingBean
        LiveSpanFactory liveSpanFactory(ObjectProvider<OpenTelemetry> openTelemetryProvider,
                                        ObjectProvider<ObjectMapper> objectMapperProvider,
                                        SpanTraceProperties properties) {
            OpenTelemetry openTelemetry = openTelemetryProvider.getIfAvailable();
            if (openTelemetry == null) {
                log.warn("OpenTelemetry not found, live spans will not be recorded");
                openTelemetry = OpenTelemetry.noop();
            }
            return new LiveSpanFactory(openTelemetry.getTracer(properties.getTracerName()),
                    objectMapperProvider.getIfAvailable(ObjectMapper::new));
        }
    }

    /**
     * OpenTelemetry SDK integration: finalizes traces as their root spans end.
     * The processor is picked up by whatever builds the SdkTracerProvider from SpanProcessor beans.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "io.opentelemetry.sdk.trace.SpanProcessor")
    static class OpenTelemetrySdkConfiguration {

        @Bean
        @ConditionalOnMissingBean
        TraceCollectingSpanProcessor traceCollectingSpanProcessor(TraceFinalizer traceFinalizer,
                                                                  ObjectProvider<ObjectMapper> objectMapperProvider,
                                                                  ObjectProvider<TraceRecordListener> listeners,
                                                                  SpanTraceProperties properties) {
            log.debug("Registering TraceCollectingSpanProcessor for trace finalization (pending-trace-timeout={}, max-pending-traces={})",
                    properties.getPendingTraceTimeout(), properties.getMaxPendingTraces());
            return new TraceCollectingSpanProcessor(traceFinalizer,
                    objectMapperProvider.getIfAvailable(ObjectMapper::new),
                    trace -> listeners.orderedStream().forEach(listener -> listener.onTraceFinalized(trace)),
                    properties.getPendingTraceTimeout(),
                    properties.getMaxPendingTraces(),
                    Clock.getDefault());
        }
    }
}
