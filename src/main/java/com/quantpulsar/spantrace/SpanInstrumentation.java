package com.quantpulsar.spantrace;

import com.quantpulsar.spantrace.chat.ChatAttributeWriter;
import com.quantpulsar.spantrace.context.ExecutionContextResolver;
import com.quantpulsar.spantrace.inputs.ArgumentBinder;
import com.quantpulsar.spantrace.span.SpanAttributeKeys;
import com.quantpulsar.spantrace.span.SpanType;
import com.quantpulsar.spantrace.span.TraceRecord;
import com.quantpulsar.spantrace.span.TraceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Entry point for the call-interception layer.
 *
 * <p>Before a traced call runs, {@link #onCallStart} snapshots its arguments and tags the span
 * with the current request id. Chat-model calls record their messages and tools through
 * {@link #setChatMessages} and {@link #setChatTools}. Once all spans of a trace have ended,
 * {@link #finalizeTrace} normalizes it.
 *
 * @author Quantpulsar 2025-2026
 */
public class SpanInstrumentation {

    private static final Logger log = LoggerFactory.getLogger(SpanInstrumentation.class);

    private final ArgumentBinder argumentBinder;
    private final ExecutionContextResolver contextResolver;
    private final ChatAttributeWriter chatAttributeWriter;
    private final TraceFinalizer traceFinalizer;
    private final SpanTraceProperties properties;

    public SpanInstrumentation(ArgumentBinder argumentBinder,
                               ExecutionContextResolver contextResolver,
                               ChatAttributeWriter chatAttributeWriter,
                               TraceFinalizer traceFinalizer,
                               SpanTraceProperties properties) {
        this.argumentBinder = argumentBinder;
        this.contextResolver = contextResolver;
        this.chatAttributeWriter = chatAttributeWriter;
        this.traceFinalizer = traceFinalizer;
        this.properties = properties;
    }

    /**
     * Prepares the span of a call that is about to run.
     *
     * @param span       the span opened for the call
     * @param spanType   kind of work the call does
     * @param callable   the invoked callable
     * @param args       positional arguments
     * @param kwargs     keyword arguments
     * @param isEvaluate whether the call belongs to an evaluation run
     */
    public void onCallStart(TraceSpan span, SpanType spanType, Object callable,
                            List<?> args, Map<String, ?> kwargs, boolean isEvaluate) {
        span.setAttribute(SpanAttributeKeys.SPAN_TYPE, spanType.name());
        if (properties.isCaptureInputs()) {
            captureInputs(span, callable, args, kwargs);
        }
        if (properties.isTagRequestId()) {
            tagRequestId(span, isEvaluate);
        }
    }

    /**
     * Binds the call's arguments and attaches them to the span.
     *
     * @return true if inputs were recorded, false if no snapshot was available
     */
    public boolean captureInputs(TraceSpan span, Object callable, List<?> args, Map<String, ?> kwargs) {
        Map<String, Object> inputs = argumentBinder.bind(callable, args, kwargs);
        if (inputs == null) {
            log.debug("Span {} ({}) recorded without inputs", span.getName(), span.getSpanId());
            return false;
        }
        span.setAttribute(SpanAttributeKeys.INPUTS, inputs);
        return true;
    }

    /**
     * Tags the span with the request id of the current execution context, if any.
     *
     * @return the request id, or null if none applies
     */
    public String tagRequestId(TraceSpan span, boolean isEvaluate) {
        String requestId = contextResolver.resolveRequestId(isEvaluate);
        if (requestId != null) {
            span.setAttribute(SpanAttributeKeys.REQUEST_ID, requestId);
        }
        return requestId;
    }

    /** Records the return value of a call. */
    public void onCallEnd(TraceSpan span, Object output) {
        if (output != null) {
            span.setAttribute(SpanAttributeKeys.OUTPUTS, output);
        }
    }

    /** @see ChatAttributeWriter#setChatMessages(TraceSpan, List, boolean) */
    public void setChatMessages(TraceSpan span, List<?> messages, boolean append) {
        chatAttributeWriter.setChatMessages(span, messages, append);
    }

    /** @see ChatAttributeWriter#setChatTools(TraceSpan, List) */
    public void setChatTools(TraceSpan span, List<?> tools) {
        chatAttributeWriter.setChatTools(span, tools);
    }

    /** @see TraceFinalizer#finalizeTrace(TraceRecord) */
    public void finalizeTrace(TraceRecord trace) {
        traceFinalizer.finalizeTrace(trace);
    }
}
