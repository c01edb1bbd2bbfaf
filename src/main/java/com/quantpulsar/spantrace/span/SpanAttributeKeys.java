package com.quantpulsar.spantrace.span;

/**
 * Reserved span attribute keys.
 *
 * @author Quantpulsar 2025-2026
 */
public final class SpanAttributeKeys {

    /** Bound call arguments of the traced function. */
    public static final String INPUTS = "spantrace.spanInputs";

    /** Return value of the traced function. */
    public static final String OUTPUTS = "spantrace.spanOutputs";

    /** {@link SpanType} name. */
    public static final String SPAN_TYPE = "spantrace.spanType";

    /** Request id resolved from the execution context. */
    public static final String REQUEST_ID = "spantrace.traceRequestId";

    /** Token usage map keyed by {@link TokenUsageKeys}. */
    public static final String CHAT_USAGE = "spantrace.chat.tokenUsage";

    /** Ordered list of chat messages. */
    public static final String CHAT_MESSAGES = "spantrace.chat.messages";

    /** Ordered list of chat tool definitions. */
    public static final String CHAT_TOOLS = "spantrace.chat.tools";

    private SpanAttributeKeys() {
    }
}
