package com.quantpulsar.spantrace.span;

import java.util.List;

/**
 * Sub-keys of the {@link SpanAttributeKeys#CHAT_USAGE} attribute.
 *
 * @author Quantpulsar 2025-2026
 */
public final class TokenUsageKeys {

    public static final String INPUT_TOKENS = "input_tokens";
    public static final String OUTPUT_TOKENS = "output_tokens";
    public static final String TOTAL_TOKENS = "total_tokens";

    /** All keys, in reporting order. */
    public static final List<String> ALL = List.of(INPUT_TOKENS, OUTPUT_TOKENS, TOTAL_TOKENS);

    private TokenUsageKeys() {
    }
}
