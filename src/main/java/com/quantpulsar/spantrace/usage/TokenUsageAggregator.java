package com.quantpulsar.spantrace.usage;

import com.quantpulsar.spantrace.span.SpanAttributeKeys;
import com.quantpulsar.spantrace.span.TokenUsageKeys;
import com.quantpulsar.spantrace.span.TraceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sums per-span token usage into a trace-level total.
 *
 * <p>A usage key reported by at least one span appears in the result, with silent spans
 * contributing zero. A key no span reports is left out of the result entirely. Values that
 * are not non-negative integers are ignored as if the span had not reported them.
 *
 * @author Quantpulsar 2025-2026
 */
public class TokenUsageAggregator {

    private static final Logger log = LoggerFactory.getLogger(TokenUsageAggregator.class);

    /**
     * Aggregates token usage over the given spans.
     *
     * @param spans the spans of one trace
     * @return key to summed count, ordered as {@link TokenUsageKeys#ALL}; empty if nothing was reported
     */
    public Map<String, Long> aggregate(List<? extends TraceSpan> spans) {
        Map<String, Long> totals = new LinkedHashMap<>();

        for (TraceSpan span : spans) {
            Object usage = span.getAttribute(SpanAttributeKeys.CHAT_USAGE);
            if (usage == null) {
                continue;
            }
            if (!(usage instanceof Map<?, ?> usageMap)) {
                log.debug("Ignoring token usage of span {} ({}): not a map", span.getName(), span.getSpanId());
                continue;
            }
            for (String key : TokenUsageKeys.ALL) {
                Object raw = usageMap.get(key);
                if (raw == null) {
                    continue;
                }
                Long count = toCount(raw);
                if (count == null) {
                    log.debug("Ignoring malformed {} value '{}' on span {} ({})",
                            key, raw, span.getName(), span.getSpanId());
                    continue;
                }
                totals.merge(key, count, (total, added) -> saturatedSum(key, total, added));
            }
        }

        // Re-order to the canonical key order
        Map<String, Long> result = new LinkedHashMap<>();
        for (String key : TokenUsageKeys.ALL) {
            Long total = totals.get(key);
            if (total != null) {
                result.put(key, total);
            }
        }
        return result;
    }

    private static long saturatedSum(String key, long total, long added) {
        try {
            return Math.addExact(total, added);
        } catch (ArithmeticException e) {
            log.debug("Total {} overflows, capping at {}", key, Long.MAX_VALUE);
            return Long.MAX_VALUE;
        }
    }

    private static Long toCount(Object raw) {
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            long value = ((Number) raw).longValue();
            return value >= 0 ? value : null;
        }
        if (raw instanceof BigInteger big) {
            return big.signum() >= 0 && big.bitLength() < Long.SIZE ? big.longValue() : null;
        }
        if (raw instanceof BigDecimal || raw instanceof Double || raw instanceof Float) {
            // Integral floating values, as produced by some JSON decoders, are accepted
            if (!(raw instanceof BigDecimal) && !Double.isFinite(((Number) raw).doubleValue())) {
                return null;
            }
            BigDecimal decimal = raw instanceof BigDecimal bd ? bd : BigDecimal.valueOf(((Number) raw).doubleValue());
            try {
                long value = decimal.longValueExact();
                return value >= 0 ? value : null;
            } catch (ArithmeticException e) {
                return null;
            }
        }
        return null;
    }
}
