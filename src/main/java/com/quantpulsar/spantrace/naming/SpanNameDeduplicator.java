package com.quantpulsar.spantrace.naming;

import com.quantpulsar.spantrace.span.TraceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites colliding span names into unique labels.
 *
 * <p>Every span whose name occurs more than once in the collection is renamed to
 * {@code name_N}, where N counts that name's occurrences from 1 in collection order.
 * Names that occur once are left alone. Span order and ids are never touched.
 *
 * <p>If a generated label is already the name of another span (for example {@code a_1}
 * next to two spans named {@code a}), N skips ahead to the next free value.
 *
 * @author Quantpulsar 2025-2026
 */
public class SpanNameDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(SpanNameDeduplicator.class);

    /**
     * Deduplicates span names in place.
     *
     * @param spans the finalized spans of one trace, in creation order
     */
    public void deduplicate(List<? extends TraceSpan> spans) {
        // First pass: total occurrences per name
        Map<String, Integer> occurrences = new HashMap<>();
        for (TraceSpan span : spans) {
            occurrences.merge(span.getName(), 1, Integer::sum);
        }

        // Names that survive unchanged
        Set<String> taken = new HashSet<>();
        occurrences.forEach((name, count) -> {
            if (count == 1) {
                taken.add(name);
            }
        });

        // Second pass: number repeated names in order
        Map<String, Integer> counters = new HashMap<>();
        int renamed = 0;
        for (TraceSpan span : spans) {
            String name = span.getName();
            if (occurrences.get(name) < 2) {
                continue;
            }
            String label;
            do {
                label = name + "_" + counters.merge(name, 1, Integer::sum);
            } while (!taken.add(label));
            span.setName(label);
            renamed++;
        }

        if (renamed > 0) {
            log.debug("Renamed {} of {} spans to resolve name collisions", renamed, spans.size());
        }
    }
}
