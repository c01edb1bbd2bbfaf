package com.quantpulsar.spantrace.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Resolves the request id of the current execution context.
 *
 * <p>A request id is returned only when the innermost context's evaluation flag matches the
 * one asked for. No context, a missing accessor or a failing accessor all resolve to null.
 *
 * @author Quantpulsar 2025-2026
 */
public class ExecutionContextResolver {

    private static final Logger log = LoggerFactory.getLogger(ExecutionContextResolver.class);

    private final ExecutionContextAccessor accessor;

    /**
     * Creates the resolver.
     *
     * @param accessor the context accessor, or null if no context facility is available
     */
    public ExecutionContextResolver(ExecutionContextAccessor accessor) {
        this.accessor = accessor;
    }

    /**
     * Resolves the request id.
     *
     * @param isEvaluate whether the caller asks for an evaluation request id
     * @return the request id, or null
     */
    public String resolveRequestId(boolean isEvaluate) {
        if (accessor == null) {
            return null;
        }

        Optional<ExecutionContext> context;
        try {
            context = accessor.current();
        } catch (RuntimeException | LinkageError e) {
            log.debug("Execution context unavailable: {}", e.toString());
            return null;
        }

        if (context == null || context.isEmpty()) {
            return null;
        }
        ExecutionContext current = context.get();
        return current.evaluate() == isEvaluate ? current.requestId() : null;
    }
}
