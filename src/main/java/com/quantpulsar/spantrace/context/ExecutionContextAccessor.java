package com.quantpulsar.spantrace.context;

import java.util.Optional;

/**
 * Gives read access to the execution context visible to the current invocation.
 * Supplied by the call-interception layer that owns the context lifecycle.
 *
 * @author Quantpulsar 2025-2026
 */
@FunctionalInterface
public interface ExecutionContextAccessor {

    /**
     * Returns the innermost active execution context.
     *
     * @return the context, or empty if none is active
     */
    Optional<ExecutionContext> current();
}
