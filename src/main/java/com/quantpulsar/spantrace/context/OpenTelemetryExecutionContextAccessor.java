package com.quantpulsar.spantrace.context;

import io.opentelemetry.context.Context;

import java.util.Optional;

/**
 * Reads the execution context from {@link Context#current()}.
 *
 * @author Quantpulsar 2025-2026
 */
public class OpenTelemetryExecutionContextAccessor implements ExecutionContextAccessor {

    @Override
    public Optional<ExecutionContext> current() {
        return Optional.ofNullable(ExecutionContext.fromContext(Context.current()));
    }
}
