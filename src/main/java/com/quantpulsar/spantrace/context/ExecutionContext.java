package com.quantpulsar.spantrace.context;

import io.opentelemetry.context.Context;
import io.opentelemetry.context.ContextKey;
import io.opentelemetry.context.ImplicitContextKeyed;

import java.util.Objects;

/**
 * Ambient metadata of a traced invocation: the request it serves and whether it runs as
 * part of an evaluation.
 *
 * <p>Stored in the OpenTelemetry {@link Context}, so it is scoped to the current thread and
 * follows the context when it is propagated to other threads. A context made current inside
 * another one shadows it until its scope is closed.
 *
 * <pre>{@code
 * try (Scope ignored = ExecutionContext.evaluation("eval-42").makeCurrent()) {
 *     // traced calls see request id "eval-42"
 * }
 * }</pre>
 *
 * @param requestId the request identifier
 * @param evaluate  whether the invocation is an evaluation call
 * @author Quantpulsar 2025-2026
 */
public record ExecutionContext(String requestId, boolean evaluate) implements ImplicitContextKeyed {

    static final ContextKey<ExecutionContext> CONTEXT_KEY = ContextKey.named("spantrace-execution-context");

    public ExecutionContext {
        Objects.requireNonNull(requestId, "requestId");
    }

    /** Creates context for an evaluation invocation. */
    public static ExecutionContext evaluation(String requestId) {
        return new ExecutionContext(requestId, true);
    }

    /** Creates context for a regular serving invocation. */
    public static ExecutionContext serving(String requestId) {
        return new ExecutionContext(requestId, false);
    }

    /**
     * Reads the execution context stored in the given OpenTelemetry context.
     *
     * @param context the OpenTelemetry context
     * @return the innermost execution context, or null if none
     */
    public static ExecutionContext fromContext(Context context) {
        return context.get(CONTEXT_KEY);
    }

    @Override
    public Context storeInContext(Context context) {
        return context.with(CONTEXT_KEY, this);
    }
}
