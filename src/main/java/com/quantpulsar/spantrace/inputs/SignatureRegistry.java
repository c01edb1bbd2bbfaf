package com.quantpulsar.spantrace.inputs;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Signatures registered explicitly when a callable is instrumented.
 *
 * @author Quantpulsar 2025-2026
 */
public class SignatureRegistry implements SignatureResolver {

    private final Map<Object, CallableSignature> signatures = new ConcurrentHashMap<>();

    /**
     * Registers the signature of a callable, replacing any previous registration.
     *
     * @param callable  the callable key, e.g. a function object or a qualified name
     * @param signature its parameter shape
     * @return this registry
     */
    public SignatureRegistry register(Object callable, CallableSignature signature) {
        signatures.put(Objects.requireNonNull(callable, "callable"), Objects.requireNonNull(signature, "signature"));
        return this;
    }

    public boolean isRegistered(Object callable) {
        return callable != null && signatures.containsKey(callable);
    }

    @Override
    public CallableSignature resolve(Object callable) throws SignatureIntrospectionException {
        CallableSignature signature = callable == null ? null : signatures.get(callable);
        if (signature == null) {
            throw new SignatureIntrospectionException("No signature registered for " + callable);
        }
        return signature;
    }
}
