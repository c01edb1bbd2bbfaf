package com.quantpulsar.spantrace.inputs;

import java.util.List;

/**
 * Tries each delegate in turn and returns the first signature found.
 *
 * @author Quantpulsar 2025-2026
 */
public class CompositeSignatureResolver implements SignatureResolver {

    private final List<SignatureResolver> delegates;

    public CompositeSignatureResolver(List<SignatureResolver> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public CallableSignature resolve(Object callable) throws SignatureIntrospectionException {
        SignatureIntrospectionException failure = null;
        for (SignatureResolver delegate : delegates) {
            try {
                return delegate.resolve(callable);
            } catch (SignatureIntrospectionException e) {
                if (failure == null) {
                    failure = new SignatureIntrospectionException("No resolver could inspect " + callable);
                }
                failure.addSuppressed(e);
            }
        }
        throw failure != null ? failure : new SignatureIntrospectionException("No signature resolvers configured");
    }
}
