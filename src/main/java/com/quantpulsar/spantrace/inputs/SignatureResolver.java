package com.quantpulsar.spantrace.inputs;

/**
 * Determines the declared parameter shape of a callable.
 *
 * @author Quantpulsar 2025-2026
 */
@FunctionalInterface
public interface SignatureResolver {

    /**
     * Resolves the signature of a callable.
     *
     * @param callable the callable, in whatever form the resolver understands
     * @return the signature
     * @throws SignatureIntrospectionException if the shape cannot be determined
     */
    CallableSignature resolve(Object callable) throws SignatureIntrospectionException;
}
