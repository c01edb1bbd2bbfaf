package com.quantpulsar.spantrace.inputs;

/**
 * Thrown when the parameter shape of a callable cannot be determined.
 *
 * @author Quantpulsar 2025-2026
 */
public class SignatureIntrospectionException extends Exception {

    public SignatureIntrospectionException(String message) {
        super(message);
    }

    public SignatureIntrospectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
