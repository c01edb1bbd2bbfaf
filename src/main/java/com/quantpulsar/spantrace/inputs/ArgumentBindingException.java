package com.quantpulsar.spantrace.inputs;

/**
 * Thrown when call-site arguments do not fit a signature.
 *
 * @author Quantpulsar 2025-2026
 */
public class ArgumentBindingException extends RuntimeException {

    public ArgumentBindingException(String message) {
        super(message);
    }
}
