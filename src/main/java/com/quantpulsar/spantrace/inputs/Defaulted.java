package com.quantpulsar.spantrace.inputs;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method parameter that callers may omit, the method supplying its own default.
 *
 * @author Quantpulsar 2025-2026
 * @see ReflectiveSignatureResolver
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface Defaulted {
}
