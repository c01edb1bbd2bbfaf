package com.quantpulsar.spantrace.inputs;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks the trailing {@code Map} parameter that receives keyword arguments no other
 * parameter declares.
 *
 * @author Quantpulsar 2025-2026
 * @see ReflectiveSignatureResolver
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface KeywordArguments {
}
