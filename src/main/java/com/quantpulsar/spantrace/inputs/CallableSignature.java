package com.quantpulsar.spantrace.inputs;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Declared parameter shape of a callable.
 *
 * <p>Parameters are ordered. An optional receiver comes first, then regular parameters,
 * then at most one var-positional parameter, then at most one var-keyword parameter.
 *
 * @param parameters the declared parameters, in declaration order
 * @author Quantpulsar 2025-2026
 */
public record CallableSignature(List<Parameter> parameters) {

    /** How a parameter takes its value at the call site. */
    public enum ParameterKind {
        /** Instance the callable is invoked on; bound positionally, never reported. */
        RECEIVER,
        /** Regular parameter, bound by position or by name. */
        POSITIONAL_OR_KEYWORD,
        /** Collects surplus positional arguments into a list. */
        VAR_POSITIONAL,
        /** Collects unmatched keyword arguments into a map. */
        VAR_KEYWORD
    }

    /**
     * A single declared parameter.
     *
     * @param name       the parameter name
     * @param kind       how the parameter binds
     * @param hasDefault whether the callable declares a default for it
     */
    public record Parameter(String name, ParameterKind kind, boolean hasDefault) {
        public Parameter {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(kind, "kind");
        }
    }

    /** Signature of a callable taking no parameters. */
    public static final CallableSignature EMPTY = new CallableSignature(List.of());

    public CallableSignature {
        parameters = List.copyOf(parameters);
        validate(parameters);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Finds a parameter that can be bound by keyword.
     *
     * @param name the keyword
     * @return the matching parameter, if any
     */
    public Optional<Parameter> keywordParameter(String name) {
        return parameters.stream()
                .filter(p -> p.name().equals(name))
                .filter(p -> p.kind() == ParameterKind.POSITIONAL_OR_KEYWORD || p.kind() == ParameterKind.RECEIVER)
                .findFirst();
    }

    public Optional<Parameter> varKeyword() {
        return parameters.stream().filter(p -> p.kind() == ParameterKind.VAR_KEYWORD).findFirst();
    }

    private static void validate(List<Parameter> parameters) {
        Set<String> names = new HashSet<>();
        int rank = 0;
        for (int i = 0; i < parameters.size(); i++) {
            Parameter parameter = parameters.get(i);
            if (!names.add(parameter.name())) {
                throw new IllegalArgumentException("Duplicate parameter name: " + parameter.name());
            }
            int parameterRank = switch (parameter.kind()) {
                case RECEIVER -> 0;
                case POSITIONAL_OR_KEYWORD -> 1;
                case VAR_POSITIONAL -> 2;
                case VAR_KEYWORD -> 3;
            };
            if (parameter.kind() == ParameterKind.RECEIVER && i != 0) {
                throw new IllegalArgumentException("Receiver parameter must come first: " + parameter.name());
            }
            if (parameterRank < rank || (parameterRank == rank && parameterRank >= 2)) {
                throw new IllegalArgumentException("Parameter " + parameter.name() + " is out of order");
            }
            rank = parameterRank;
        }
    }

    /** Builds a signature in declaration order. */
    public static final class Builder {

        private final List<Parameter> parameters = new ArrayList<>();

        private Builder() {
        }

        /** Adds the receiver, e.g. {@code self}, bound from the first positional argument. */
        public Builder receiver(String name) {
            parameters.add(new Parameter(name, ParameterKind.RECEIVER, false));
            return this;
        }

        /** Adds a parameter without a default. */
        public Builder parameter(String name) {
            parameters.add(new Parameter(name, ParameterKind.POSITIONAL_OR_KEYWORD, false));
            return this;
        }

        /** Adds a parameter with a declared default. */
        public Builder defaulted(String name) {
            parameters.add(new Parameter(name, ParameterKind.POSITIONAL_OR_KEYWORD, true));
            return this;
        }

        public Builder varPositional(String name) {
            parameters.add(new Parameter(name, ParameterKind.VAR_POSITIONAL, false));
            return this;
        }

        public Builder varKeyword(String name) {
            parameters.add(new Parameter(name, ParameterKind.VAR_KEYWORD, false));
            return this;
        }

        public CallableSignature build() {
            return new CallableSignature(parameters);
        }
    }
}
