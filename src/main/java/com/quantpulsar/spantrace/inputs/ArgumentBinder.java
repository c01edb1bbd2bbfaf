package com.quantpulsar.spantrace.inputs;

import com.quantpulsar.spantrace.inputs.CallableSignature.Parameter;
import com.quantpulsar.spantrace.inputs.CallableSignature.ParameterKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reconstructs the named arguments of an invocation from its call-site arguments.
 *
 * <p>The snapshot only holds what the caller actually passed: parameters left to their
 * defaults are absent, the receiver is dropped, surplus positional arguments are collected
 * into a list under the var-positional parameter and unmatched keyword arguments into a map
 * under the var-keyword parameter. Entries follow declaration order.
 *
 * @author Quantpulsar 2025-2026
 */
public class ArgumentBinder {

    private static final Logger log = LoggerFactory.getLogger(ArgumentBinder.class);

    private final SignatureResolver signatureResolver;

    public ArgumentBinder(SignatureResolver signatureResolver) {
        this.signatureResolver = Objects.requireNonNull(signatureResolver, "signatureResolver");
    }

    /**
     * Binds call-site arguments of a callable whose signature is looked up through the resolver.
     *
     * @param callable the invoked callable
     * @param args     positional arguments
     * @param kwargs   keyword arguments
     * @return the argument snapshot, or null if the signature could not be determined or
     *         the arguments do not fit it
     */
    public Map<String, Object> bind(Object callable, List<?> args, Map<String, ?> kwargs) {
        CallableSignature signature;
        try {
            signature = signatureResolver.resolve(callable);
        } catch (SignatureIntrospectionException | RuntimeException e) {
            log.warn("Failed to inspect signature of {}, inputs will not be captured: {}",
                    describe(callable), e.getMessage());
            log.debug("Signature introspection failure", e);
            return null;
        }
        if (signature == null) {
            log.warn("No signature available for {}, inputs will not be captured", describe(callable));
            return null;
        }
        return bind(signature, args, kwargs);
    }

    /**
     * Binds call-site arguments against a known signature.
     *
     * @param signature the callable's signature
     * @param args      positional arguments
     * @param kwargs    keyword arguments
     * @return the argument snapshot, or null if the arguments do not fit the signature
     */
    public Map<String, Object> bind(CallableSignature signature, List<?> args, Map<String, ?> kwargs) {
        try {
            return bindStrict(signature, args, kwargs);
        } catch (ArgumentBindingException e) {
            log.warn("Failed to bind arguments, inputs will not be captured: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Binds call-site arguments against a known signature, failing on a mismatch.
     *
     * @param signature the callable's signature
     * @param args      positional arguments
     * @param kwargs    keyword arguments
     * @return the argument snapshot
     * @throws ArgumentBindingException if the arguments do not fit the signature
     */
    public Map<String, Object> bindStrict(CallableSignature signature, List<?> args, Map<String, ?> kwargs) {
        List<?> positional = args != null ? args : List.of();
        Map<String, ?> keywords = kwargs != null ? kwargs : Map.of();

        Map<String, Object> bound = new HashMap<>();
        int next = 0;

        for (Parameter parameter : signature.parameters()) {
            if (next >= positional.size()) {
                break;
            }
            switch (parameter.kind()) {
                case RECEIVER, POSITIONAL_OR_KEYWORD -> bound.put(parameter.name(), positional.get(next++));
                case VAR_POSITIONAL -> {
                    bound.put(parameter.name(),
                            Collections.unmodifiableList(new ArrayList<>(positional.subList(next, positional.size()))));
                    next = positional.size();
                }
                case VAR_KEYWORD -> {
                    // binds keywords only
                }
            }
        }
        if (next < positional.size()) {
            throw new ArgumentBindingException("Takes " + next + " positional argument(s) but "
                    + positional.size() + " were given");
        }

        Map<String, Object> extra = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : keywords.entrySet()) {
            String name = entry.getKey();
            Parameter parameter = signature.keywordParameter(name).orElse(null);
            if (parameter == null) {
                extra.put(name, entry.getValue());
            } else if (bound.containsKey(name)) {
                throw new ArgumentBindingException("Got multiple values for argument '" + name + "'");
            } else {
                bound.put(name, entry.getValue());
            }
        }
        if (!extra.isEmpty()) {
            Parameter varKeyword = signature.varKeyword()
                    .orElseThrow(() -> new ArgumentBindingException(
                            "Got unexpected keyword argument(s) " + extra.keySet()));
            bound.put(varKeyword.name(), Collections.unmodifiableMap(extra));
        }

        Map<String, Object> snapshot = new LinkedHashMap<>();
        for (Parameter parameter : signature.parameters()) {
            if (parameter.kind() != ParameterKind.RECEIVER && bound.containsKey(parameter.name())) {
                snapshot.put(parameter.name(), bound.get(parameter.name()));
            }
        }
        return Collections.unmodifiableMap(snapshot);
    }

    private static String describe(Object callable) {
        return callable == null ? "null" : callable.toString();
    }
}
