package com.quantpulsar.spantrace.inputs;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.Map;

/**
 * Derives signatures from {@link Method} objects.
 *
 * <p>Parameter names are only available when classes are compiled with {@code -parameters};
 * without them introspection fails. {@link Defaulted} marks optional parameters, a trailing
 * {@code Map} parameter annotated with {@link KeywordArguments} becomes the var-keyword
 * catch-all and a varargs parameter becomes the var-positional one.
 *
 * @author Quantpulsar 2025-2026
 */
public class ReflectiveSignatureResolver implements SignatureResolver {

    /** Name given to the receiver of instance methods when it is passed positionally. */
    public static final String RECEIVER_NAME = "this";

    private final boolean receiverInArguments;

    /** Creates a resolver for calls whose receiver is bound separately from the arguments. */
    public ReflectiveSignatureResolver() {
        this(false);
    }

    /**
     * Creates a resolver.
     *
     * @param receiverInArguments whether instance methods are invoked with their receiver as the
     *                            first positional argument
     */
    public ReflectiveSignatureResolver(boolean receiverInArguments) {
        this.receiverInArguments = receiverInArguments;
    }

    @Override
    public CallableSignature resolve(Object callable) throws SignatureIntrospectionException {
        if (!(callable instanceof Method method)) {
            throw new SignatureIntrospectionException("Not a method: " + callable);
        }

        CallableSignature.Builder builder = CallableSignature.builder();
        if (receiverInArguments && !Modifier.isStatic(method.getModifiers())) {
            builder.receiver(RECEIVER_NAME);
        }

        Parameter[] parameters = method.getParameters();
        for (int i = 0; i < parameters.length; i++) {
            Parameter parameter = parameters[i];
            if (!parameter.isNamePresent()) {
                throw new SignatureIntrospectionException("Parameter names of " + method.getName()
                        + " are not available, compile with -parameters");
            }
            String name = parameter.getName();
            if (parameter.isAnnotationPresent(KeywordArguments.class)) {
                if (i != parameters.length - 1 || !Map.class.isAssignableFrom(parameter.getType())) {
                    throw new SignatureIntrospectionException("@KeywordArguments parameter " + name + " of "
                            + method.getName() + " must be the last parameter and a Map");
                }
                builder.varKeyword(name);
            } else if (parameter.isVarArgs()) {
                builder.varPositional(name);
            } else if (parameter.isAnnotationPresent(Defaulted.class)) {
                builder.defaulted(name);
            } else {
                builder.parameter(name);
            }
        }

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new SignatureIntrospectionException("Unsupported signature of " + method.getName(), e);
        }
    }
}
