package com.quantpulsar.spantrace.inputs;

import com.quantpulsar.spantrace.inputs.CallableSignature.ParameterKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for ReflectiveSignatureResolver and its combination with SignatureRegistry.
 */
class ReflectiveSignatureResolverTest {

    static class Functions {

        static int func(int a, int b, @Defaulted Integer c, @Defaulted Integer d,
                        @KeywordArguments Map<String, Object> kwargs) {
            return a + b;
        }

        static String join(String separator, String... parts) {
            return String.join(separator, parts);
        }

        String greet(String name) {
            return "hello " + name;
        }

        static void misplaced(@KeywordArguments Map<String, Object> options, int a) {
        }
    }

    @Test
    void resolve_shouldMapAnnotationsToParameterKinds() throws Exception {
        CallableSignature signature = new ReflectiveSignatureResolver().resolve(method("func"));

        assertThat(signature.parameters()).extracting(CallableSignature.Parameter::name)
                .containsExactly("a", "b", "c", "d", "kwargs");
        assertThat(signature.parameters()).extracting(CallableSignature.Parameter::hasDefault)
                .containsExactly(false, false, true, true, false);
        assertThat(signature.varKeyword()).isPresent();
    }

    @Test
    void resolve_varargsBecomeVarPositional() throws Exception {
        CallableSignature signature = new ReflectiveSignatureResolver().resolve(method("join"));

        assertThat(signature.parameters()).extracting(CallableSignature.Parameter::kind)
                .containsExactly(ParameterKind.POSITIONAL_OR_KEYWORD, ParameterKind.VAR_POSITIONAL);
    }

    @Test
    @DisplayName("Instance methods get a receiver only when it travels with the arguments")
    void resolve_receiverHandling() throws Exception {
        Method greet = method("greet");

        assertThat(new ReflectiveSignatureResolver().resolve(greet).parameters())
                .extracting(CallableSignature.Parameter::name).containsExactly("name");
        assertThat(new ReflectiveSignatureResolver(true).resolve(greet).parameters())
                .extracting(CallableSignature.Parameter::name)
                .containsExactly(ReflectiveSignatureResolver.RECEIVER_NAME, "name");
        assertThat(new ReflectiveSignatureResolver(true).resolve(method("join")).parameters())
                .extracting(CallableSignature.Parameter::kind)
                .doesNotContain(ParameterKind.RECEIVER);
    }

    @Test
    void resolve_shouldRejectNonMethods() {
        assertThatThrownBy(() -> new ReflectiveSignatureResolver().resolve("not a method"))
                .isInstanceOf(SignatureIntrospectionException.class);
    }

    @Test
    void resolve_shouldRejectMisplacedKeywordArguments() {
        assertThatThrownBy(() -> new ReflectiveSignatureResolver().resolve(method("misplaced")))
                .isInstanceOf(SignatureIntrospectionException.class)
                .hasMessageContaining("must be the last parameter");
    }

    @Test
    @DisplayName("Reflected signatures bind like declared ones")
    void bind_throughReflection() {
        ArgumentBinder binder = new ArgumentBinder(new ReflectiveSignatureResolver());

        Map<String, Object> inputs = binder.bind(method("func"), List.of(1, 2), Map.of("e", 7));

        assertThat(inputs).containsEntry("a", 1).containsEntry("b", 2).containsEntry("kwargs", Map.of("e", 7));
    }

    @Test
    @DisplayName("Registered signatures win over reflection, unknown callables fall through")
    void composite_shouldPreferRegistry() throws Exception {
        SignatureRegistry registry = new SignatureRegistry()
                .register(method("greet"), CallableSignature.builder().parameter("who").build());
        CompositeSignatureResolver resolver = new CompositeSignatureResolver(
                List.of(registry, new ReflectiveSignatureResolver()));

        assertThat(registry.isRegistered(method("greet"))).isTrue();
        assertThat(resolver.resolve(method("greet")).parameters())
                .extracting(CallableSignature.Parameter::name).containsExactly("who");
        assertThat(resolver.resolve(method("join")).parameters()).hasSize(2);
    }

    @Test
    void composite_shouldReportEveryFailure() {
        CompositeSignatureResolver resolver = new CompositeSignatureResolver(
                List.of(new SignatureRegistry(), new ReflectiveSignatureResolver()));

        assertThatThrownBy(() -> resolver.resolve("opaque"))
                .isInstanceOf(SignatureIntrospectionException.class)
                .satisfies(e -> assertThat(e.getSuppressed()).hasSize(2));
    }

    private static Method method(String name) {
        for (Method method : Functions.class.getDeclaredMethods()) {
            if (method.getName().equals(name)) {
                return method;
            }
        }
        throw new IllegalArgumentException(name);
    }
}
