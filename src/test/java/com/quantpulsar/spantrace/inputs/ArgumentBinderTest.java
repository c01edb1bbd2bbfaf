package com.quantpulsar.spantrace.inputs;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for ArgumentBinder.
 */
@ExtendWith(MockitoExtension.class)
class ArgumentBinderTest {

    // func(a, b, c=3, d=4, **kwargs)
    private static final CallableSignature FUNC = CallableSignature.builder()
            .parameter("a")
            .parameter("b")
            .defaulted("c")
            .defaulted("d")
            .varKeyword("kwargs")
            .build();

    @Mock
    private SignatureResolver signatureResolver;

    private ArgumentBinder binder;

    @BeforeEach
    void setUp() {
        binder = new ArgumentBinder(signatureResolver);
    }

    @Nested
    @DisplayName("Binding against a known signature")
    class KnownSignature {

        @Test
        @DisplayName("Defaults the caller did not pass are absent")
        void bind_positionalOnly() {
            assertThat(binder.bind(FUNC, List.of(1, 2), Map.of()))
                    .containsExactly(Map.entry("a", 1), Map.entry("b", 2));
        }

        @Test
        void bind_positionalAndKeyword() {
            assertThat(binder.bind(FUNC, List.of(1, 2), Map.of("c", 5)))
                    .containsExactly(Map.entry("a", 1), Map.entry("b", 2), Map.entry("c", 5));
        }

        @Test
        @DisplayName("Unmatched keywords are collected under the var-keyword parameter")
        void bind_extraKeywordGoesToVarKeyword() {
            Map<String, Object> inputs = binder.bind(FUNC, List.of(1, 2), Map.of("e", 7));

            assertThat(inputs).containsOnlyKeys("a", "b", "kwargs");
            assertThat(inputs.get("kwargs")).isEqualTo(Map.of("e", 7));
        }

        @Test
        void bind_allByKeyword() {
            assertThat(binder.bind(FUNC, List.of(), Map.of("a", 1, "b", 2)))
                    .containsExactly(Map.entry("a", 1), Map.entry("b", 2));
        }

        @Test
        @DisplayName("Entries follow declaration order, not call-site order")
        void bind_shouldFollowDeclarationOrder() {
            Map<String, Object> kwargs = new LinkedHashMap<>();
            kwargs.put("d", 9);
            kwargs.put("b", 2);
            kwargs.put("c", 8);

            assertThat(binder.bind(FUNC, List.of(1), kwargs)).containsExactly(
                    Map.entry("a", 1), Map.entry("b", 2), Map.entry("c", 8), Map.entry("d", 9));
        }

        // Explicitly passed values equal to the default are still reported
        @Test
        void bind_shouldReportExplicitDefault() {
            assertThat(binder.bind(FUNC, List.of(1, 2, 3), Map.of())).containsEntry("c", 3);
        }

        @Test
        void bind_noParameters() {
            assertThat(binder.bind(CallableSignature.EMPTY, List.of(), Map.of())).isEmpty();
            assertThat(binder.bind(CallableSignature.EMPTY, null, null)).isEmpty();
        }

        @Test
        @DisplayName("The receiver consumes the first argument but is not reported")
        void bind_shouldExcludeReceiver() {
            CallableSignature method = CallableSignature.builder()
                    .receiver("self")
                    .parameter("x")
                    .build();
            Object receiver = new Object();

            assertThat(binder.bind(method, List.of(receiver, 10), Map.of()))
                    .containsExactly(Map.entry("x", 10));
        }

        @Test
        void bind_varPositional() {
            CallableSignature variadic = CallableSignature.builder()
                    .parameter("first")
                    .varPositional("rest")
                    .build();

            Map<String, Object> inputs = binder.bind(variadic, List.of("a", "b", "c"), Map.of());

            assertThat(inputs).containsEntry("first", "a");
            assertThat(inputs.get("rest")).isEqualTo(List.of("b", "c"));
        }

        @Test
        void bind_resultShouldBeUnmodifiable() {
            Map<String, Object> inputs = binder.bind(FUNC, List.of(1, 2), Map.of());

            assertThatThrownBy(() -> inputs.put("z", 0)).isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("Arguments that do not fit the signature")
    class Mismatch {

        @Test
        void bind_tooManyPositionalsShouldYieldNull() {
            assertThat(binder.bind(FUNC, List.of(1, 2, 3, 4, 5), Map.of())).isNull();
        }

        @Test
        void bind_unexpectedKeywordWithoutVarKeywordShouldYieldNull() {
            CallableSignature closed = CallableSignature.builder().parameter("a").build();

            assertThat(binder.bind(closed, List.of(), Map.of("b", 1))).isNull();
        }

        @Test
        void bindStrict_duplicateValueShouldThrow() {
            assertThatThrownBy(() -> binder.bindStrict(FUNC, List.of(1, 2), Map.of("a", 3)))
                    .isInstanceOf(ArgumentBindingException.class)
                    .hasMessageContaining("'a'");
        }

        @Test
        void bindStrict_tooManyPositionalsShouldThrow() {
            assertThatThrownBy(() -> binder.bindStrict(CallableSignature.EMPTY, List.of(1), Map.of()))
                    .isInstanceOf(ArgumentBindingException.class);
        }
    }

    @Nested
    @DisplayName("Signature lookup")
    class Lookup {

        @Test
        void bind_shouldUseResolvedSignature() throws Exception {
            Object callable = "module.func";
            when(signatureResolver.resolve(callable)).thenReturn(FUNC);

            assertThat(binder.bind(callable, List.of(1, 2), Map.of("c", 5)))
                    .containsOnlyKeys("a", "b", "c");
            verify(signatureResolver).resolve(callable);
        }

        @Test
        @DisplayName("Introspection failure yields null instead of propagating")
        void bind_introspectionFailureShouldYieldNull() throws Exception {
            when(signatureResolver.resolve(any())).thenThrow(new SignatureIntrospectionException("opaque"));

            assertThat(binder.bind("builtin", List.of(1), Map.of())).isNull();
            verify(signatureResolver).resolve("builtin");
        }

        @Test
        void bind_allDefaultsSupplied() throws Exception {
            when(signatureResolver.resolve("func")).thenReturn(FUNC);

            Map<String, Object> inputs = binder.bind("func", List.of(1, 2), Map.of("c", 30, "d", 40, "e", 50));

            assertThat(inputs).containsExactly(Map.entry("a", 1), Map.entry("b", 2), Map.entry("c", 30),
                    Map.entry("d", 40), Map.entry("kwargs", Map.of("e", 50)));
        }

        @Test
        void bind_unexpectedResolverErrorShouldYieldNull() throws Exception {
            when(signatureResolver.resolve(any())).thenThrow(new IllegalStateException("boom"));

            assertThat(binder.bind("anything", List.of(), Map.of())).isNull();
        }

        @Test
        void bind_missingSignatureShouldYieldNull() throws Exception {
            when(signatureResolver.resolve(any())).thenReturn(null);

            assertThat(binder.bind("anything", List.of(), Map.of())).isNull();
        }
    }
}
