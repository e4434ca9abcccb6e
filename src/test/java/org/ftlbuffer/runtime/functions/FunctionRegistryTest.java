package org.ftlbuffer.runtime.functions;

import org.ftlbuffer.diagnostics.DiagnosticCode;
import org.ftlbuffer.diagnostics.Outcome;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests registration, lookup and failure handling of {@link FunctionRegistry}.
 */
@Tag("unit")
class FunctionRegistryTest {

    /**
     * Verifies the built-in functions and their locale convention.
     */
    @Test
    void withBuiltins_registersNumberDatetimeCurrency() {
        FunctionRegistry registry = FunctionRegistry.withBuiltins();

        assertThat(registry.names()).containsExactly("NUMBER", "DATETIME", "CURRENCY");
        assertThat(registry.isBuiltin("NUMBER")).isTrue();
        assertThat(registry.requiresLocale("NUMBER")).isTrue();
        assertThat(new FunctionRegistry().hasFunction("NUMBER")).isFalse();
    }

    /**
     * Verifies that replacing a built-in makes the name a custom function.
     */
    @Test
    void register_overridesBuiltin() {
        FunctionRegistry registry = FunctionRegistry.withBuiltins();

        registry.register("NUMBER", (positional, named) -> "custom");

        assertThat(registry.isBuiltin("NUMBER")).isFalse();
        assertThat(registry.requiresLocale("NUMBER")).isFalse();
        assertThat(registry.call("NUMBER", List.of(1), Map.of())).isEqualTo(Outcome.of("custom"));
    }

    /**
     * Verifies that copies are independent.
     */
    @Test
    void copy_isIndependent() {
        FunctionRegistry original = FunctionRegistry.withBuiltins();
        FunctionRegistry copy = original.copy();

        copy.register("EXTRA", (positional, named) -> "x");

        assertThat(copy.hasFunction("EXTRA")).isTrue();
        assertThat(original.hasFunction("EXTRA")).isFalse();
        assertThat(copy.isBuiltin("DATETIME")).isTrue();
    }

    /**
     * Verifies that missing and throwing functions become failures.
     */
    @Test
    void call_failures() {
        FunctionRegistry registry = new FunctionRegistry();
        registry.register("FAIL", (positional, named) -> {
            throw new IllegalStateException();
        });

        Outcome<Object> missing = registry.call("NOPE", List.of(), Map.of());
        Outcome<Object> failed = registry.call("FAIL", List.of(), Map.of());

        assertThat(((Outcome.Failure<Object>) missing).diagnostic().code()).isEqualTo(DiagnosticCode.FUNCTION_NOT_FOUND);
        Outcome.Failure<Object> failure = (Outcome.Failure<Object>) failed;
        assertThat(failure.diagnostic().code()).isEqualTo(DiagnosticCode.FUNCTION_FAILED);
        assertThat(failure.diagnostic().message()).isEqualTo("Function 'FAIL' failed: IllegalStateException");
    }

    /**
     * Verifies that functions receive read-only arguments.
     */
    @Test
    void call_passesUnmodifiableArguments() {
        FunctionRegistry registry = new FunctionRegistry();
        registry.register("MUTATE", (positional, named) -> {
            positional.add("x");
            return "unreachable";
        });

        Outcome<Object> result = registry.call("MUTATE", List.of(), Map.of());

        assertThat(result.isFailure()).isTrue();
    }

    /**
     * Verifies that blank names are rejected.
     */
    @Test
    void register_rejectsBlankName() {
        FunctionRegistry registry = new FunctionRegistry();

        assertThatThrownBy(() -> registry.register(" ", (positional, named) -> null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
