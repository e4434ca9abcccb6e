package org.ftlbuffer.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link DiagnosticsEngine} and the {@link Outcome} type.
 */
@Tag("unit")
class DiagnosticsEngineTest {

    /**
     * Verifies that reported diagnostics are kept in order and can be queried by code.
     */
    @Test
    void report_collectsInOrder() {
        // Arrange
        DiagnosticsEngine engine = new DiagnosticsEngine();

        // Act
        engine.report(ErrorTemplates.variableNotProvided("name"));
        engine.reportAll(List.of(ErrorTemplates.termNotFound("brand")));

        // Assert
        assertThat(engine.hasErrors()).isTrue();
        assertThat(engine.has(DiagnosticCode.TERM_NOT_FOUND)).isTrue();
        assertThat(engine.has(DiagnosticCode.CYCLIC_REFERENCE)).isFalse();
        assertThat(engine.getDiagnostics()).extracting(Diagnostic::code)
                .containsExactly(DiagnosticCode.VARIABLE_NOT_PROVIDED, DiagnosticCode.TERM_NOT_FOUND);
        assertThat(engine.summary()).contains("Variable '$name' not provided").contains("Term '-brand' not found");
    }

    /**
     * Verifies that the diagnostics list cannot be modified from outside.
     */
    @Test
    void getDiagnostics_isUnmodifiable() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        assertThat(engine.hasErrors()).isFalse();
        assertThatThrownBy(() -> engine.getDiagnostics().add(ErrorTemplates.noVariants()))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    /**
     * Verifies that a failure keeps its diagnostic when retyped.
     */
    @Test
    void outcome_failureRetypeKeepsDiagnostic() {
        Diagnostic diagnostic = ErrorTemplates.functionNotFound("FOO");
        Outcome.Failure<String> failure = new Outcome.Failure<>(diagnostic);

        Outcome<Integer> retyped = failure.retype();

        assertThat(retyped.isFailure()).isTrue();
        assertThat(((Outcome.Failure<Integer>) retyped).diagnostic()).isSameAs(diagnostic);
        assertThat(Outcome.of("x").isFailure()).isFalse();
    }

    /**
     * Verifies that an exception built from a diagnostic exposes it.
     */
    @Test
    void fluentException_carriesDiagnostic() {
        Diagnostic diagnostic = ErrorTemplates.messageNotFound("x");

        FluentException exception = new FluentException(diagnostic);

        assertThat(exception.getMessage()).isEqualTo(diagnostic.format());
        assertThat(exception.getDiagnostic()).contains(diagnostic);
        assertThat(new FluentException("plain").getDiagnostic()).isEmpty();
    }
}
