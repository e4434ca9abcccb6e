package org.ftlbuffer.diagnostics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting the diagnostics produced while formatting one message.
 * <p>
 * This decouples error reporting from the resolution logic: resolver helpers report problems
 * here and carry on with a fallback value. Not thread-safe; one engine belongs to one call.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports a diagnostic.
     *
     * @param diagnostic The diagnostic.
     */
    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    /**
     * Reports several diagnostics in order.
     *
     * @param more The diagnostics.
     */
    public void reportAll(Collection<Diagnostic> more) {
        diagnostics.addAll(more);
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one diagnostic exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * Checks if a diagnostic with the given code has been reported.
     *
     * @param code The code to look for.
     * @return {@code true} if at least one diagnostic has that code.
     */
    public boolean has(DiagnosticCode code) {
        return diagnostics.stream().anyMatch(d -> d.code() == code);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::format)
                .collect(Collectors.joining("\n"));
    }
}
