package org.ftlbuffer.runtime;

import org.ftlbuffer.diagnostics.Diagnostic;

import java.util.List;
import java.util.Objects;

/**
 * The formatted text of a message together with every problem found while producing it.
 * The text is always usable; failed placeables appear as readable fallbacks such as {@code {$name}}.
 *
 * @param value       The formatted text.
 * @param diagnostics The diagnostics in the order they were reported.
 */
public record ResolveResult(String value, List<Diagnostic> diagnostics) {

    public ResolveResult {
        Objects.requireNonNull(value, "value");
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /**
     * @param value The formatted text.
     * @return A result without diagnostics.
     */
    public static ResolveResult of(String value) {
        return new ResolveResult(value, List.of());
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }
}
