package org.ftlbuffer.diagnostics;

import java.util.Optional;

/**
 * An exception that is thrown when an API-level operation cannot be completed, for example when a
 * resource file cannot be read.
 * <p>
 * Parsing and formatting never throw this; they report problems as diagnostics instead.
 */
public class FluentException extends Exception {

    private final transient Diagnostic diagnostic;

    /**
     * Constructs a new exception with the specified detail message.
     * @param message The detail message.
     */
    public FluentException(String message) {
        super(message, null);
        this.diagnostic = null;
    }

    /**
     * Constructs a new exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public FluentException(String message, Throwable cause) {
        super(message, cause);
        this.diagnostic = null;
    }

    /**
     * Constructs a new exception from a diagnostic; the message is the formatted diagnostic.
     * @param diagnostic The diagnostic describing the failure.
     */
    public FluentException(Diagnostic diagnostic) {
        super(diagnostic.format(), null);
        this.diagnostic = diagnostic;
    }

    public Optional<Diagnostic> getDiagnostic() {
        return Optional.ofNullable(diagnostic);
    }
}
