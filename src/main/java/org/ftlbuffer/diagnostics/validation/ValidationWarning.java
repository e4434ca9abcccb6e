package org.ftlbuffer.diagnostics.validation;

/**
 * A semantic problem in a resource that parses fine but will not format as intended.
 *
 * @param code    One of {@link #DUPLICATE_ID}, {@link #UNDEFINED_REFERENCE}, {@link #CIRCULAR_REFERENCE}.
 * @param message The human-readable description.
 * @param context The id or reference path the warning is about.
 */
public record ValidationWarning(String code, String message, String context) {

    public static final String DUPLICATE_ID = "duplicate-id";
    public static final String UNDEFINED_REFERENCE = "undefined-reference";
    public static final String CIRCULAR_REFERENCE = "circular-reference";
}
