package org.ftlbuffer.syntax.ast;

import org.ftlbuffer.syntax.Span;

/**
 * A parse error attached to a {@link Junk} entry.
 *
 * @param code    The error code, e.g. {@code E0099}.
 * @param message The human-readable description.
 * @param span    The position of the error.
 */
public record Annotation(String code, String message, Span span) {

    /** The code used for all errors reported by the parser. */
    public static final String PARSE_ERROR_CODE = "E0099";
}
