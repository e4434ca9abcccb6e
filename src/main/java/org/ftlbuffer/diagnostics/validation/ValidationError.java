package org.ftlbuffer.diagnostics.validation;

import org.ftlbuffer.diagnostics.Diagnostic;

/**
 * A syntax error: a part of the resource that the parser had to skip.
 *
 * @param code       Always {@link #PARSE_ERROR}.
 * @param message    Why parsing failed.
 * @param content    The skipped source text.
 * @param line       The 1-based line where the skipped text starts.
 * @param column     The 1-based column where the skipped text starts.
 * @param diagnostic The same error as a diagnostic pointing at the exact error position.
 */
public record ValidationError(String code, String message, String content, int line, int column,
                              Diagnostic diagnostic) {

    public static final String PARSE_ERROR = "parse-error";
}
