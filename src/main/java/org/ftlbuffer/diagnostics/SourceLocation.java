package org.ftlbuffer.diagnostics;

import org.ftlbuffer.syntax.Cursor;
import org.ftlbuffer.syntax.Span;

/**
 * Where a diagnostic points to in the source: a character range and the line and column of its start.
 *
 * @param span   The character range.
 * @param line   The 1-based line of {@code span.start()}.
 * @param column The 1-based column of {@code span.start()}.
 */
public record SourceLocation(Span span, int line, int column) {

    /**
     * Computes line and column for a span of the given source.
     * @param source The source text the span refers to.
     * @param span   The range.
     * @return The location.
     */
    public static SourceLocation of(String source, Span span) {
        Cursor.LineCol position = new Cursor(source, Math.min(span.start(), source.length())).lineCol();
        return new SourceLocation(span, position.line(), position.column());
    }
}
