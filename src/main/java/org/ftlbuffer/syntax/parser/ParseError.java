package org.ftlbuffer.syntax.parser;

import org.ftlbuffer.syntax.Cursor;

import java.util.List;
import java.util.Objects;

/**
 * Describes why a grammar rule did not match.
 *
 * @param message  A human-readable description of the problem.
 * @param cursor   The position at which the problem was detected.
 * @param expected The tokens that would have been accepted at that position, possibly empty.
 */
public record ParseError(String message, Cursor cursor, List<String> expected) {

    public ParseError {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(cursor, "cursor");
        expected = expected == null ? List.of() : List.copyOf(expected);
    }

    public ParseError(String message, Cursor cursor) {
        this(message, cursor, List.of());
    }

    @Override
    public String toString() {
        Cursor.LineCol position = cursor.lineCol();
        return message + " at line " + position.line() + ", column " + position.column()
                + (expected.isEmpty() ? "" : " (expected " + String.join(", ", expected) + ")");
    }
}
