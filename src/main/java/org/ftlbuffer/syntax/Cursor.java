package org.ftlbuffer.syntax;

import java.util.Objects;
import java.util.Optional;

/**
 * An immutable position inside an FTL source string.
 * <p>
 * Every operation returns a new cursor; a cursor is never mutated. Grammar rules therefore
 * have to reassign their cursor variable on each step, and a rule that forgets to do so
 * simply makes no progress instead of corrupting shared state.
 *
 * @param source The complete source text.
 * @param pos    The current offset into {@code source}, between 0 and {@code source.length()}.
 */
public record Cursor(String source, int pos) {

    public Cursor {
        Objects.requireNonNull(source, "source");
        if (pos < 0 || pos > source.length()) {
            throw new IllegalArgumentException("Position " + pos + " is outside of [0, " + source.length() + "]");
        }
    }

    /**
     * Creates a cursor at the start of the given source.
     * @param source The source text.
     * @return A cursor at offset 0.
     */
    public static Cursor of(String source) {
        return new Cursor(source, 0);
    }

    /**
     * @return {@code true} if the cursor has reached the end of the source.
     */
    public boolean isEof() {
        return pos >= source.length();
    }

    /**
     * Returns the character at the current position.
     * Callers must check {@link #isEof()} first or use {@link #peek(int)}.
     *
     * @return The current character.
     * @throws CursorEofException if the cursor is at the end of the source.
     */
    public char current() {
        if (isEof()) {
            throw new CursorEofException(pos);
        }
        return source.charAt(pos);
    }

    /**
     * Looks ahead without moving. Never fails.
     * @param offset The distance from the current position (0 is the current character).
     * @return The character at {@code pos + offset}, or empty if that is outside the source.
     */
    public Optional<Character> peek(int offset) {
        long target = (long) pos + offset;
        if (target < 0 || target >= source.length()) {
            return Optional.empty();
        }
        return Optional.of(source.charAt((int) target));
    }

    /**
     * Checks the current character without failing at the end of the source.
     * @param expected The character to compare with.
     * @return {@code true} if not at EOF and the current character equals {@code expected}.
     */
    public boolean is(char expected) {
        return !isEof() && source.charAt(pos) == expected;
    }

    /**
     * Checks the character at {@code pos + offset} without failing.
     * @param offset   The lookahead distance.
     * @param expected The character to compare with.
     * @return {@code true} if that character exists and equals {@code expected}.
     */
    public boolean isAt(int offset, char expected) {
        return peek(offset).map(c -> c == expected).orElse(false);
    }

    /**
     * @return A cursor one character further, clamped at the end of the source.
     */
    public Cursor advance() {
        return advance(1);
    }

    /**
     * Moves forward by {@code count} characters, clamped at the end of the source.
     * @param count The number of characters to skip, must not be negative.
     * @return The new cursor; its position is never smaller than this one's.
     */
    public Cursor advance(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Cannot advance by a negative count: " + count);
        }
        long target = Math.min((long) pos + count, source.length());
        return target == pos ? this : new Cursor(source, (int) target);
    }

    /**
     * @param from Start offset, inclusive.
     * @param to   End offset, exclusive.
     * @return The source text between the two offsets.
     */
    public String slice(int from, int to) {
        return source.substring(from, to);
    }

    /**
     * @param to End offset, exclusive.
     * @return The source text from the current position up to {@code to}.
     */
    public String sliceTo(int to) {
        return source.substring(pos, to);
    }

    /**
     * Computes the 1-based line and column of this position.
     * This scans the source from the beginning and is meant for diagnostics only.
     *
     * @return The line and column.
     */
    public LineCol lineCol() {
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < pos; i++) {
            char c = source.charAt(i);
            if (c == '\n') {
                line++;
                lineStart = i + 1;
            } else if (c == '\r' && (i + 1 >= source.length() || source.charAt(i + 1) != '\n')) {
                line++;
                lineStart = i + 1;
            }
        }
        return new LineCol(line, pos - lineStart + 1);
    }

    @Override
    public String toString() {
        return "Cursor[pos=" + pos + ", length=" + source.length() + "]";
    }

    /**
     * A 1-based line and column pair.
     *
     * @param line   The line number.
     * @param column The column number.
     */
    public record LineCol(int line, int column) {
    }
}
