package org.ftlbuffer.syntax.parser;

import org.ftlbuffer.syntax.Cursor;

import java.util.List;
import java.util.function.Function;

/**
 * The outcome of applying one grammar rule: either a value with the cursor after it, or an error.
 * <p>
 * A successful result always carries a cursor that lies strictly after the rule's start
 * position unless the rule is allowed to match the empty string (patterns, blanks).
 *
 * @param <T> The type of the parsed value.
 */
public sealed interface ParseResult<T> permits ParseResult.Success, ParseResult.Failure {

    static <T> ParseResult<T> success(T value, Cursor cursor) {
        return new Success<>(value, cursor);
    }

    static <T> ParseResult<T> failure(String message, Cursor cursor, String... expected) {
        return new Failure<>(new ParseError(message, cursor, List.of(expected)));
    }

    /**
     * @return The parsed value.
     * @throws IllegalStateException if this is a failure.
     */
    T value();

    /**
     * @return The cursor after the value, or the error position for a failure.
     */
    Cursor cursor();

    /**
     * @return The error.
     * @throws IllegalStateException if this is a success.
     */
    ParseError error();

    boolean isFailure();

    /**
     * Re-types a failure so that it can be returned from a rule producing a different value.
     * @param <U> The new value type.
     * @return This failure with a different type parameter.
     * @throws IllegalStateException if this is a success.
     */
    <U> ParseResult<U> propagate();

    /**
     * Transforms the value of a success, keeping its cursor. Failures pass through.
     * @param mapper The value transformation.
     * @param <U>    The new value type.
     * @return The mapped result.
     */
    <U> ParseResult<U> map(Function<? super T, ? extends U> mapper);

    record Success<T>(T value, Cursor cursor) implements ParseResult<T> {
        @Override
        public ParseError error() {
            throw new IllegalStateException("A successful parse result has no error");
        }

        @Override
        public boolean isFailure() {
            return false;
        }

        @Override
        public <U> ParseResult<U> propagate() {
            throw new IllegalStateException("Only failures can be propagated");
        }

        @Override
        public <U> ParseResult<U> map(Function<? super T, ? extends U> mapper) {
            return new Success<>(mapper.apply(value), cursor);
        }
    }

    record Failure<T>(ParseError error) implements ParseResult<T> {
        @Override
        public T value() {
            throw new IllegalStateException("Parse failed: " + error.message());
        }

        @Override
        public Cursor cursor() {
            return error.cursor();
        }

        @Override
        public boolean isFailure() {
            return true;
        }

        @Override
        public <U> ParseResult<U> propagate() {
            return new Failure<>(error);
        }

        @Override
        public <U> ParseResult<U> map(Function<? super T, ? extends U> mapper) {
            return new Failure<>(error);
        }
    }
}
