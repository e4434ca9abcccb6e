package org.ftlbuffer.diagnostics;

import java.util.Objects;

/**
 * The result of an operation that either produces a value or fails with a diagnostic.
 * Used on paths where failure is expected and must not be signalled with an exception.
 *
 * @param <T> The value type.
 */
public sealed interface Outcome<T> permits Outcome.Value, Outcome.Failure {

    static <T> Outcome<T> of(T value) {
        return new Value<>(value);
    }

    static <T> Outcome<T> failure(Diagnostic diagnostic) {
        return new Failure<>(diagnostic);
    }

    boolean isFailure();

    /**
     * @param value The produced value, may be {@code null}.
     * @param <T>   The value type.
     */
    record Value<T>(T value) implements Outcome<T> {
        @Override
        public boolean isFailure() {
            return false;
        }
    }

    /**
     * @param diagnostic Why the operation failed.
     * @param <T>        The value type the operation would have produced.
     */
    record Failure<T>(Diagnostic diagnostic) implements Outcome<T> {
        public Failure {
            Objects.requireNonNull(diagnostic, "diagnostic");
        }

        @Override
        public boolean isFailure() {
            return true;
        }

        /**
         * @param <U> The new value type.
         * @return This failure with a different type parameter.
         */
        public <U> Outcome<U> retype() {
            return new Failure<>(diagnostic);
        }
    }
}
