package org.javai.retry;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The terminal result of a retried operation.
 * Either {@link Ok} containing the value of the successful attempt, or {@link Fail} containing
 * the error that ended the retry sequence.
 *
 * <p>A {@code Fail} always carries one of three kinds of error, distinguishable with
 * {@link RetryErrors}:</p>
 * <ul>
 *   <li>{@link UnretryableException} - the retry predicate rejected a failure</li>
 *   <li>{@link RetriesExhaustedException} - the attempt limit was reached</li>
 *   <li>the cancellation signal's own error, passed through unchanged</li>
 * </ul>
 *
 * @param <T> The type of the successful value
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Fail {

    /**
     * A successful outcome containing a value.
     *
     * @param value the successful value (may be null, e.g. for {@code Outcome<Void>})
     */
    record Ok<T>(T value) implements Outcome<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public boolean isFail() {
            return false;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            return value;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public Outcome<T> recover(Function<? super Throwable, ? extends T> recovery) {
            return this;
        }
    }

    /**
     * A failed outcome containing the terminal error.
     *
     * @param error the error that ended the retry sequence
     */
    record Fail<T>(Throwable error) implements Outcome<T> {

        /**
         * Canonical constructor with validation.
         */
        public Fail {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public boolean isFail() {
            return true;
        }

        /**
         * Rethrows the error if it is unchecked, otherwise throws an {@link OutcomeFailedException}
         * caused by it.
         */
        @Override
        public T getOrThrow() {
            if (error instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new OutcomeFailedException(error);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.get();
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Fail<>(error);
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            return new Fail<>(error);
        }

        @Override
        public Outcome<T> recover(Function<? super Throwable, ? extends T> recovery) {
            Objects.requireNonNull(recovery);
            return new Ok<>(recovery.apply(error));
        }
    }

    // Query methods
    boolean isOk();
    boolean isFail();

    // Value extraction
    T getOrThrow();
    T getOrElse(T defaultValue);
    T getOrElseGet(Supplier<? extends T> supplier);

    // Transformations
    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);
    <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper);

    // Recovery
    Outcome<T> recover(Function<? super Throwable, ? extends T> recovery);

    // Static factories
    static Outcome<Void> ok() {
        return new Ok<>(null);
    }

    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> fail(Throwable error) {
        return new Fail<>(error);
    }
}
