package org.javai.retry;

import java.util.List;
import java.util.Objects;

/**
 * Decides whether a failed attempt should be followed by another one.
 * Implementations should be pure and must not throw.
 */
@FunctionalInterface
public interface RetryPredicate {

    /**
     * @param error the failure of the attempt that just ran
     * @return {@code true} to retry, {@code false} to stop with an {@link UnretryableException}
     */
    boolean isRetryable(Throwable error);

    /**
     * Returns a predicate that retries only when both this and {@code other} agree.
     */
    default RetryPredicate and(RetryPredicate other) {
        Objects.requireNonNull(other, "other must not be null");
        return error -> isRetryable(error) && other.isRetryable(error);
    }

    /**
     * Returns a predicate that retries when either this or {@code other} says so.
     */
    default RetryPredicate or(RetryPredicate other) {
        Objects.requireNonNull(other, "other must not be null");
        return error -> isRetryable(error) || other.isRetryable(error);
    }

    default RetryPredicate negate() {
        return error -> !isRetryable(error);
    }

    /**
     * Retries every failure. This is the default.
     */
    static RetryPredicate always() {
        return error -> true;
    }

    /**
     * Never retries: the first failure ends the sequence.
     */
    static RetryPredicate never() {
        return error -> false;
    }

    /**
     * Retries only failures that are instances of one of the given types.
     */
    @SafeVarargs
    static RetryPredicate retryOn(Class<? extends Throwable>... types) {
        List<Class<? extends Throwable>> retryable = List.of(types);
        return error -> retryable.stream().anyMatch(type -> type.isInstance(error));
    }

    /**
     * Retries everything except failures that are instances of one of the given types.
     */
    @SafeVarargs
    static RetryPredicate abortOn(Class<? extends Throwable>... types) {
        return retryOn(types).negate();
    }

    /**
     * Retries everything except failures the operation already marked with
     * {@link UnretryableException} somewhere in their cause chain.
     */
    static RetryPredicate notMarkedUnretryable() {
        return error -> !RetryErrors.isUnretryable(error);
    }
}
