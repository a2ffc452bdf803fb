package org.javai.retry.ops;

import java.time.Duration;

/**
 * Reports retry lifecycle events for observability and operator notification.
 * Implementations might emit metrics, structured logs, or alerts.
 *
 * <p>All methods default to no-ops so implementations can pick the events they care about.</p>
 */
public interface RetryReporter {

    /**
     * Reports a retryable failure that will be followed by another attempt.
     *
     * @param operation The name of the retried operation
     * @param attempt The zero-based index of the attempt that failed
     * @param error The failure
     * @param delay How long the retrier will wait before the next attempt
     */
    default void reportRetryAttempt(String operation, int attempt, Throwable error, Duration delay) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that the attempt limit was reached.
     *
     * @param operation The name of the retried operation
     * @param attempts The total number of attempts made
     * @param error The failure of the last attempt
     */
    default void reportRetriesExhausted(String operation, int attempts, Throwable error) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports a failure the retry predicate rejected.
     *
     * @param operation The name of the retried operation
     * @param attempt The zero-based index of the attempt that failed
     * @param error The failure
     */
    default void reportUnretryable(String operation, int attempt, Throwable error) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that the cancellation signal stopped the sequence.
     *
     * @param operation The name of the retried operation
     * @param attempts The number of attempts made before cancellation was observed
     * @param error The cancellation error
     */
    default void reportCancelled(String operation, int attempts, Throwable error) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static RetryReporter noOp() {
        return NoOp.INSTANCE;
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static RetryReporter composite(RetryReporter... reporters) {
        return CompositeRetryReporter.of(reporters);
    }

    /** Singleton for {@link #noOp()}. */
    enum NoOp implements RetryReporter {
        INSTANCE
    }
}
