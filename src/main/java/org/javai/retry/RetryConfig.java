package org.javai.retry;

import java.util.Objects;

import org.javai.retry.backoff.Backoff;
import org.javai.retry.backoff.LinearBackoff;

/**
 * The retry policy of a {@link Retrier}: how often to try, how long to wait in between,
 * and which failures are worth another attempt.
 *
 * @param maxAttempts the maximum number of attempts; 0 means retry until success, cancellation
 *                    or an unretryable failure
 * @param backoff the delay strategy between attempts
 * @param retryPredicate decides whether a failure is retried
 */
public record RetryConfig(int maxAttempts, Backoff backoff, RetryPredicate retryPredicate) {

    /** Default attempt limit. */
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    public RetryConfig {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0, was: " + maxAttempts);
        }
        Objects.requireNonNull(backoff, "backoff must not be null");
        Objects.requireNonNull(retryPredicate, "retryPredicate must not be null");
    }

    /**
     * Three attempts, {@link LinearBackoff#defaults() linear backoff}, every failure retried.
     */
    public static RetryConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Whether the sequence stops after a fixed number of attempts.
     */
    public boolean isBounded() {
        return maxAttempts > 0;
    }

    /**
     * Returns a copy with a different attempt limit.
     */
    public RetryConfig withMaxAttempts(int maxAttempts) {
        return new RetryConfig(maxAttempts, backoff, retryPredicate);
    }

    public static final class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Backoff backoff = LinearBackoff.defaults();
        private RetryPredicate retryPredicate = RetryPredicate.always();

        private Builder() {}

        /**
         * Sets the maximum number of attempts (default 3, 0 = unbounded).
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder backoff(Backoff backoff) {
            this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
            return this;
        }

        public Builder retryPredicate(RetryPredicate retryPredicate) {
            this.retryPredicate = Objects.requireNonNull(retryPredicate, "retryPredicate must not be null");
            return this;
        }

        /**
         * @throws IllegalArgumentException if maxAttempts is negative
         */
        public RetryConfig build() {
            return new RetryConfig(maxAttempts, backoff, retryPredicate);
        }
    }
}
