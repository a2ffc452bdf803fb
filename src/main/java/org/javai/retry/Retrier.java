package org.javai.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;

import org.javai.retry.backoff.Backoff;
import org.javai.retry.cancel.CancellationSignal;
import org.javai.retry.ops.RetryReporter;

/**
 * Executes an operation repeatedly until it succeeds, the cancellation signal fires, the attempt
 * limit is reached, or a failure is judged unretryable.
 * Operates entirely over Outcome values. Failures of the operation never escape as exceptions.
 *
 * <p>Attempts run one after another on the calling thread. Between attempts the retrier waits
 * for the backoff delay or until the signal fires, whichever comes first.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Retrier retrier = Retrier.builder()
 *     .name("FetchUser")
 *     .maxAttempts(5)
 *     .backoff(new ExponentialBackoff(Duration.ofMillis(100), 2.0, Duration.ofSeconds(5), 0.2))
 *     .retryPredicate(new TransientExceptionPredicate())
 *     .reporter(new Log4jRetryReporter())
 *     .build();
 *
 * Outcome<User> result = retrier.execute(token, attempt -> userApi.fetch(userId));
 * }</pre>
 *
 * <p>A Retrier keeps no state between calls. Concurrent calls are safe as long as the configured
 * backoff, predicate and reporter are.</p>
 */
public final class Retrier {

    private static final String DEFAULT_NAME = "retry";

    private final RetryConfig config;
    private final String name;
    private final RetryReporter reporter;
    private final Waiter waiter;

    private Retrier(RetryConfig config, String name, RetryReporter reporter, Waiter waiter) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.waiter = Objects.requireNonNull(waiter, "waiter must not be null");
    }

    /**
     * Creates a builder for configuring a Retrier instance.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * A retrier with the {@link RetryConfig#defaults() default} policy.
     */
    public static Retrier withDefaults() {
        return builder().build();
    }

    /**
     * A retrier applying the given policy, without reporting.
     */
    public static Retrier of(RetryConfig config) {
        return builder().config(config).build();
    }

    /**
     * Builder for configuring a Retrier instance.
     *
     * <p>Unset values fall back to three attempts, {@link org.javai.retry.backoff.LinearBackoff#defaults()
     * linear backoff}, retrying every failure, and no reporting.</p>
     */
    public static final class Builder {
        private int maxAttempts = RetryConfig.DEFAULT_MAX_ATTEMPTS;
        private Backoff backoff;
        private RetryPredicate retryPredicate;
        private String name = DEFAULT_NAME;
        private RetryReporter reporter = RetryReporter.noOp();
        private Waiter waiter = CancellationSignal::await;

        private Builder() {}

        /**
         * Copies attempt limit, backoff and predicate from an existing policy.
         *
         * @param config the policy to apply
         * @return this builder
         */
        public Builder config(RetryConfig config) {
            Objects.requireNonNull(config, "config must not be null");
            this.maxAttempts = config.maxAttempts();
            this.backoff = config.backoff();
            this.retryPredicate = config.retryPredicate();
            return this;
        }

        /**
         * Sets the maximum number of attempts (default 3, 0 = unbounded).
         *
         * @param maxAttempts the attempt limit
         * @return this builder
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Sets the delay strategy between attempts.
         *
         * @param backoff the backoff strategy
         * @return this builder
         */
        public Builder backoff(Backoff backoff) {
            this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
            return this;
        }

        /**
         * Sets the predicate deciding which failures are retried (default: all).
         *
         * @param retryPredicate the retry predicate
         * @return this builder
         */
        public Builder retryPredicate(RetryPredicate retryPredicate) {
            this.retryPredicate = Objects.requireNonNull(retryPredicate, "retryPredicate must not be null");
            return this;
        }

        /**
         * Sets the operation name passed to the reporter (default "retry").
         *
         * @param name the operation name
         * @return this builder
         */
        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            return this;
        }

        /**
         * Sets the reporter for retry events (optional, defaults to no-op).
         *
         * @param reporter the reporter for retry events
         * @return this builder
         */
        public Builder reporter(RetryReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the waiter for testing (package-private).
         */
        Builder waiter(Waiter waiter) {
            this.waiter = Objects.requireNonNull(waiter, "waiter must not be null");
            return this;
        }

        /**
         * Builds the Retrier instance.
         *
         * @return a configured Retrier
         * @throws IllegalArgumentException if maxAttempts is negative
         */
        public Retrier build() {
            RetryConfig.Builder policy = RetryConfig.builder().maxAttempts(maxAttempts);
            if (backoff != null) {
                policy.backoff(backoff);
            }
            if (retryPredicate != null) {
                policy.retryPredicate(retryPredicate);
            }
            return new Retrier(policy.build(), name, reporter, waiter);
        }
    }

    /**
     * Runs the operation until it succeeds or the retry sequence ends.
     *
     * <p>The signal is polled before every attempt, the first included, and raced against the
     * backoff delay while waiting. An attempt already running is never interrupted.</p>
     *
     * <p>An {@link InterruptedException}, whether thrown by the operation or raised while waiting,
     * ends the sequence as a cancellation without consulting the predicate. The thread's interrupt
     * flag is restored.</p>
     *
     * @param signal the cancellation signal to observe
     * @param operation the operation, given the zero-based attempt index
     * @return {@code Ok} with the first successful value, or {@code Fail} with the cancellation
     *         error, an {@link UnretryableException} or a {@link RetriesExhaustedException}
     */
    public <T> Outcome<T> execute(CancellationSignal signal, Attempt<T> operation) {
        Objects.requireNonNull(signal, "signal must not be null");
        Objects.requireNonNull(operation, "operation must not be null");

        for (int attempt = 0; ; attempt = nextAttempt(attempt)) {
            CancellationException cancelled = signal.error();
            if (cancelled != null) {
                reporter.reportCancelled(name, attempt, cancelled);
                return Outcome.fail(cancelled);
            }

            Exception failure;
            try {
                return Outcome.ok(operation.run(attempt));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                reporter.reportCancelled(name, nextAttempt(attempt), e);
                return Outcome.fail(e);
            } catch (Exception e) {
                failure = e;
            }

            if (!config.retryPredicate().isRetryable(failure)) {
                reporter.reportUnretryable(name, attempt, failure);
                return Outcome.fail(UnretryableException.of(failure));
            }

            int attempts = nextAttempt(attempt);
            if (config.isBounded() && attempts >= config.maxAttempts()) {
                reporter.reportRetriesExhausted(name, attempts, failure);
                return Outcome.fail(new RetriesExhaustedException(attempts, failure));
            }

            Duration delay = config.backoff().next(attempt);
            reporter.reportRetryAttempt(name, attempt, failure, delay);
            try {
                if (waiter.await(signal, delay)) {
                    CancellationException cause = signal.error();
                    Throwable error = cause != null ? cause : new CancellationException("cancellation signal fired");
                    reporter.reportCancelled(name, attempts, error);
                    return Outcome.fail(error);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                reporter.reportCancelled(name, attempts, e);
                return Outcome.fail(e);
            }
        }
    }

    /**
     * Runs the operation under the given signal, returning the value or throwing the terminal error.
     * Convenient when the caller propagates failures as exceptions anyway.
     *
     * @throws RetryException if retries were exhausted or a failure was unretryable
     * @throws CancellationException if the signal fired
     * @throws OutcomeFailedException if the retrying thread was interrupted
     */
    public <T> T call(CancellationSignal signal, Attempt<T> operation) {
        return execute(signal, operation).getOrThrow();
    }

    public RetryConfig config() {
        return config;
    }

    public String name() {
        return name;
    }

    // === STATIC CONVENIENCE METHODS ===

    /**
     * Simple retry with the default backoff and predicate.
     *
     * @param signal the cancellation signal to observe
     * @param maxAttempts maximum number of attempts (0 = until success or cancellation)
     * @param operation the operation to run
     * @return the final Outcome after success or the end of the retry sequence
     * @throws IllegalArgumentException if maxAttempts is negative
     */
    public static <T> Outcome<T> attempt(CancellationSignal signal, int maxAttempts, Attempt<T> operation) {
        return builder().maxAttempts(maxAttempts).build().execute(signal, operation);
    }

    /**
     * The attempt index after {@code attempt}, held at {@link Integer#MAX_VALUE} in unbounded runs.
     */
    static int nextAttempt(int attempt) {
        return attempt == Integer.MAX_VALUE ? attempt : attempt + 1;
    }

    /**
     * Waits between attempts. Swappable for testing.
     */
    @FunctionalInterface
    interface Waiter {
        /**
         * @return {@code true} if the signal fired before the delay elapsed
         */
        boolean await(CancellationSignal signal, Duration delay) throws InterruptedException;
    }
}
