package org.javai.retry.backoff;

import java.time.Duration;

/**
 * Computes how long to wait before the next attempt.
 *
 * <p>Implementations are pure: the result depends only on the attempt index and the
 * strategy's own parameters, apart from an optional random jitter term. They hold no
 * mutable state and may be shared between retriers.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Backoff backoff = new ExponentialBackoff(Duration.ofMillis(100), 2.0, Duration.ofSeconds(5), 0.2);
 * Duration wait = backoff.next(0); // ~100ms
 * }</pre>
 */
@FunctionalInterface
public interface Backoff {

    /**
     * Returns the delay to wait after the given attempt failed.
     *
     * @param attempt the zero-based index of the attempt that just failed
     * @return a non-negative delay
     */
    Duration next(int attempt);

    /**
     * A strategy that never waits.
     */
    static Backoff none() {
        return attempt -> Duration.ZERO;
    }

    /**
     * Constant delay without jitter.
     */
    static Backoff fixed(Duration interval) {
        return new FixedBackoff(interval, 0);
    }

    /**
     * Linear delay without jitter.
     */
    static Backoff linear(Duration base, Duration step, Duration max) {
        return new LinearBackoff(base, step, max, 0);
    }

    /**
     * Exponential delay without jitter.
     */
    static Backoff exponential(Duration base, double factor, Duration max) {
        return new ExponentialBackoff(base, factor, max, 0);
    }
}
