package org.javai.retry.backoff;

import java.time.Duration;

/**
 * Grows the delay by a constant step per attempt: {@code base + attempt * step}.
 *
 * <p>When {@code max} is positive the computed delay is clamped to it before jitter is
 * applied, so a jittered delay may exceed {@code max} by up to the jitter fraction.</p>
 *
 * @param base the delay after the first failed attempt
 * @param step added for each further attempt
 * @param max upper bound for the un-jittered delay; {@link Duration#ZERO} means no bound
 * @param jitter random variation as a fraction of the computed delay; values outside (0, 1) disable it
 */
public record LinearBackoff(Duration base, Duration step, Duration max, double jitter) implements Backoff {

    public LinearBackoff {
        Jitter.requireNonNegative(base, "base");
        Jitter.requireNonNegative(step, "step");
        Jitter.requireNonNegative(max, "max");
        Jitter.requireFinite(jitter, "jitter");
    }

    /**
     * The default strategy used by {@link org.javai.retry.Retrier}: 1s, 2s, 3s, ... capped at 10s, ±10%.
     */
    public static LinearBackoff defaults() {
        return new LinearBackoff(Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ofSeconds(10), 0.1);
    }

    @Override
    public Duration next(int attempt) {
        Jitter.requireValidAttempt(attempt);
        Duration delay = Jitter.ofNanos(Jitter.nanos(base) + (double) attempt * Jitter.nanos(step));
        return Jitter.apply(Jitter.capped(delay, max), jitter);
    }
}
