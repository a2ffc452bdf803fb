package org.javai.retry.backoff;

import java.time.Duration;

/**
 * Multiplies the delay by a constant factor per attempt: {@code base * factor^attempt}.
 *
 * <p>Attempt 0 always yields exactly {@code base}. When {@code max} is positive the computed
 * delay is clamped to it before jitter is applied.</p>
 *
 * @param base the delay after the first failed attempt
 * @param factor the multiplier per attempt (e.g. 2.0)
 * @param max upper bound for the un-jittered delay; {@link Duration#ZERO} means no bound
 * @param jitter random variation as a fraction of the computed delay; values outside (0, 1) disable it
 */
public record ExponentialBackoff(Duration base, double factor, Duration max, double jitter) implements Backoff {

    public ExponentialBackoff {
        Jitter.requireNonNegative(base, "base");
        Jitter.requireFinite(factor, "factor");
        if (factor < 0) {
            throw new IllegalArgumentException("factor must not be negative, was: " + factor);
        }
        Jitter.requireNonNegative(max, "max");
        Jitter.requireFinite(jitter, "jitter");
    }

    /**
     * Doubling backoff without jitter.
     */
    public static ExponentialBackoff doubling(Duration base, Duration max) {
        return new ExponentialBackoff(base, 2.0, max, 0);
    }

    @Override
    public Duration next(int attempt) {
        Jitter.requireValidAttempt(attempt);
        Duration delay = attempt == 0
                ? base
                : Jitter.ofNanos(Jitter.nanos(base) * Math.pow(factor, attempt));
        return Jitter.apply(Jitter.capped(delay, max), jitter);
    }
}
