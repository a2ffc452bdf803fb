package org.javai.retry.backoff;

import java.time.Duration;

/**
 * Waits the same interval after every attempt.
 *
 * @param interval the delay between attempts
 * @param jitter random variation as a fraction of {@code interval} (e.g. 0.2 = ±20%);
 *               values outside (0, 1) disable jitter
 */
public record FixedBackoff(Duration interval, double jitter) implements Backoff {

    public FixedBackoff {
        Jitter.requireNonNegative(interval, "interval");
        Jitter.requireFinite(jitter, "jitter");
    }

    /**
     * Creates a fixed backoff without jitter.
     */
    public static FixedBackoff of(Duration interval) {
        return new FixedBackoff(interval, 0);
    }

    @Override
    public Duration next(int attempt) {
        Jitter.requireValidAttempt(attempt);
        return Jitter.apply(interval, jitter);
    }
}
