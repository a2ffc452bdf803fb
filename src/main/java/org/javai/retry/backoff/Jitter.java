package org.javai.retry.backoff;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Shared arithmetic for the backoff records.
 */
final class Jitter {

    /** Longest duration whose nanosecond count still fits in a long. */
    static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

    private static final DoubleSupplier RANDOM = () -> ThreadLocalRandom.current().nextDouble();

    private Jitter() {
        // Utility class
    }

    /**
     * Applies jitter using a thread-safe random source.
     */
    static Duration apply(Duration delay, double jitter) {
        return apply(delay, jitter, RANDOM);
    }

    /**
     * Multiplies {@code delay} by {@code 1 + δ}, with δ uniform in {@code [-jitter, +jitter]}.
     * A jitter outside the open interval (0, 1) leaves the delay unchanged.
     *
     * @param random supplies values in [0, 1)
     */
    static Duration apply(Duration delay, double jitter, DoubleSupplier random) {
        if (!enabled(jitter)) {
            return delay;
        }
        double delta = (random.getAsDouble() * 2 - 1) * jitter;
        return ofNanos(nanos(delay) * (1 + delta));
    }

    static boolean enabled(double jitter) {
        return jitter > 0 && jitter < 1;
    }

    /**
     * Converts a (possibly huge) nanosecond value back to a Duration, saturating at {@link #MAX_NANOS}.
     */
    static Duration ofNanos(double nanos) {
        if (nanos <= 0) {
            return Duration.ZERO;
        }
        // A double above Long.MAX_VALUE narrows to Long.MAX_VALUE.
        return Duration.ofNanos((long) nanos);
    }

    static double nanos(Duration duration) {
        return duration.compareTo(MAX_NANOS) >= 0 ? Long.MAX_VALUE : duration.toNanos();
    }

    static Duration capped(Duration delay, Duration max) {
        return !max.isZero() && delay.compareTo(max) > 0 ? max : delay;
    }

    static Duration requireNonNegative(Duration duration, String name) {
        Objects.requireNonNull(duration, name + " must not be null");
        if (duration.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative, was: " + duration);
        }
        return duration;
    }

    static void requireFinite(double value, String name) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must be finite, was: " + value);
        }
    }

    static void requireValidAttempt(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, was: " + attempt);
        }
    }
}
