package org.javai.retry;

import java.util.Objects;

/**
 * Every allowed attempt failed with a retryable error. The cause is the failure of the last attempt.
 */
public final class RetriesExhaustedException extends RetryException {

    private final int attempts;

    public RetriesExhaustedException(int attempts, Throwable lastFailure) {
        super("all " + attempts + " attempts failed: "
                + Objects.requireNonNull(lastFailure, "lastFailure must not be null"), lastFailure);
        this.attempts = attempts;
    }

    /**
     * The number of attempts made.
     */
    public int attempts() {
        return attempts;
    }
}
