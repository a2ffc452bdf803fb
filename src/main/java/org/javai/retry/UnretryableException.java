package org.javai.retry;

import java.util.Objects;

/**
 * Marks a failure as final: the retry sequence stopped here deliberately.
 *
 * <p>The retrier produces this when its {@link RetryPredicate} rejects a failure. An operation
 * may also throw it itself to mark its own error as not worth retrying; combined with
 * {@link RetryPredicate#notMarkedUnretryable()} the retrier then stops at once.</p>
 */
public final class UnretryableException extends RetryException {

    public UnretryableException(Throwable cause) {
        super("unretryable error: " + Objects.requireNonNull(cause, "cause must not be null"), cause);
    }

    /**
     * Wraps {@code cause}, or returns it unchanged if it already is an {@code UnretryableException}.
     */
    public static UnretryableException of(Throwable cause) {
        if (cause instanceof UnretryableException unretryable) {
            return unretryable;
        }
        return new UnretryableException(cause);
    }
}
