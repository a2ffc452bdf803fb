package org.javai.retry;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * Classifies the error of a failed {@link Outcome} by type.
 *
 * <p>The three checks are mutually exclusive for errors returned by {@link Retrier}. The retry
 * wrappers are searched for along the whole cause chain, while cancellation is judged on the
 * top-level error only, since a cancellation raised inside an attempt ends up as the cause of an
 * unretryable or exhausted error.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * if (result instanceof Outcome.Fail<Order> fail) {
 *     if (RetryErrors.isCancelled(fail.error())) {
 *         // shutting down
 *     } else if (RetryErrors.isExhausted(fail.error())) {
 *         // give up for now, try again later
 *     }
 * }
 * }</pre>
 */
public final class RetryErrors {

    private RetryErrors() {
        // Utility class
    }

    /**
     * Whether the error is, or was caused by, an {@link UnretryableException}.
     */
    public static boolean isUnretryable(Throwable error) {
        return find(error, UnretryableException.class).isPresent();
    }

    /**
     * Whether the error is, or was caused by, a {@link RetriesExhaustedException}.
     */
    public static boolean isExhausted(Throwable error) {
        return find(error, RetriesExhaustedException.class).isPresent();
    }

    /**
     * Whether the error itself comes from a cancellation signal or from the retrying thread being
     * interrupted. Causes are not inspected.
     */
    public static boolean isCancelled(Throwable error) {
        return error instanceof CancellationException || error instanceof InterruptedException;
    }

    /**
     * Returns the first throwable in the cause chain of {@code error} (starting with {@code error}
     * itself) that is an instance of {@code type}.
     */
    public static <E extends Throwable> Optional<E> find(Throwable error, Class<E> type) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable current = error; current != null && seen.add(current); current = current.getCause()) {
            if (type.isInstance(current)) {
                return Optional.of(type.cast(current));
            }
        }
        return Optional.empty();
    }
}
