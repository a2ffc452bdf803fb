package org.javai.retry.cancel;

import java.time.Duration;
import java.util.concurrent.CancellationException;

/**
 * An externally owned notification that an operation should stop: an explicit abort or a
 * passed deadline.
 *
 * <p>The retrier only observes a signal; it never cancels one. Implementations must be safe
 * to poll and await from any thread.</p>
 */
public interface CancellationSignal {

    /**
     * Returns the error describing why cancellation happened, or {@code null} while the
     * signal has not fired. Once non-null, the same instance is returned on every call.
     */
    CancellationException error();

    /**
     * Polls the signal.
     */
    default boolean isCancelled() {
        return error() != null;
    }

    /**
     * Blocks until the signal fires or {@code timeout} elapses, whichever comes first.
     *
     * @param timeout the longest time to wait
     * @return {@code true} if the signal fired, {@code false} if the timeout elapsed first
     * @throws InterruptedException if the waiting thread is interrupted
     */
    boolean await(Duration timeout) throws InterruptedException;

    /**
     * A signal that never fires. Awaiting it simply sleeps for the timeout.
     */
    static CancellationSignal never() {
        return NeverCancelled.INSTANCE;
    }
}
