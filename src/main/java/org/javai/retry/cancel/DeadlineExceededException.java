package org.javai.retry.cancel;

import java.time.Instant;
import java.util.concurrent.CancellationException;

/**
 * The cancellation error of a {@link CancellationToken} whose deadline passed.
 */
public class DeadlineExceededException extends CancellationException {

    private final Instant deadline;

    public DeadlineExceededException(Instant deadline) {
        super("deadline exceeded: " + deadline);
        this.deadline = deadline;
    }

    public Instant deadline() {
        return deadline;
    }
}
