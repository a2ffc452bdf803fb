package org.javai.retry.cancel;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A caller-owned {@link CancellationSignal}, optionally bound to a deadline.
 *
 * <p>The first call to {@link #cancel(String)} (or the deadline passing, whichever happens
 * first) decides the error; later calls have no effect. Threads blocked in
 * {@link #await(Duration)} wake up as soon as the token is cancelled.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * CancellationToken token = CancellationToken.withTimeout(Duration.ofSeconds(30));
 * Outcome<Order> result = retrier.execute(token, attempt -> orders.fetch(id));
 *
 * // From another thread, on shutdown:
 * token.cancel("shutting down");
 * }</pre>
 */
public final class CancellationToken implements CancellationSignal {

    private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

    private final AtomicReference<CancellationException> error = new AtomicReference<>();
    private final CountDownLatch fired = new CountDownLatch(1);
    private final Instant deadline;
    private final Clock clock;

    private CancellationToken(Instant deadline, Clock clock) {
        this.deadline = deadline;  // null means no deadline
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Creates a token that fires only when {@link #cancel()} is called.
     */
    public static CancellationToken create() {
        return new CancellationToken(null, Clock.systemUTC());
    }

    /**
     * Creates a token that fires once {@code timeout} has elapsed from now.
     */
    public static CancellationToken withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        Clock clock = Clock.systemUTC();
        return new CancellationToken(clock.instant().plus(timeout), clock);
    }

    /**
     * Creates a token that fires at {@code deadline}.
     */
    public static CancellationToken withDeadline(Instant deadline) {
        return withDeadline(deadline, Clock.systemUTC());
    }

    /**
     * Creates a token that fires at {@code deadline} as observed through {@code clock}.
     */
    public static CancellationToken withDeadline(Instant deadline, Clock clock) {
        Objects.requireNonNull(deadline, "deadline must not be null");
        return new CancellationToken(deadline, clock);
    }

    /**
     * Cancels the token with a generic reason.
     *
     * @return {@code true} if this call cancelled the token, {@code false} if it was already cancelled
     */
    public boolean cancel() {
        return cancel("cancelled");
    }

    /**
     * Cancels the token.
     *
     * @param reason included in the message of the resulting {@link CancellationException}
     * @return {@code true} if this call cancelled the token, {@code false} if it was already cancelled
     */
    public boolean cancel(String reason) {
        return fire(new CancellationException(reason));
    }

    @Override
    public CancellationException error() {
        CancellationException current = error.get();
        if (current == null && deadlinePassed()) {
            fireDeadline();
            return error.get();
        }
        return current;
    }

    @Override
    public boolean await(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (isCancelled()) {
            return true;
        }
        Duration wait = timeout;
        if (deadline != null) {
            Duration untilDeadline = Duration.between(clock.instant(), deadline);
            if (untilDeadline.compareTo(wait) < 0) {
                wait = untilDeadline;
            }
        }
        if (fired.await(saturatedNanos(wait), TimeUnit.NANOSECONDS)) {
            return true;
        }
        return isCancelled();
    }

    /**
     * Returns the deadline, or {@code null} if the token has none.
     */
    public Instant deadline() {
        return deadline;
    }

    private boolean deadlinePassed() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    private void fireDeadline() {
        fire(new DeadlineExceededException(deadline));
    }

    private boolean fire(CancellationException cause) {
        if (error.compareAndSet(null, cause)) {
            fired.countDown();
            return true;
        }
        return false;
    }

    static long saturatedNanos(Duration duration) {
        if (duration.isNegative() || duration.isZero()) {
            return 0;
        }
        return duration.compareTo(MAX_NANOS) >= 0 ? Long.MAX_VALUE : duration.toNanos();
    }

    @Override
    public String toString() {
        CancellationException current = error.get();
        return "CancellationToken[" + (current == null ? "active" : current.getMessage())
                + (deadline == null ? "" : ", deadline=" + deadline) + "]";
    }
}
