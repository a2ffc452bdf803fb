package org.javai.retry;

/**
 * Base type of the errors a {@link Retrier} produces itself. The failure of the operation is
 * always available through {@link #getCause()}.
 */
public abstract sealed class RetryException extends RuntimeException
        permits UnretryableException, RetriesExhaustedException {

    protected RetryException(String message, Throwable cause) {
        super(message, cause);
    }
}
