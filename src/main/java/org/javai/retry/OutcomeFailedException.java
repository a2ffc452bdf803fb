package org.javai.retry;

/**
 * Thrown when {@link Outcome#getOrThrow()} is called on a failed outcome whose error is a
 * checked exception. This is an unchecked exception because it indicates misuse of the API:
 * the caller should have checked {@link Outcome#isFail()} first or used pattern matching.
 */
public class OutcomeFailedException extends RuntimeException {

    public OutcomeFailedException(Throwable error) {
        super("Outcome failed: " + error, error);
    }
}
