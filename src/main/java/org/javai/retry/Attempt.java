package org.javai.retry;

/**
 * One try of a retried operation.
 * Returning normally is success; throwing is a failure handed to the {@link RetryPredicate}.
 *
 * @param <T> The type of value produced on success
 */
@FunctionalInterface
public interface Attempt<T> {

    /**
     * @param attempt the zero-based index of this attempt
     * @return the result of a successful attempt
     * @throws Exception if the attempt failed
     */
    T run(int attempt) throws Exception;
}
