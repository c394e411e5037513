package org.javai.status.boundary;

/**
 * A side-effecting operation that may throw a checked exception.
 *
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingRunnable<E extends Exception> {

    void run() throws E;
}
