package org.javai.status.boundary;

/**
 * A supplier that may throw a checked exception.
 * Used by {@link StatusAdapter} to wrap code that still reports failure by throwing.
 *
 * @param <T> The type of value supplied
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
