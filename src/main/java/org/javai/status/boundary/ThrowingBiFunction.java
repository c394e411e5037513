package org.javai.status.boundary;

/**
 * A two-argument function that may throw a checked exception.
 *
 * @param <A> The first argument type
 * @param <B> The second argument type
 * @param <R> The result type
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingBiFunction<A, B, R, E extends Exception> {

    R apply(A first, B second) throws E;
}
