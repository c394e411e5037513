package org.javai.status.boundary;

/**
 * A one-argument function that may throw a checked exception.
 *
 * @param <A> The argument type
 * @param <R> The result type
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingFunction<A, R, E extends Exception> {

    R apply(A argument) throws E;
}
