package org.javai.railway.boundary;

/**
 * A function that may throw a checked exception.
 * Used by {@link Boundary} to wrap calls to operations that report failure by throwing.
 *
 * @param <T> The type of the input
 * @param <R> The type of the result
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingFunction<T, R, E extends Exception> {

    R apply(T input) throws E;
}
