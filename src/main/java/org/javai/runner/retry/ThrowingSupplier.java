package org.javai.runner.retry;

/**
 * A supplier that may throw a checked exception.
 *
 * @param <T> the type of value supplied
 * @param <E> the type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
