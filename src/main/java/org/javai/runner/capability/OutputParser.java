package org.javai.runner.capability;

/**
 * Turns captured analysis output into a caller-defined structure.
 * The runner never interprets output itself.
 *
 * @param <T> the parsed type
 */
@FunctionalInterface
public interface OutputParser<T> {

    T parse(String output) throws Exception;
}
