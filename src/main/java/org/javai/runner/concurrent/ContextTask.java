package org.javai.runner.concurrent;

/**
 * A unit of work that cooperates with cancellation through the context it is given.
 */
@FunctionalInterface
public interface ContextTask {

    void run(RunContext ctx) throws Exception;
}
