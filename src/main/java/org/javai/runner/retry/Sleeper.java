package org.javai.runner.retry;

import org.javai.runner.RunnerException;
import org.javai.runner.concurrent.RunContext;

import java.time.Duration;

/**
 * Waits between attempts. Replaced in tests to avoid real delays.
 */
@FunctionalInterface
interface Sleeper {

    /**
     * @throws RunnerException the context's error if it ends while sleeping
     */
    void sleep(RunContext ctx, Duration duration) throws RunnerException;

    static Sleeper contextual() {
        return RunContext::sleep;
    }
}
