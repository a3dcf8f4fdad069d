package org.javai.runner.concurrent;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Named daemon threads for the runner's helpers: pipe drains, exit watchers, pools.
 *
 * <p>A thread that dies from an uncaught exception has hit a defect. The handler installed
 * here logs it before the thread terminates so it is never lost silently.</p>
 *
 * <pre>{@code
 * ExecutorService pool = Executors.newCachedThreadPool(RunnerThreads.factory("runner-task"));
 * }</pre>
 */
public final class RunnerThreads {

    private static final Logger logger = LogManager.getLogger(RunnerThreads.class);

    private static final UncaughtExceptionHandler LOGGING_HANDLER = (thread, throwable) ->
            logger.error("Uncaught exception in thread {}", thread.getName(), throwable);

    private RunnerThreads() {
    }

    /**
     * Creates a factory producing daemon threads named {@code prefix-1}, {@code prefix-2}, ...
     */
    public static ThreadFactory factory(String namePrefix) {
        return new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable runnable) {
                return daemon(namePrefix + "-" + counter.incrementAndGet(), runnable);
            }
        };
    }

    /**
     * Creates (but does not start) a single named daemon thread.
     */
    public static Thread daemon(String name, Runnable runnable) {
        Thread thread = new Thread(runnable, name);
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler(LOGGING_HANDLER);
        return thread;
    }
}
