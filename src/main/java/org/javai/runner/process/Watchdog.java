package org.javai.runner.process;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.runner.RunnerError;
import org.javai.runner.RunnerException;
import org.javai.runner.concurrent.RunContext;
import org.javai.runner.concurrent.RunnerThreads;
import org.javai.runner.ops.OpReporter;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Enforces a hard time limit on a running subprocess.
 *
 * <p>When the limit passes while the process is still running, it is force-killed and
 * the wait fails with {@link RunnerError#TIMEOUT}. Timeouts are counted apart from other
 * failures and announced to the registered listeners and the reporter.</p>
 */
public class Watchdog implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(Watchdog.class);

    private final ScheduledExecutorService scheduler =
            Executors.newSingleThreadScheduledExecutor(RunnerThreads.factory("watchdog"));
    private final OpReporter reporter;
    private final AtomicLong timeouts = new AtomicLong();
    private final List<Consumer<Subprocess>> timeoutListeners = new CopyOnWriteArrayList<>();

    public Watchdog(OpReporter reporter) {
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    public Watchdog onTimeout(Consumer<Subprocess> listener) {
        timeoutListeners.add(listener);
        return this;
    }

    /**
     * Waits for {@code process} to exit, killing it if it is still running after
     * {@code timeout}.
     *
     * @return the process's standard output
     * @throws RunnerException {@link RunnerError#CANCELLED} if the watchdog was closed, after
     *         killing the process
     */
    public String awaitExit(RunContext ctx, Subprocess process, Duration timeout) throws RunnerException {
        AtomicBoolean fired = new AtomicBoolean();
        ScheduledFuture<?> killer;
        try {
            killer = scheduler.schedule(() -> {
                if (process.isRunning()) {
                    fired.set(true);
                    process.kill();
                }
            }, timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            // closed by a concurrent shutdown
            process.kill();
            throw new RunnerException(RunnerError.CANCELLED,
                    "watchdog is closed, killed pid " + process.pid(), e);
        }

        try {
            return process.waitFor(ctx);
        } catch (RunnerException e) {
            if (fired.get()) {
                recordTimeout(process, timeout);
                throw new RunnerException(RunnerError.TIMEOUT,
                        "watchdog killed pid " + process.pid() + " after " + timeout.toMillis() + " ms", e);
            }
            if (RunnerException.hasKind(e, RunnerError.TIMEOUT)) {
                recordTimeout(process, timeout);
            }
            throw e;
        } finally {
            killer.cancel(false);
        }
    }

    public long timeoutCount() {
        return timeouts.get();
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }

    private void recordTimeout(Subprocess process, Duration timeout) {
        timeouts.incrementAndGet();
        logger.warn("{} timed out (limit {} ms)", process, timeout.toMillis());
        reporter.reportTimeout(process.binary() + "#" + process.pid(), timeout);
        for (Consumer<Subprocess> listener : timeoutListeners) {
            try {
                listener.accept(process);
            } catch (RuntimeException e) {
                logger.warn("Timeout listener failed: {}", e.getMessage(), e);
            }
        }
    }
}
