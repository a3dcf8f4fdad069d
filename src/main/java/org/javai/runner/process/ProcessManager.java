package org.javai.runner.process;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.runner.RunnerError;
import org.javai.runner.RunnerException;
import org.javai.runner.concurrent.RunContext;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry of live subprocesses keyed by caller-chosen id.
 *
 * <p>The registry is guarded by a read/write lock. Handles are always stopped outside the
 * lock, so a slow process never blocks lookups.</p>
 */
public class ProcessManager {

    private static final Logger logger = LogManager.getLogger(ProcessManager.class);

    public static final Duration DEFAULT_GRACE = Duration.ofSeconds(5);

    private final String binary;
    private final Path workDir;
    private final long maxOutputBytes;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Subprocess> processes = new HashMap<>();

    public ProcessManager(String binary, Path workDir, long maxOutputBytes) {
        this.binary = Objects.requireNonNull(binary, "binary must not be null");
        this.workDir = workDir;
        this.maxOutputBytes = maxOutputBytes;
    }

    /**
     * Starts a subprocess and registers it under {@code id}.
     *
     * @throws RunnerException {@link RunnerError#PROCESS_ALREADY_RUN} if a live process is
     *         already registered under {@code id}, or any failure from {@link Subprocess#start}
     */
    public Subprocess start(RunContext ctx, String id, List<String> args) throws RunnerException {
        Subprocess process = Subprocess.builder(binary)
                .args(args)
                .workDir(workDir)
                .maxOutputBytes(maxOutputBytes)
                .build();

        lock.writeLock().lock();
        try {
            Subprocess existing = processes.get(id);
            if (existing != null && existing.isRunning()) {
                throw new RunnerException(RunnerError.PROCESS_ALREADY_RUN,
                        "process " + id + " is already running");
            }
            processes.put(id, process);
        } finally {
            lock.writeLock().unlock();
        }

        try {
            process.start(ctx);
        } catch (RunnerException e) {
            remove(id, process);
            throw e;
        }
        return process;
    }

    public Optional<Subprocess> get(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(processes.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isRunning(String id) {
        return get(id).map(Subprocess::isRunning).orElse(false);
    }

    public int size() {
        lock.readLock().lock();
        try {
            return processes.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Unregisters {@code id} and asks its process to terminate. Unknown ids are ignored.
     */
    public void stop(String id) {
        Subprocess process;
        lock.writeLock().lock();
        try {
            process = processes.remove(id);
        } finally {
            lock.writeLock().unlock();
        }
        if (process != null) {
            process.stop();
        }
    }

    public int stopAll() {
        return stopAll(DEFAULT_GRACE);
    }

    /**
     * Stops every registered process, waits up to {@code grace} for them to exit, then
     * force-kills whatever is left. Every handle is dealt with before the first stop
     * failure, if any, is rethrown.
     *
     * @return how many processes had to be force-killed
     */
    public int stopAll(Duration grace) {
        List<Subprocess> snapshot;
        lock.writeLock().lock();
        try {
            snapshot = new ArrayList<>(processes.values());
            processes.clear();
        } finally {
            lock.writeLock().unlock();
        }
        if (snapshot.isEmpty()) {
            return 0;
        }

        RuntimeException firstStopError = null;
        for (Subprocess process : snapshot) {
            try {
                process.stop();
            } catch (RuntimeException e) {
                logger.warn("Failed to stop {}: {}", process, e.getMessage());
                if (firstStopError == null) {
                    firstStopError = e;
                }
            }
        }

        long deadline = System.nanoTime() + grace.toNanos();
        boolean interrupted = false;
        int killed = 0;
        for (Subprocess process : snapshot) {
            long left = Math.max(0, deadline - System.nanoTime());
            boolean exited = false;
            if (!interrupted) {
                try {
                    exited = process.awaitExit(Duration.ofNanos(left));
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            if (!exited && process.isRunning()) {
                process.kill();
                killed++;
            }
        }

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        if (killed > 0) {
            logger.warn("Force-killed {} of {} process(es) after {} ms grace", killed, snapshot.size(),
                    TimeUnit.NANOSECONDS.toMillis(grace.toNanos()));
        }
        if (firstStopError != null) {
            throw firstStopError;
        }
        return killed;
    }

    private void remove(String id, Subprocess expected) {
        lock.writeLock().lock();
        try {
            processes.remove(id, expected);
        } finally {
            lock.writeLock().unlock();
        }
    }
}
