package org.javai.runner.process;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.runner.RunnerError;
import org.javai.runner.RunnerException;
import org.javai.runner.concurrent.RunContext;
import org.javai.runner.concurrent.RunnerThreads;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Handle on one external analysis process.
 *
 * <p>The handle is single-use: {@link #start(RunContext)} may be called once. From the
 * moment the process starts, two daemon threads drain its standard output and standard
 * error into in-memory buffers, so nothing is lost if {@link #waitFor(RunContext)} is
 * called late. Buffers and process state are guarded by a handle-local read/write lock.</p>
 *
 * <pre>{@code
 * Subprocess process = Subprocess.builder("claude").args(List.of("-p")).build();
 * process.start(ctx);
 * process.writePrompt(prompt);
 * String output = process.waitFor(ctx);
 * }</pre>
 */
public final class Subprocess implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(Subprocess.class);

    private static final Duration READER_JOIN_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration KILL_SETTLE_TIMEOUT = Duration.ofSeconds(5);

    private final String binary;
    private final List<String> args;
    private final Path workDir;
    private final long maxOutputBytes;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ByteArrayOutputStream stdoutBuffer = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderrBuffer = new ByteArrayOutputStream();
    private boolean started;
    private Process process;
    private Thread stdoutReader;
    private Thread stderrReader;
    private IOException pipeError;
    private volatile boolean limitExceeded;

    private Subprocess(Builder builder) {
        this.binary = builder.binary;
        this.args = List.copyOf(builder.args);
        this.workDir = builder.workDir;
        this.maxOutputBytes = builder.maxOutputBytes;
    }

    public static Builder builder(String binary) {
        return new Builder(binary);
    }

    /**
     * Spawns the process with piped standard streams and starts draining its output.
     * If {@code ctx} ends while the process is alive, the process is killed.
     *
     * @throws RunnerException {@link RunnerError#CLAUDE_NOT_FOUND} if the binary cannot be
     *         located, {@link RunnerError#PROCESS_ALREADY_RUN} on a second call,
     *         {@link RunnerError#PROCESS_START_FAILED} if the OS refuses to spawn it
     */
    public void start(RunContext ctx) throws RunnerException {
        Process spawned;
        lock.writeLock().lock();
        try {
            if (started) {
                throw new RunnerException(RunnerError.PROCESS_ALREADY_RUN);
            }
            started = true;
            ctx.throwIfDone();

            Path executable = findExecutable(binary)
                    .orElseThrow(() -> new RunnerException(RunnerError.CLAUDE_NOT_FOUND,
                            RunnerError.CLAUDE_NOT_FOUND.defaultMessage() + ": " + binary));

            List<String> command = new ArrayList<>(args.size() + 1);
            command.add(executable.toString());
            command.addAll(args);

            ProcessBuilder builder = new ProcessBuilder(command);
            if (workDir != null) {
                builder.directory(workDir.toFile());
            }
            try {
                spawned = builder.start();
            } catch (IOException e) {
                throw new RunnerException(RunnerError.PROCESS_START_FAILED,
                        "failed to start " + executable + ": " + e.getMessage(), e);
            }
            process = spawned;
            stdoutReader = drain(spawned.getInputStream(), stdoutBuffer, "stdout", spawned.pid());
            stderrReader = drain(spawned.getErrorStream(), stderrBuffer, "stderr", spawned.pid());
        } finally {
            lock.writeLock().unlock();
        }

        Runnable killOnEnd = ctx.onDone(this::kill);
        spawned.onExit().thenRun(killOnEnd);
        logger.debug("Started {} with {} argument(s), pid {}", binary, args.size(), spawned.pid());
    }

    /**
     * Writes the prompt to standard input as UTF-8 and closes it, signalling end of input.
     */
    public void writePrompt(String prompt) throws RunnerException {
        Process p = requireStarted();
        try (OutputStream stdin = p.getOutputStream()) {
            stdin.write(prompt.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            if (!p.isAlive()) {
                // exited before consuming its input; the exit status tells the real story
                logger.debug("pid {} exited before reading its prompt: {}", p.pid(), e.getMessage());
                return;
            }
            throw new RunnerException(RunnerError.IO_FAILURE, "failed to write prompt: " + e.getMessage(), e);
        }
    }

    /**
     * Waits for the process to exit and returns everything it wrote to standard output.
     *
     * <p>If {@code ctx} is already done, or ends before the process exits, the process is
     * killed and a {@link RunnerError#TIMEOUT} failure is thrown.</p>
     *
     * @throws ProcessFailedException if the process exited with a non-zero status
     */
    public String waitFor(RunContext ctx) throws RunnerException {
        Process p = requireStarted();
        if (ctx.isDone()) {
            kill();
            throw timedOut(ctx);
        }

        CompletableFuture<Process> exit = p.onExit();
        CompletableFuture<Void> ended = new CompletableFuture<>();
        Runnable unregister = ctx.onDone(() -> ended.complete(null));
        try {
            CompletableFuture.anyOf(exit, ended).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            kill();
            throw new RunnerException(RunnerError.CANCELLED, "interrupted while waiting for pid " + p.pid(), e);
        } catch (ExecutionException e) {
            throw new RunnerException(RunnerError.IO_FAILURE, "failed waiting for pid " + p.pid(), e.getCause());
        } finally {
            unregister.run();
        }

        if (!exit.isDone() || (ctx.isDone() && p.exitValue() != 0)) {
            kill();
            settle(p);
            joinReaders();
            throw timedOut(ctx);
        }

        joinReaders();
        if (limitExceeded) {
            throw new RunnerException(RunnerError.RESOURCE_LIMIT_EXCEEDED,
                    RunnerError.RESOURCE_LIMIT_EXCEEDED.defaultMessage() + " of " + maxOutputBytes + " bytes");
        }
        int code = p.exitValue();
        if (code != 0) {
            throw new ProcessFailedException(code, stderr());
        }
        IOException readFailure = readPipeError();
        if (readFailure != null) {
            throw new RunnerException(RunnerError.IO_FAILURE, "failed reading output: " + readFailure.getMessage(), readFailure);
        }
        return stdout();
    }

    /**
     * Asks the process (and its children) to terminate. No-op if it is not running.
     */
    public void stop() {
        Process p = currentProcess();
        if (p == null || !p.isAlive()) {
            return;
        }
        p.descendants().forEach(ProcessHandle::destroy);
        p.destroy();
    }

    /**
     * Forcibly terminates the process and its descendants. No-op if it is not running.
     */
    public void kill() {
        Process p = currentProcess();
        if (p == null || !p.isAlive()) {
            return;
        }
        p.descendants().forEach(ProcessHandle::destroyForcibly);
        p.destroyForcibly();
        logger.debug("Killed pid {}", p.pid());
    }

    /**
     * Waits up to {@code timeout} for the process to exit.
     *
     * @return true if the process has exited (or was never started)
     */
    public boolean awaitExit(Duration timeout) throws InterruptedException {
        Process p = currentProcess();
        return p == null || p.waitFor(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public boolean isRunning() {
        Process p = currentProcess();
        return p != null && p.isAlive();
    }

    public boolean isStarted() {
        lock.readLock().lock();
        try {
            return started;
        } finally {
            lock.readLock().unlock();
        }
    }

    public String stdout() {
        lock.readLock().lock();
        try {
            return stdoutBuffer.toString(StandardCharsets.UTF_8);
        } finally {
            lock.readLock().unlock();
        }
    }

    public String stderr() {
        lock.readLock().lock();
        try {
            return stderrBuffer.toString(StandardCharsets.UTF_8);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Exit status, empty until the process has exited.
     */
    public OptionalInt exitCode() {
        Process p = currentProcess();
        return p == null || p.isAlive() ? OptionalInt.empty() : OptionalInt.of(p.exitValue());
    }

    public long pid() {
        Process p = currentProcess();
        return p == null ? -1 : p.pid();
    }

    public String binary() {
        return binary;
    }

    public List<String> args() {
        return args;
    }

    @Override
    public void close() {
        kill();
    }

    /**
     * Resolves a binary the way a shell would: a name containing a path separator is used
     * as-is, a bare name is looked up on {@code PATH}.
     */
    public static Optional<Path> findExecutable(String binary) {
        if (binary == null || binary.isBlank()) {
            return Optional.empty();
        }
        try {
            if (binary.indexOf('/') >= 0 || binary.indexOf(File.separatorChar) >= 0) {
                Path candidate = Path.of(binary);
                return isExecutableFile(candidate) ? Optional.of(candidate) : Optional.empty();
            }
            String path = System.getenv("PATH");
            if (path == null) {
                return Optional.empty();
            }
            for (String dir : path.split(File.pathSeparator)) {
                if (dir.isEmpty()) {
                    continue;
                }
                Path candidate = Path.of(dir).resolve(binary);
                if (isExecutableFile(candidate)) {
                    return Optional.of(candidate);
                }
            }
        } catch (InvalidPathException e) {
            logger.debug("Unusable path while resolving {}: {}", binary, e.getMessage());
        }
        return Optional.empty();
    }

    private static boolean isExecutableFile(Path candidate) {
        return Files.isRegularFile(candidate) && Files.isExecutable(candidate);
    }

    private Thread drain(InputStream in, ByteArrayOutputStream target, String stream, long pid) {
        Thread reader = RunnerThreads.daemon("subprocess-" + pid + "-" + stream, () -> {
            byte[] chunk = new byte[8192];
            try (in) {
                int n;
                while ((n = in.read(chunk)) != -1) {
                    if (!append(target, chunk, n)) {
                        logger.warn("pid {} exceeded output limit of {} bytes, killing it", pid, maxOutputBytes);
                        kill();
                        return;
                    }
                }
            } catch (IOException e) {
                recordPipeError(e);
            }
        });
        reader.start();
        return reader;
    }

    private boolean append(ByteArrayOutputStream target, byte[] chunk, int length) {
        lock.writeLock().lock();
        try {
            if (maxOutputBytes > 0 && stdoutBuffer.size() + stderrBuffer.size() + (long) length > maxOutputBytes) {
                limitExceeded = true;
                return false;
            }
            target.write(chunk, 0, length);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void recordPipeError(IOException e) {
        lock.writeLock().lock();
        try {
            if (pipeError == null) {
                pipeError = e;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private IOException readPipeError() {
        lock.readLock().lock();
        try {
            return pipeError;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void joinReaders() throws RunnerException {
        Thread out;
        Thread err;
        lock.readLock().lock();
        try {
            out = stdoutReader;
            err = stderrReader;
        } finally {
            lock.readLock().unlock();
        }
        try {
            join(out);
            join(err);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunnerException(RunnerError.CANCELLED, "interrupted while collecting output", e);
        }
    }

    private static void join(Thread reader) throws InterruptedException {
        if (reader == null) {
            return;
        }
        reader.join(READER_JOIN_TIMEOUT.toMillis());
        if (reader.isAlive()) {
            logger.warn("Reader {} still running after {}; output may be incomplete", reader.getName(), READER_JOIN_TIMEOUT);
        }
    }

    private static void settle(Process p) throws RunnerException {
        try {
            p.waitFor(KILL_SETTLE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunnerException(RunnerError.CANCELLED, "interrupted while terminating pid " + p.pid(), e);
        }
    }

    private RunnerException timedOut(RunContext ctx) {
        RunnerException reason = ctx.error();
        String detail = reason == null ? "" : ": " + reason.getMessage();
        return new RunnerException(RunnerError.TIMEOUT, RunnerError.TIMEOUT.defaultMessage() + detail, reason);
    }

    private Process currentProcess() {
        lock.readLock().lock();
        try {
            return process;
        } finally {
            lock.readLock().unlock();
        }
    }

    private Process requireStarted() throws RunnerException {
        Process p = currentProcess();
        if (p == null) {
            throw new RunnerException(RunnerError.PROCESS_NOT_RUNNING);
        }
        return p;
    }

    @Override
    public String toString() {
        return "Subprocess[" + binary + ", pid=" + pid() + "]";
    }

    public static final class Builder {
        private final String binary;
        private final List<String> args = new ArrayList<>();
        private Path workDir;
        private long maxOutputBytes;

        private Builder(String binary) {
            this.binary = Objects.requireNonNull(binary, "binary must not be null");
        }

        public Builder args(List<String> args) {
            this.args.addAll(args);
            return this;
        }

        public Builder arg(String arg) {
            this.args.add(arg);
            return this;
        }

        public Builder workDir(Path workDir) {
            this.workDir = workDir;
            return this;
        }

        /**
         * Combined stdout and stderr limit; zero or negative disables it.
         */
        public Builder maxOutputBytes(long maxOutputBytes) {
            this.maxOutputBytes = maxOutputBytes;
            return this;
        }

        public Subprocess build() {
            return new Subprocess(this);
        }
    }
}
