package org.javai.runner;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.runner.cache.CacheEntry;
import org.javai.runner.cache.ReviewCache;
import org.javai.runner.capability.Capability;
import org.javai.runner.capability.CapabilityProvider;
import org.javai.runner.classify.ClassifiedError;
import org.javai.runner.classify.DefaultErrorClassifier;
import org.javai.runner.classify.ErrorClassifier;
import org.javai.runner.concurrent.ContextTask;
import org.javai.runner.concurrent.ParallelRunner;
import org.javai.runner.concurrent.RunContext;
import org.javai.runner.concurrent.RunnerThreads;
import org.javai.runner.config.ConfigLoader;
import org.javai.runner.config.RunnerConfig;
import org.javai.runner.config.YamlConfigLoader;
import org.javai.runner.fallback.FallbackHandler;
import org.javai.runner.fallback.FallbackMetrics;
import org.javai.runner.fallback.FallbackResult;
import org.javai.runner.ops.OpReporter;
import org.javai.runner.ops.log4j.Log4jOpReporter;
import org.javai.runner.process.ProcessManager;
import org.javai.runner.process.ProcessPool;
import org.javai.runner.process.Subprocess;
import org.javai.runner.process.Watchdog;
import org.javai.runner.retry.RetryExecutor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs capability analyses as external subprocesses with retry, degradation and caching.
 *
 * <p>A runner is bootstrapped once, runs any number of requests (concurrently if the
 * caller wishes), and is shut down once. Shutdown drains every tracked subprocess within a
 * grace period; it also runs from a JVM shutdown hook so that termination signals do not
 * leave orphaned processes behind.</p>
 *
 * <pre>{@code
 * Runner runner = Runner.builder()
 *     .options(RunnerOptions.builder().workDir(repo).build())
 *     .capabilities(provider)
 *     .build();
 * runner.bootstrap(RunContext.background());
 *
 * RunResult result = runner.run(ctx, RunRequest.builder("code-review").input("diff", diff).build());
 * System.exit(result.exitCode().code());
 * }</pre>
 */
public final class Runner implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(Runner.class);

    private static final Duration SLOW_BOOTSTRAP = Duration.ofSeconds(3);

    private final RunnerOptions options;
    private final ConfigLoader configLoader;
    private final CapabilityProvider capabilities;
    private final ErrorClassifier classifier;
    private final OpReporter reporter;
    private final ExecutorService executor;

    private final Object stateLock = new Object();
    private RunnerState state = RunnerState.UNINITIALIZED;
    private int inFlight;
    private Thread shutdownHook;
    private final Set<RunContext> activeRuns = ConcurrentHashMap.newKeySet();

    // Assigned once during bootstrap, before the state becomes READY.
    private volatile RunnerConfig config;
    private volatile List<String> discovered = List.of();
    private volatile ReviewCache cache;
    private volatile RetryExecutor retryExecutor;
    private volatile FallbackHandler fallback;
    private volatile ProcessManager processManager;
    private volatile ProcessPool processPool;
    private volatile Watchdog watchdog;
    private volatile BootstrapMetrics bootstrapMetrics = BootstrapMetrics.notStarted();

    private Runner(Builder builder) {
        this.options = builder.options;
        this.configLoader = builder.configLoader;
        this.capabilities = Objects.requireNonNull(builder.capabilities, "capabilities must be set");
        this.classifier = builder.classifier;
        this.reporter = builder.reporter;
        this.executor = Executors.newCachedThreadPool(RunnerThreads.factory("runner"));
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========== Lifecycle ==========

    /**
     * Loads configuration, discovers capabilities and validates the workspace concurrently,
     * then builds the execution components and becomes {@link RunnerState#READY}.
     *
     * <p>The first failing step aborts bootstrap and leaves the runner in
     * {@link RunnerState#INITIALIZING}.</p>
     *
     * @throws RunnerException {@link RunnerError#PROCESS_ALREADY_RUN} if the runner was
     *         already bootstrapped, or the failure of the first failing setup step
     */
    public void bootstrap(RunContext ctx) throws RunnerException {
        synchronized (stateLock) {
            if (state != RunnerState.UNINITIALIZED) {
                throw new RunnerException(RunnerError.PROCESS_ALREADY_RUN,
                        "cannot bootstrap: runner is in state " + state);
            }
            state = RunnerState.validate(state, RunnerState.INITIALIZING);
        }

        Instant startTime = Instant.now();
        long start = System.nanoTime();
        AtomicReference<RunnerConfig> loaded = new AtomicReference<>();
        AtomicReference<List<String>> names = new AtomicReference<>(List.of());
        AtomicReference<Duration> configLoad = new AtomicReference<>(Duration.ZERO);
        AtomicReference<Duration> capabilityScan = new AtomicReference<>(Duration.ZERO);
        AtomicReference<Duration> workspaceCheck = new AtomicReference<>(Duration.ZERO);

        List<ContextTask> steps = List.of(
                c -> {
                    long s = System.nanoTime();
                    loaded.set(configLoader.load(options.configPath()));
                    configLoad.set(since(s));
                },
                c -> {
                    long s = System.nanoTime();
                    names.set(List.copyOf(capabilities.discover()));
                    capabilityScan.set(since(s));
                },
                c -> {
                    long s = System.nanoTime();
                    validateWorkspace();
                    workspaceCheck.set(since(s));
                }
        );
        try {
            new ParallelRunner(executor).runAll(ctx, steps);
        } catch (RunnerException | RuntimeException e) {
            logger.error("Bootstrap failed: {}", e.getMessage());
            throw e;
        } catch (Exception e) {
            throw new RunnerException(RunnerError.IO_FAILURE, "bootstrap failed: " + e.getMessage(), e);
        }

        RunnerConfig cfg = loaded.get();
        this.config = cfg;
        this.discovered = names.get();
        this.cache = openCache(cfg);
        this.retryExecutor = RetryExecutor.builder()
                .policy(cfg.retry().toPolicy())
                .classifier(classifier)
                .reporter(reporter)
                .build();
        this.fallback = new FallbackHandler(cache, reporter);
        this.processManager = new ProcessManager(cfg.claude().binary(), options.workDir(), cfg.claude().maxOutputBytes());
        this.processPool = new ProcessPool(cfg.claude().binary(), options.workDir());
        this.watchdog = new Watchdog(reporter);

        Duration total = since(start);
        this.bootstrapMetrics = new BootstrapMetrics(startTime, configLoad.get(), capabilityScan.get(),
                workspaceCheck.get(), Duration.ZERO, total);

        synchronized (stateLock) {
            if (state != RunnerState.INITIALIZING) {
                // shut down while bootstrapping
                watchdog.close();
                throw new RunnerException(RunnerError.NOT_INITIALIZED, "runner was shut down during bootstrap");
            }
            state = RunnerState.validate(state, RunnerState.READY);
        }

        if (options.preWarm()) {
            startWarmup(ctx);
        }
        if (options.installShutdownHook()) {
            installShutdownHook();
        }
        if (total.compareTo(SLOW_BOOTSTRAP) > 0) {
            logger.warn("Bootstrap took {} ms (target < {} ms)", total.toMillis(), SLOW_BOOTSTRAP.toMillis());
        }
        logger.info("Runner ready in {} ms: {} capabilities, binary {}", total.toMillis(), discovered.size(),
                cfg.claude().binary());
    }

    /**
     * Stops every tracked subprocess, waiting up to the graceful timeout (or what is left
     * of {@code ctx}, if less) before force-killing stragglers. The runner ends in
     * {@link RunnerState#STOPPED} either way. Calling it again does nothing.
     *
     * @throws RunnerException {@link RunnerError#SHUTDOWN_TIMEOUT} if any process had to be
     *         force-killed; the runner is already stopped when this is thrown
     */
    public void shutdown(RunContext ctx) throws RunnerException {
        synchronized (stateLock) {
            if (state == RunnerState.STOPPED || state == RunnerState.SHUTTING_DOWN) {
                return;
            }
            state = RunnerState.validate(state, RunnerState.SHUTTING_DOWN);
        }
        removeShutdownHook();

        Duration grace = options.gracefulTimeout();
        Optional<Duration> remaining = ctx.remaining();
        if (remaining.isPresent() && remaining.get().compareTo(grace) < 0) {
            grace = remaining.get();
        }

        int killed = 0;
        try {
            ProcessManager manager = processManager;
            if (manager != null) {
                killed = manager.stopAll(grace);
            }
        } finally {
            // anything that slipped past stopAll dies with its context
            activeRuns.forEach(RunContext::cancel);
            Watchdog dog = watchdog;
            if (dog != null) {
                dog.close();
            }
            stopExecutor();
            synchronized (stateLock) {
                state = RunnerState.validate(state, RunnerState.STOPPED);
            }
            logger.info("Runner stopped");
        }

        if (killed > 0) {
            throw new RunnerException(RunnerError.SHUTDOWN_TIMEOUT,
                    killed + " process(es) did not exit within " + grace.toMillis() + " ms and were killed");
        }
    }

    @Override
    public void close() throws RunnerException {
        shutdown(RunContext.background());
    }

    private boolean isShuttingDown() {
        synchronized (stateLock) {
            return state == RunnerState.SHUTTING_DOWN || state == RunnerState.STOPPED;
        }
    }

    public RunnerState state() {
        synchronized (stateLock) {
            return state;
        }
    }

    // ========== Execution ==========

    /**
     * Runs one analysis.
     *
     * <p>Execution failures do not throw: they come back as a {@link RunResult} carrying the
     * error and its exit code. Failures that the fallback policy degrades come back as
     * successes flagged skipped, partial or cached.</p>
     *
     * @throws RunnerException {@link RunnerError#NOT_INITIALIZED} unless the runner is ready
     */
    public RunResult run(RunContext ctx, RunRequest request) throws RunnerException {
        Objects.requireNonNull(request, "request must not be null");
        acquire();
        try {
            return execute(ctx, request);
        } finally {
            release();
        }
    }

    /**
     * Runs tasks concurrently on the runner's pool under one shared cancelable context.
     * The first failure cancels the siblings and is rethrown once all tasks have returned.
     */
    public void runParallel(RunContext ctx, List<? extends ContextTask> tasks) throws Exception {
        new ParallelRunner(executor).runAll(ctx, tasks);
    }

    private RunResult execute(RunContext ctx, RunRequest request) {
        long start = System.nanoTime();

        if (request.cacheKey().isPresent() && !request.force()) {
            Optional<CacheEntry> hit = cache.getReview(request.cacheKey().getAsLong());
            if (hit.isPresent()) {
                logger.info("Cache hit for {}", request);
                CacheEntry entry = hit.get();
                return RunResult.fromCache(entry.payload(), entry.partial(), entry.originalDuration());
            }
        }

        Capability capability;
        try {
            capability = capabilities.load(request.capability());
        } catch (RunnerException e) {
            logger.error("Cannot run {}: {}", request, e.getMessage());
            return RunResult.failed(e, since(start), 0);
        }

        String prompt = capability.render(request.inputs());
        List<String> args = buildArgs(capability);
        Duration timeout = request.timeout().orElse(config.claude().timeout());
        RunContext exec = ctx.withTimeout(timeout);
        activeRuns.add(exec);
        AtomicInteger attempts = new AtomicInteger();
        AtomicReference<String> lastOutput = new AtomicReference<>("");

        try {
            String output = retryExecutor.execute(exec, request.id(),
                    () -> attemptOnce(exec, request, prompt, args, attempts, lastOutput));
            Duration elapsed = since(start);
            store(request, output, false, elapsed);
            logger.info("Run {} succeeded in {} ms after {} attempt(s)", request.id(), elapsed.toMillis(), attempts.get());
            return RunResult.success(output, elapsed, retries(attempts));
        } catch (RunnerException e) {
            return onFailure(ctx, exec, request, e, lastOutput.get(), start, retries(attempts));
        } finally {
            activeRuns.remove(exec);
            exec.cancel();
        }
    }

    private String attemptOnce(RunContext exec, RunRequest request, String prompt, List<String> args,
                               AtomicInteger attempts, AtomicReference<String> lastOutput) throws RunnerException {
        if (isShuttingDown()) {
            exec.cancel();
            exec.throwIfDone();
        }
        attempts.incrementAndGet();
        Subprocess process = processManager.start(exec, request.id(), args);
        try {
            process.writePrompt(prompt);
            Duration limit = exec.remaining().orElse(config.claude().timeout());
            return watchdog.awaitExit(exec, process, limit);
        } finally {
            lastOutput.set(process.stdout());
            processManager.stop(request.id());
        }
    }

    private RunResult onFailure(RunContext ctx, RunContext exec, RunRequest request, RunnerException failure,
                                String availableOutput, long start, int retries) {
        if (failure.is(RunnerError.TIMEOUT) || failure.is(RunnerError.CANCELLED)) {
            logger.warn("Run {} timed out after {} retries: {}", request.id(), retries, failure.getMessage());
            return RunResult.failed(failure, since(start), retries);
        }
        RunnerException ended = exec.error();
        if (ended != null) {
            // the deadline passed while the last attempts were failing for other reasons
            RunnerException timedOut = new RunnerException(ended.error(),
                    ended.getMessage() + ": " + failure.getMessage(), failure);
            logger.warn("Run {} ran out of time: {}", request.id(), timedOut.getMessage());
            return RunResult.failed(timedOut, since(start), retries);
        }

        Throwable cause = failure.is(RunnerError.MAX_RETRIES_EXCEEDED) && failure.getCause() != null
                ? failure.getCause()
                : failure;
        ClassifiedError classified = classifier.classify(cause);
        Optional<FallbackResult> degraded = fallback.handle(ctx, classified, request, availableOutput);
        Duration elapsed = since(start);

        if (degraded.isPresent()) {
            FallbackResult result = degraded.get();
            logger.warn("Run {} degraded ({}): {}", request.id(), classified.action(), result.reason());
            if (result.partial()) {
                store(request, result.output(), true, elapsed);
            }
            return RunResult.degraded(result, elapsed, retries);
        }

        logger.error("Run {} failed with {}: {}", request.id(), classified.code(), failure.getMessage());
        return RunResult.failed(failure, elapsed, retries);
    }

    List<String> buildArgs(Capability capability) {
        RunnerConfig.ClaudeSettings claude = config.claude();
        List<String> args = new ArrayList<>();
        args.add("-p");
        if (claude.skipPermissions()) {
            args.add("--dangerously-skip-permissions");
        }
        if (capability.timeoutSeconds() > 0) {
            args.add("--timeout");
            args.add(String.valueOf(capability.timeoutSeconds()));
        }
        for (String tool : capability.allowedTools()) {
            args.add("--allowedTools");
            args.add(tool);
        }
        if (capability.maxTokens() > 0) {
            args.add("--max-tokens");
            args.add(String.valueOf(capability.maxTokens()));
        }
        args.addAll(claude.extraArgs());
        return args;
    }

    private void store(RunRequest request, String output, boolean partial, Duration elapsed) {
        if (request.cacheKey().isEmpty()) {
            return;
        }
        long key = request.cacheKey().getAsLong();
        try {
            cache.setReview(key, CacheEntry.of(key, output, partial, elapsed));
        } catch (IOException e) {
            logger.warn("Failed to cache result for {}: {}", request.id(), e.getMessage());
        }
    }

    private void acquire() throws RunnerException {
        synchronized (stateLock) {
            if (state == RunnerState.READY) {
                state = RunnerState.validate(state, RunnerState.RUNNING);
            } else if (state != RunnerState.RUNNING) {
                throw new RunnerException(RunnerError.NOT_INITIALIZED,
                        RunnerError.NOT_INITIALIZED.defaultMessage() + ": runner is in state " + state);
            }
            inFlight++;
        }
    }

    private void release() {
        synchronized (stateLock) {
            inFlight--;
            if (inFlight == 0 && state == RunnerState.RUNNING) {
                state = RunnerState.validate(state, RunnerState.READY);
            }
        }
    }

    // ========== Metrics ==========

    public FallbackMetrics fallbackMetrics() {
        FallbackHandler handler = fallback;
        return handler == null ? new FallbackMetrics(0, Map.of(), Map.of()) : handler.metrics();
    }

    public BootstrapMetrics bootstrapMetrics() {
        return bootstrapMetrics;
    }

    public long timeoutCount() {
        Watchdog dog = watchdog;
        return dog == null ? 0 : dog.timeoutCount();
    }

    public boolean isWarm() {
        ProcessPool pool = processPool;
        return pool != null && pool.isWarm();
    }

    public List<String> capabilities() {
        return discovered;
    }

    public Optional<RunnerConfig> config() {
        return Optional.ofNullable(config);
    }

    // ========== Internals ==========

    private void validateWorkspace() throws RunnerException {
        Path workDir = options.workDir();
        if (!Files.isDirectory(workDir)) {
            throw new RunnerException(RunnerError.WORKSPACE_INVALID, "work directory does not exist: " + workDir);
        }
        if (!Files.exists(workDir.resolve(".git"))) {
            if (options.requireGitWorkspace()) {
                throw new RunnerException(RunnerError.WORKSPACE_INVALID, "not a git repository: " + workDir);
            }
            logger.warn("{} is not a git repository", workDir.toAbsolutePath());
        }
        if (!Files.exists(workDir.resolve("CLAUDE.md"))) {
            logger.debug("No CLAUDE.md in {}", workDir.toAbsolutePath());
        }
    }

    private ReviewCache openCache(RunnerConfig cfg) throws RunnerException {
        RunnerConfig.CacheSettings settings = cfg.cache();
        Path dir = settings.dir() == null
                ? Path.of(System.getProperty("user.home"), ".analysis-runner", "cache")
                : options.workDir().resolve(settings.dir());
        try {
            ReviewCache opened = ReviewCache.open(dir, settings.enabled());
            opened.setTtl(settings.ttl());
            return opened;
        } catch (IOException e) {
            throw new RunnerException(RunnerError.INVALID_CONFIG, "cache directory is not usable: " + dir, e);
        }
    }

    private void startWarmup(RunContext ctx) {
        ProcessPool pool = processPool;
        executor.execute(() -> {
            long s = System.nanoTime();
            try {
                pool.warmup(ctx);
            } catch (RunnerException e) {
                logger.warn("Warm-up failed: {}", e.getMessage());
            } finally {
                bootstrapMetrics = bootstrapMetrics.withWarmup(since(s));
            }
        });
    }

    private void installShutdownHook() {
        Thread hook = new Thread(this::onTermination, "runner-shutdown-hook");
        synchronized (stateLock) {
            shutdownHook = hook;
        }
        Runtime.getRuntime().addShutdownHook(hook);
    }

    private void removeShutdownHook() {
        Thread hook;
        synchronized (stateLock) {
            hook = shutdownHook;
            shutdownHook = null;
        }
        if (hook == null || hook == Thread.currentThread()) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            logger.debug("JVM already shutting down, hook stays registered");
        }
    }

    private void onTermination() {
        logger.info("Termination requested, shutting down runner");
        try {
            shutdown(RunContext.background().withTimeout(options.gracefulTimeout()));
        } catch (RunnerException e) {
            logger.warn("Shutdown on termination: {}", e.getMessage());
        }
    }

    private void stopExecutor() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(100, TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static int retries(AtomicInteger attempts) {
        return Math.max(0, attempts.get() - 1);
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    public static final class Builder {
        private RunnerOptions options = RunnerOptions.defaults();
        private ConfigLoader configLoader = new YamlConfigLoader();
        private CapabilityProvider capabilities;
        private ErrorClassifier classifier = new DefaultErrorClassifier();
        private OpReporter reporter = new Log4jOpReporter();

        private Builder() {}

        public Builder options(RunnerOptions options) {
            this.options = Objects.requireNonNull(options, "options must not be null");
            return this;
        }

        public Builder configLoader(ConfigLoader configLoader) {
            this.configLoader = Objects.requireNonNull(configLoader, "configLoader must not be null");
            return this;
        }

        public Builder capabilities(CapabilityProvider capabilities) {
            this.capabilities = Objects.requireNonNull(capabilities, "capabilities must not be null");
            return this;
        }

        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        public Runner build() {
            return new Runner(this);
        }
    }
}
