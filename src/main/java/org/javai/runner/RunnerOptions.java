package org.javai.runner;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Options fixed when a {@link Runner} is built, as opposed to the configuration it loads.
 */
public final class RunnerOptions {

    public static final String DEFAULT_CONFIG_FILE = ".analysis-runner.yaml";
    public static final Duration DEFAULT_GRACEFUL_TIMEOUT = Duration.ofSeconds(5);

    private final Path workDir;
    private final Path configPath;
    private final boolean preWarm;
    private final Duration gracefulTimeout;
    private final boolean requireGitWorkspace;
    private final boolean installShutdownHook;

    private RunnerOptions(Builder builder) {
        this.workDir = builder.workDir;
        this.configPath = builder.configPath;
        this.preWarm = builder.preWarm;
        this.gracefulTimeout = builder.gracefulTimeout;
        this.requireGitWorkspace = builder.requireGitWorkspace;
        this.installShutdownHook = builder.installShutdownHook;
    }

    public static RunnerOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Path workDir() {
        return workDir;
    }

    /**
     * Configuration file, resolved against the work directory when relative.
     */
    public Path configPath() {
        return workDir.resolve(configPath);
    }

    public boolean preWarm() {
        return preWarm;
    }

    public Duration gracefulTimeout() {
        return gracefulTimeout;
    }

    public boolean requireGitWorkspace() {
        return requireGitWorkspace;
    }

    public boolean installShutdownHook() {
        return installShutdownHook;
    }

    public static final class Builder {
        private Path workDir = Path.of(".");
        private Path configPath = Path.of(DEFAULT_CONFIG_FILE);
        private boolean preWarm;
        private Duration gracefulTimeout = DEFAULT_GRACEFUL_TIMEOUT;
        private boolean requireGitWorkspace;
        private boolean installShutdownHook = true;

        private Builder() {}

        public Builder workDir(Path workDir) {
            this.workDir = Objects.requireNonNull(workDir, "workDir must not be null");
            return this;
        }

        public Builder configPath(Path configPath) {
            this.configPath = Objects.requireNonNull(configPath, "configPath must not be null");
            return this;
        }

        /**
         * Start the warm-up probe in the background once bootstrap succeeds.
         */
        public Builder preWarm(boolean preWarm) {
            this.preWarm = preWarm;
            return this;
        }

        public Builder gracefulTimeout(Duration gracefulTimeout) {
            Objects.requireNonNull(gracefulTimeout, "gracefulTimeout must not be null");
            if (gracefulTimeout.isNegative()) {
                throw new IllegalArgumentException("gracefulTimeout must not be negative");
            }
            this.gracefulTimeout = gracefulTimeout;
            return this;
        }

        /**
         * Fail bootstrap when the work directory is not a git checkout. Off by default,
         * in which case a missing {@code .git} only logs a warning.
         */
        public Builder requireGitWorkspace(boolean requireGitWorkspace) {
            this.requireGitWorkspace = requireGitWorkspace;
            return this;
        }

        public Builder installShutdownHook(boolean installShutdownHook) {
            this.installShutdownHook = installShutdownHook;
            return this;
        }

        public RunnerOptions build() {
            return new RunnerOptions(this);
        }
    }
}
