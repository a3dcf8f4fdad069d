package org.javai.runner.process;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.runner.RunnerException;
import org.javai.runner.concurrent.RunContext;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Warms up the analysis binary before the first real run.
 *
 * <p>Warm-up runs {@code <binary> --version} under a short deadline. It loads the binary
 * and its runtime into the OS caches so the first analysis does not pay that cost.</p>
 */
public class ProcessPool {

    private static final Logger logger = LogManager.getLogger(ProcessPool.class);

    static final Duration DEFAULT_WARMUP_TIMEOUT = Duration.ofSeconds(10);

    private final String binary;
    private final Path workDir;
    private final Duration warmupTimeout;
    private volatile boolean warm;

    public ProcessPool(String binary, Path workDir) {
        this(binary, workDir, DEFAULT_WARMUP_TIMEOUT);
    }

    public ProcessPool(String binary, Path workDir, Duration warmupTimeout) {
        this.binary = binary;
        this.workDir = workDir;
        this.warmupTimeout = warmupTimeout;
    }

    /**
     * Runs the warm-up probe once. A failure leaves the pool cold and is rethrown for the
     * caller to decide how much it matters.
     *
     * @return the version string the binary printed
     */
    public String warmup(RunContext ctx) throws RunnerException {
        RunContext probeCtx = ctx.withTimeout(warmupTimeout);
        try (Subprocess probe = Subprocess.builder(binary).args(List.of("--version")).workDir(workDir).build()) {
            probe.start(probeCtx);
            probe.writePrompt("");
            String version = probe.waitFor(probeCtx).strip();
            warm = true;
            logger.info("Warmed up {} ({})", binary, version.isEmpty() ? "no version output" : version);
            return version;
        } finally {
            probeCtx.cancel();
        }
    }

    public boolean isWarm() {
        return warm;
    }
}
