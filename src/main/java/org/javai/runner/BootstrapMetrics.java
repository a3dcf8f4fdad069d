package org.javai.runner;

import java.time.Duration;
import java.time.Instant;

/**
 * Timings of the bootstrap phases. The setup steps run concurrently, so {@code total} is
 * usually less than their sum. {@code warmup} is zero until asynchronous warm-up finishes.
 */
public record BootstrapMetrics(
        Instant startTime,
        Duration configLoad,
        Duration capabilityScan,
        Duration workspaceCheck,
        Duration warmup,
        Duration total
) {

    static BootstrapMetrics notStarted() {
        return new BootstrapMetrics(null, Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ZERO);
    }

    BootstrapMetrics withWarmup(Duration warmup) {
        return new BootstrapMetrics(startTime, configLoad, capabilityScan, workspaceCheck, warmup, total);
    }
}
