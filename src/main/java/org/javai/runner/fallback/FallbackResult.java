package org.javai.runner.fallback;

/**
 * A degraded but successful outcome produced in place of a failed analysis.
 *
 * @param skipped the analysis did not run
 * @param cached the output is a previously cached result
 * @param partial the output is incomplete
 * @param output text to report in place of the analysis output
 * @param reason human-readable explanation of the degradation
 */
public record FallbackResult(boolean skipped, boolean cached, boolean partial, String output, String reason) {

    static FallbackResult skipped(String reason, String output) {
        return new FallbackResult(true, false, false, output, reason);
    }

    static FallbackResult fromCache(String output, String reason) {
        return new FallbackResult(false, true, false, output, reason);
    }

    static FallbackResult partial(String output, String reason) {
        return new FallbackResult(false, false, true, output, reason);
    }
}
