package org.javai.runner.classify;

/**
 * How a terminal failure is degraded once retrying is no longer an option.
 *
 * <p>{@link #RETRY} is consumed by the retry loop. The remaining actions decide what the
 * fallback handler hands back to the caller.</p>
 */
public enum FallbackAction {
    /** Try again with backoff. */
    RETRY,
    /** Report the analysis as skipped; the pipeline is not blocked. */
    SKIP,
    /** Serve a previously cached result for the same key. */
    CACHE,
    /** Return whatever output is available, flagged partial. */
    PARTIAL,
    /** Propagate the error to the caller. */
    FAIL
}
