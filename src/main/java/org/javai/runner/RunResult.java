package org.javai.runner;

import org.javai.runner.capability.OutputParser;
import org.javai.runner.fallback.FallbackResult;

import java.time.Duration;
import java.util.Optional;

/**
 * Outcome of one {@link Runner#run} call.
 *
 * <p>Degraded outcomes (skipped, partial, served from cache) are successes with exit code 0
 * and a reason, so reporting can tell "found nothing" apart from "did not run".</p>
 *
 * @param exitCode process exit code to surface
 * @param output analysis output, or the placeholder of a degraded result
 * @param failure the error for failed runs, null otherwise
 * @param duration wall time of the run; for cache hits, the duration of the original run
 * @param skipped analysis did not run
 * @param reason why the result is degraded or failed, null for a clean success
 * @param partial output is incomplete
 * @param cached output was served from the cache
 * @param retries attempts beyond the first
 */
public record RunResult(
        ExitCode exitCode,
        String output,
        RunnerException failure,
        Duration duration,
        boolean skipped,
        String reason,
        boolean partial,
        boolean cached,
        int retries
) {

    static RunResult success(String output, Duration duration, int retries) {
        return new RunResult(ExitCode.SUCCESS, output, null, duration, false, null, false, false, retries);
    }

    static RunResult fromCache(String output, boolean partial, Duration originalDuration) {
        return new RunResult(ExitCode.SUCCESS, output, null, originalDuration, false,
                "served from cache", partial, true, 0);
    }

    static RunResult degraded(FallbackResult fallback, Duration duration, int retries) {
        return new RunResult(ExitCode.SUCCESS, fallback.output(), null, duration, fallback.skipped(),
                fallback.reason(), fallback.partial(), fallback.cached(), retries);
    }

    static RunResult failed(RunnerException failure, Duration duration, int retries) {
        return new RunResult(ExitCode.forFailure(failure), "", failure, duration, false,
                failure.getMessage(), false, false, retries);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public Optional<RunnerException> error() {
        return Optional.ofNullable(failure);
    }

    /**
     * Applies {@code parser} to the output.
     *
     * @throws RunnerException the run's own failure, or {@link RunnerError#OUTPUT_PARSE_FAILED}
     */
    public <T> T parseOutput(OutputParser<T> parser) throws RunnerException {
        if (failure != null) {
            throw failure;
        }
        try {
            return parser.parse(output);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new RunnerException(RunnerError.OUTPUT_PARSE_FAILED,
                    RunnerError.OUTPUT_PARSE_FAILED.defaultMessage() + ": " + e.getMessage(), e);
        }
    }
}
