package org.javai.runner;

/**
 * Process exit codes surfaced to whatever invoked the runner (usually a CI step).
 */
public enum ExitCode {

    /** Analysis completed, possibly in degraded form. */
    SUCCESS(0),
    /** Infrastructure problem: configuration, workspace, missing binary. */
    INFRA_ERROR(1),
    /** The analysis subprocess or its API failed. */
    CLAUDE_ERROR(2),
    /** Execution exceeded its deadline. */
    TIMEOUT(101),
    /** A resource limit was exceeded. */
    RESOURCE_LIMIT(102);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Exit code for a failure. Runner failures use their kind's code, anything else is
     * treated as a subprocess/API error.
     */
    public static ExitCode forFailure(Throwable failure) {
        if (failure == null) {
            return SUCCESS;
        }
        if (failure instanceof RunnerException runnerException) {
            return runnerException.error().exitCode();
        }
        return CLAUDE_ERROR;
    }
}
