package org.javai.runner;

/**
 * The kinds of failure the runner raises itself.
 * Each kind carries a default message and the exit code it surfaces as.
 */
public enum RunnerError {

    CLAUDE_NOT_FOUND("claude binary not found in PATH", ExitCode.INFRA_ERROR),
    PROCESS_NOT_RUNNING("process is not running", ExitCode.INFRA_ERROR),
    PROCESS_ALREADY_RUN("process has already been started", ExitCode.INFRA_ERROR),
    PROCESS_START_FAILED("failed to start process", ExitCode.INFRA_ERROR),
    IO_FAILURE("process I/O failed", ExitCode.CLAUDE_ERROR),
    PROCESS_FAILED("process exited with non-zero status", ExitCode.CLAUDE_ERROR),
    TIMEOUT("execution timed out", ExitCode.TIMEOUT),
    CANCELLED("context canceled", ExitCode.TIMEOUT),
    MAX_RETRIES_EXCEEDED("max retries exceeded", ExitCode.CLAUDE_ERROR),
    SHUTDOWN_TIMEOUT("graceful shutdown timed out", ExitCode.INFRA_ERROR),
    NOT_INITIALIZED("runner not initialized", ExitCode.INFRA_ERROR),
    CAPABILITY_NOT_FOUND("capability not found", ExitCode.INFRA_ERROR),
    INVALID_CONFIG("invalid configuration", ExitCode.INFRA_ERROR),
    WORKSPACE_INVALID("workspace is not usable", ExitCode.INFRA_ERROR),
    RESOURCE_LIMIT_EXCEEDED("output exceeds limit", ExitCode.RESOURCE_LIMIT),
    OUTPUT_PARSE_FAILED("failed to parse output", ExitCode.CLAUDE_ERROR);

    private final String defaultMessage;
    private final ExitCode exitCode;

    RunnerError(String defaultMessage, ExitCode exitCode) {
        this.defaultMessage = defaultMessage;
        this.exitCode = exitCode;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public ExitCode exitCode() {
        return exitCode;
    }
}
