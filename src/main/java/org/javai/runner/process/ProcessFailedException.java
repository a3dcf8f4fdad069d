package org.javai.runner.process;

import org.javai.runner.RunnerError;
import org.javai.runner.RunnerException;

/**
 * A subprocess ran to completion but exited with a non-zero status.
 * The captured standard error is part of the message so that classification can see it.
 */
public class ProcessFailedException extends RunnerException {

    private final int exitCode;
    private final String stderr;

    public ProcessFailedException(int exitCode, String stderr) {
        super(RunnerError.PROCESS_FAILED, describe(exitCode, stderr));
        this.exitCode = exitCode;
        this.stderr = stderr == null ? "" : stderr;
    }

    public int exitCode() {
        return exitCode;
    }

    public String stderr() {
        return stderr;
    }

    private static String describe(int exitCode, String stderr) {
        String detail = stderr == null ? "" : stderr.strip();
        return detail.isEmpty()
                ? "process exited with code " + exitCode
                : "process exited with code " + exitCode + ": " + detail;
    }
}
