package org.javai.runner;

import java.util.Objects;

/**
 * Checked exception for every failure the runner raises itself.
 * The {@link RunnerError} kind is the structured identity used by classification;
 * the message is for humans.
 */
public class RunnerException extends Exception {

    private final RunnerError error;

    public RunnerException(RunnerError error) {
        this(error, error.defaultMessage(), null);
    }

    public RunnerException(RunnerError error, String message) {
        this(error, message, null);
    }

    public RunnerException(RunnerError error, String message, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error must not be null");
    }

    public RunnerError error() {
        return error;
    }

    public boolean is(RunnerError kind) {
        return error == kind;
    }

    /**
     * Walks the cause chain looking for a runner failure of the given kind.
     */
    public static boolean hasKind(Throwable throwable, RunnerError kind) {
        for (Throwable t = throwable; t != null; t = t.getCause()) {
            if (t instanceof RunnerException runnerException && runnerException.is(kind)) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
