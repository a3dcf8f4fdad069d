package org.javai.runner.classify;

import java.util.Objects;

/**
 * The verdict on a failure: what it was, whether it is worth retrying, and how to degrade
 * if it ends up terminal.
 *
 * @param code stable error identifier
 * @param message the failure text that was classified
 * @param retryable whether another attempt may succeed
 * @param action degradation to apply when the failure is terminal
 */
public record ClassifiedError(ErrorCode code, String message, boolean retryable, FallbackAction action) {

    public ClassifiedError {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(action, "action must not be null");
        message = message == null ? "" : message;
    }

    static ClassifiedError retryable(ErrorCode code, String message) {
        return new ClassifiedError(code, message, true, FallbackAction.RETRY);
    }

    static ClassifiedError terminal(ErrorCode code, String message, FallbackAction action) {
        return new ClassifiedError(code, message, false, action);
    }

    @Override
    public String toString() {
        return code + "(" + (retryable ? "retryable" : action) + "): " + message;
    }
}
