package org.javai.runner.classify;

import org.javai.runner.RunnerError;
import org.javai.runner.RunnerException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Default classifier for subprocess and API failures.
 *
 * <p>Structured causes anywhere in the cause chain are checked first: runner timeouts and
 * cancellations, JDK timeout exceptions, status codes, and a missing binary. When none
 * applies, the lower-cased messages of the whole chain are searched for the well-known
 * fragments, in the same precedence order. Anything left over is {@link ErrorCode#UNKNOWN}
 * and retryable.</p>
 */
public class DefaultErrorClassifier implements ErrorClassifier {

    @Override
    public ClassifiedError classify(Throwable t) {
        String message = describe(t);

        ClassifiedError structured = classifyStructured(t, message);
        if (structured != null) {
            return structured;
        }
        return classifyText(message);
    }

    private ClassifiedError classifyStructured(Throwable t, String message) {
        for (Throwable current = t; current != null; current = next(current, t)) {
            if (current instanceof RunnerException re) {
                if (re.is(RunnerError.TIMEOUT) || re.is(RunnerError.CANCELLED)) {
                    return ClassifiedError.retryable(ErrorCode.TIMEOUT, message);
                }
                if (re.is(RunnerError.CLAUDE_NOT_FOUND)) {
                    return ClassifiedError.terminal(ErrorCode.CLAUDE_NOT_FOUND, message, FallbackAction.SKIP);
                }
                if (re.is(RunnerError.RESOURCE_LIMIT_EXCEEDED)) {
                    return ClassifiedError.terminal(ErrorCode.CONTENT_TOO_LARGE, message, FallbackAction.PARTIAL);
                }
            }
            if (current instanceof TimeoutException
                    || current instanceof SocketTimeoutException
                    || current instanceof HttpTimeoutException) {
                return ClassifiedError.retryable(ErrorCode.TIMEOUT, message);
            }
            if (current instanceof HasStatusCode withStatus) {
                ClassifiedError byStatus = classifyStatus(withStatus.statusCode(), message);
                if (byStatus != null) {
                    return byStatus;
                }
            }
        }
        return null;
    }

    private ClassifiedError classifyStatus(int status, String message) {
        if (status == 429) {
            return ClassifiedError.retryable(ErrorCode.RATE_LIMITED, message);
        }
        if (status == 401) {
            return ClassifiedError.terminal(ErrorCode.UNAUTHORIZED, message, FallbackAction.SKIP);
        }
        if (status >= 500 && status <= 504) {
            return ClassifiedError.retryable(ErrorCode.SERVER_ERROR, message);
        }
        return null;
    }

    private ClassifiedError classifyText(String message) {
        String text = message.toLowerCase(Locale.ROOT);

        if (containsAny(text, "timeout", "deadline exceeded")) {
            return ClassifiedError.retryable(ErrorCode.TIMEOUT, message);
        }
        if (containsAny(text, "rate limit", "429")) {
            return ClassifiedError.retryable(ErrorCode.RATE_LIMITED, message);
        }
        if (containsAny(text, "401", "unauthorized", "authentication")) {
            return ClassifiedError.terminal(ErrorCode.UNAUTHORIZED, message, FallbackAction.SKIP);
        }
        if (containsAny(text, "500", "502", "503", "504")) {
            return ClassifiedError.retryable(ErrorCode.SERVER_ERROR, message);
        }
        if (containsAny(text, "too large", "exceeds limit", "context length")) {
            return ClassifiedError.terminal(ErrorCode.CONTENT_TOO_LARGE, message, FallbackAction.PARTIAL);
        }
        return ClassifiedError.retryable(ErrorCode.UNKNOWN, message);
    }

    private static boolean containsAny(String text, String... fragments) {
        for (String fragment : fragments) {
            if (text.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Joins the messages of the cause chain, outermost first.
     */
    private static String describe(Throwable t) {
        StringBuilder sb = new StringBuilder();
        for (Throwable current = t; current != null; current = next(current, t)) {
            String msg = current.getMessage();
            if (msg == null || msg.isBlank() || sb.indexOf(msg) >= 0) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(": ");
            }
            sb.append(msg);
        }
        return sb.length() > 0 ? sb.toString() : t.getClass().getName();
    }

    // Stops on self-referencing or cyclic chains.
    private static Throwable next(Throwable current, Throwable root) {
        Throwable cause = current.getCause();
        return cause == current || cause == root ? null : cause;
    }
}
