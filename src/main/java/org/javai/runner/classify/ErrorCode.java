package org.javai.runner.classify;

/**
 * Stable identifiers for classified subprocess and API failures.
 */
public enum ErrorCode {
    TIMEOUT,
    RATE_LIMITED,
    UNAUTHORIZED,
    SERVER_ERROR,
    CONTENT_TOO_LARGE,
    CLAUDE_NOT_FOUND,
    UNKNOWN
}
