package org.javai.runner.classify;

/**
 * Implemented by exceptions that carry an HTTP-style status code, letting the classifier
 * match on the number rather than on message text.
 */
public interface HasStatusCode {

    int statusCode();
}
