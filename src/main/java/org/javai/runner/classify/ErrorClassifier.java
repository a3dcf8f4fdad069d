package org.javai.runner.classify;

/**
 * Decides whether a failure is retryable and how it degrades.
 * This is the single place where retryability is decided.
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * @param throwable the failure, never null
     * @return its classification, never null
     */
    ClassifiedError classify(Throwable throwable);
}
