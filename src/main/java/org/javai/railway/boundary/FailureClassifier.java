package org.javai.railway.boundary;

import org.javai.railway.Failure;

/**
 * Classifies exceptions into structured failures.
 * Implementations should provide deterministic, context-aware classification.
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * Classifies an exception into a Failure.
     *
     * @param operation The operation that was being performed
     * @param throwable The exception that occurred
     * @return A failure of category {@link org.javai.railway.FailureCategory#FAULT}
     */
    Failure classify(String operation, Throwable throwable);
}
