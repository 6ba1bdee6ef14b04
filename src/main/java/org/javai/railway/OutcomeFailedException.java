package org.javai.railway;

import java.util.Objects;

/**
 * Raised by {@link Outcome#getOrThrow()} when a pipeline ends on the failure track.
 *
 * <p>Leaving the railway this way is the caller's choice; inside a pipeline, failures travel
 * as values. The detail message names the failure code, and the failure itself is kept for
 * callers that catch this at an outer edge.</p>
 */
public class OutcomeFailedException extends RuntimeException {

    private final transient Failure failure;

    public OutcomeFailedException(Failure failure) {
        super(describe(Objects.requireNonNull(failure, "failure must not be null")));
        this.failure = failure;
    }

    public Failure failure() {
        return failure;
    }

    private static String describe(Failure failure) {
        return "Pipeline ended on the failure track [" + failure.code() + "]: " + failure.message();
    }
}
