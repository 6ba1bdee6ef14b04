package org.javai.railway;

import java.util.Objects;

/**
 * The single error shape threaded through a pipeline.
 *
 * <p>A failure is a plain value: two failures with the same code, message, category and
 * cause are equal. Timestamps belong to whoever records the failure.</p>
 *
 * @param code Namespaced failure identifier
 * @param message Human-readable description, never null
 * @param category Whether the failure was reported by a step or converted from a fault
 * @param cause The underlying exception, for faults (may be null)
 */
public record Failure(
        FailureCode code,
        String message,
        FailureCategory category,
        Cause cause
) {

    public Failure {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(category, "category must not be null");
    }

    /**
     * Creates a failure that a step reported through its return value.
     */
    public static Failure of(FailureCode code, String message) {
        return new Failure(code, message, FailureCategory.EXPECTED, null);
    }

    /**
     * Creates a failure converted from an exception at a boundary.
     */
    public static Failure fault(FailureCode code, String message, Cause cause) {
        return new Failure(code, message, FailureCategory.FAULT, cause);
    }

    public boolean isFault() {
        return category == FailureCategory.FAULT;
    }

    /**
     * Returns true if this failure carries the given code.
     */
    public boolean hasCode(FailureCode other) {
        return code.equals(other);
    }
}
