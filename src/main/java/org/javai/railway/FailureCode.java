package org.javai.railway;

import java.util.Objects;

/**
 * Identifies what kind of failure left the success track.
 *
 * <p>Steps that fail on purpose use their own namespace ({@code auth:not_found}); faults
 * converted at a boundary use the classifier's namespaces ({@code io:io_error},
 * {@code fault:IllegalStateException}). Codes compare by value and print as
 * {@code namespace:name}.</p>
 *
 * @param namespace who raised the failure, never blank
 * @param name the kind within that namespace, never blank
 */
public record FailureCode(String namespace, String name) {

    public FailureCode {
        requireText(namespace, "namespace");
        requireText(name, "name");
    }

    public static FailureCode of(String namespace, String name) {
        return new FailureCode(namespace, name);
    }

    /**
     * Returns true if this code was raised under the given namespace.
     */
    public boolean inNamespace(String candidate) {
        return namespace.equals(candidate);
    }

    private static void requireText(String value, String field) {
        Objects.requireNonNull(value, field + " must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }

    @Override
    public String toString() {
        return namespace + ":" + name;
    }
}
