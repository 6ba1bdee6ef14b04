package org.javai.railway;

import java.util.Objects;

/**
 * What a boundary kept of the exception it converted into a failure.
 *
 * <p>The exception itself is not retained, so failures stay plain values that can be logged,
 * compared and serialized. The fingerprint, {@code SimpleName@declaringClass:line} of the
 * throwing frame, groups repeats of the same fault.</p>
 *
 * @param type fully qualified exception class
 * @param fingerprint throw site, or the class name when the exception has no stack trace
 * @param detail the exception message, may be null
 */
public record Cause(String type, String fingerprint, String detail) {

    public Cause {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
    }

    public static Cause fromThrowable(Throwable thrown) {
        Objects.requireNonNull(thrown, "thrown must not be null");
        String type = thrown.getClass().getName();
        return new Cause(type, throwSite(thrown, type), thrown.getMessage());
    }

    private static String throwSite(Throwable thrown, String type) {
        StackTraceElement[] frames = thrown.getStackTrace();
        if (frames.length == 0) {
            return type;
        }
        StackTraceElement origin = frames[0];
        return thrown.getClass().getSimpleName() + "@" + origin.getClassName() + ":" + origin.getLineNumber();
    }
}
