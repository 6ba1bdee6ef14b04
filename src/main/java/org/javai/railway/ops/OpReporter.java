package org.javai.railway.ops;

import org.javai.railway.Failure;

/**
 * Reports faults caught at a {@link org.javai.railway.boundary.Boundary} for observability
 * and operator notification.
 */
@FunctionalInterface
public interface OpReporter {

    /**
     * Reports a fault occurrence.
     *
     * @param operation the operation that threw
     * @param failure the classified failure
     */
    void report(String operation, Failure failure);

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static OpReporter noOp() {
        return (operation, failure) -> {};
    }
}
