package org.javai.railway;

/**
 * Distinguishes failures a step reported on purpose from faults caught at a boundary.
 */
public enum FailureCategory {
    /**
     * The step returned a failed outcome (user not found, password mismatch).
     * Part of normal operation.
     */
    EXPECTED,

    /**
     * The step threw, and a {@link org.javai.railway.boundary.Boundary} converted the
     * exception into a failed outcome. Usually worth an operator's attention.
     */
    FAULT
}
