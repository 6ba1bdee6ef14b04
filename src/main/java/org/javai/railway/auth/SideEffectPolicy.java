package org.javai.railway.auth;

/**
 * Whether a failing side step (notification, history) fails the authentication.
 */
public enum SideEffectPolicy {
    /**
     * The side step's failure becomes the pipeline's failure.
     */
    REQUIRED,

    /**
     * The side step's failure is audited and the pipeline continues with its value unchanged.
     */
    BEST_EFFORT
}
