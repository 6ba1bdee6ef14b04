package org.javai.railway.auth;

import java.util.Arrays;
import java.util.Optional;

import org.javai.railway.Failure;
import org.javai.railway.FailureCode;
import org.javai.railway.Outcome;

/**
 * The closed set of failure kinds raised by the authentication pipeline and its adapters.
 * Each kind owns a {@link FailureCode} in the {@code auth} namespace.
 */
public enum AuthFailure {

    INVALID_INPUT("invalid_input"),
    NOT_FOUND("not_found"),
    CREDENTIAL_MISMATCH("credential_mismatch"),
    NOTIFY_FAILED("notify_failed"),
    HISTORY_FAILED("history_failed");

    public static final String NAMESPACE = "auth";

    private final FailureCode code;

    AuthFailure(String name) {
        this.code = FailureCode.of(NAMESPACE, name);
    }

    public FailureCode code() {
        return code;
    }

    public Failure failure(String message) {
        return Failure.of(code, message);
    }

    public <T> Outcome<T> outcome(String message) {
        return Outcome.fail(failure(message));
    }

    /**
     * Finds the kind a failure was raised with, if it came from this enum.
     */
    public static Optional<AuthFailure> of(Failure failure) {
        if (!failure.code().inNamespace(NAMESPACE)) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(kind -> failure.hasCode(kind.code))
                .findFirst();
    }
}
