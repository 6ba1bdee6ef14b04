package org.javai.railway.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Objects;
import java.util.function.BiPredicate;

import org.javai.railway.Outcome;

/**
 * Compares a stored credential with the password supplied at login.
 */
@FunctionalInterface
public interface PasswordChecker {

    String MISMATCH_MESSAGE = "Authentication Failed";

    /**
     * @param stored the credential held for the user
     * @param provided the password supplied with this attempt
     * @return Ok on a match, a failure otherwise
     */
    Outcome<Void> check(String stored, String provided);

    /**
     * Adapts a boolean comparison; false becomes {@link AuthFailure#CREDENTIAL_MISMATCH}.
     */
    static PasswordChecker ofPredicate(BiPredicate<String, String> matches) {
        Objects.requireNonNull(matches, "matches must not be null");
        return (stored, provided) -> matches.test(stored, provided)
                ? Outcome.ok()
                : AuthFailure.CREDENTIAL_MISMATCH.outcome(MISMATCH_MESSAGE);
    }

    /**
     * Plain-text comparison in constant time. For stores that keep the credential as given.
     */
    static PasswordChecker exactMatch() {
        return ofPredicate((stored, provided) -> stored != null && provided != null
                && MessageDigest.isEqual(
                        stored.getBytes(StandardCharsets.UTF_8),
                        provided.getBytes(StandardCharsets.UTF_8)));
    }
}
