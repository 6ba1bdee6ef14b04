package org.javai.railway.auth;

import java.util.Objects;

/**
 * A user record as returned by a {@link UserLookup}. The pipeline only reads it.
 *
 * @param id stable user identifier
 * @param name display name
 * @param email address used for login confirmations
 * @param password the stored credential, as understood by the configured {@link PasswordChecker}
 */
public record User(String id, String name, String email, String password) {

    public User {
        Objects.requireNonNull(id, "id must not be null");
    }

    @Override
    public String toString() {
        return "User[id=" + id + ", name=" + name + ", email=" + email + ", password=***]";
    }
}
