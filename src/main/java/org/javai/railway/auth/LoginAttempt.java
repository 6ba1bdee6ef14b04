package org.javai.railway.auth;

import java.util.Objects;

/**
 * A looked-up user paired with the password supplied for this attempt. Carried between
 * lookup and response building so that later steps can see both.
 */
public record LoginAttempt(User user, String providedPassword) {

    public LoginAttempt {
        Objects.requireNonNull(user, "user must not be null");
    }

    @Override
    public String toString() {
        return "LoginAttempt[user=" + user + ", providedPassword=***]";
    }
}
