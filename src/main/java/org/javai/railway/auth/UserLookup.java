package org.javai.railway.auth;

import java.util.Objects;
import java.util.function.Function;

import org.javai.railway.Outcome;

/**
 * Finds a user by username.
 */
@FunctionalInterface
public interface UserLookup {

    String NOT_FOUND_MESSAGE = "User not found";

    /**
     * @return the user, or a failure when the user is unknown or the store is unavailable
     */
    Outcome<User> findByUsername(String username);

    /**
     * Adapts a lookup that signals "not found" with null.
     */
    static UserLookup ofNullable(Function<String, User> finder) {
        Objects.requireNonNull(finder, "finder must not be null");
        return username -> {
            User user = finder.apply(username);
            return user != null ? Outcome.ok(user) : AuthFailure.NOT_FOUND.outcome(NOT_FOUND_MESSAGE);
        };
    }
}
