package org.javai.railway.auth;

import org.javai.railway.Outcome;

/**
 * Delivers a message to a user's email address.
 */
@FunctionalInterface
public interface Notifier {

    Outcome<Void> send(String email, String message);
}
