package org.javai.railway.auth;

import org.javai.railway.Outcome;

/**
 * Records a successful login in the user's history.
 */
@FunctionalInterface
public interface HistoryRecorder {

    Outcome<Void> record(User user);
}
