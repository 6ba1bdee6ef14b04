package org.javai.railway.auth.audit;

import org.javai.railway.Failure;
import org.javai.railway.auth.User;

/**
 * Receives the audit trail of authentication attempts.
 *
 * <p>Implementations are fire-and-forget: they must not throw, and nothing they do can
 * change the result of an authentication.
 */
public interface AuditLog {

	/**
	 * Called once for every attempt that authenticated.
	 */
	void loginSucceeded(User user);

	/**
	 * Called once for every attempt that failed, whichever step failed.
	 *
	 * @param username the username as supplied, possibly null or blank
	 * @param failure the failure the pipeline returns
	 */
	void loginFailed(String username, Failure failure);

	/**
	 * Called when a best-effort side step failed and the attempt continued.
	 *
	 * @param step the side step name, e.g. "notify"
	 * @param user the user being authenticated
	 * @param failure the side step's failure
	 */
	void sideEffectFailed(String step, User user, Failure failure);

	/**
	 * An audit log that records nothing. Useful for testing.
	 */
	static AuditLog noOp() {
		return new AuditLog() {
			@Override
			public void loginSucceeded(User user) {
			}

			@Override
			public void loginFailed(String username, Failure failure) {
			}

			@Override
			public void sideEffectFailed(String step, User user, Failure failure) {
			}
		};
	}
}
