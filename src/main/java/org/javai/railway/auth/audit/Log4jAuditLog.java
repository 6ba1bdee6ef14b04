package org.javai.railway.auth.audit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.railway.Failure;
import org.javai.railway.auth.User;

/**
 * Writes the audit trail through Log4j2.
 *
 * <ul>
 *   <li>success → INFO, marker {@code AUTH_SUCCESS}</li>
 *   <li>failure → WARN, marker {@code AUTH_FAILURE}</li>
 *   <li>best-effort side step failure → WARN, marker {@code SIDE_EFFECT_FAILURE}</li>
 * </ul>
 */
public class Log4jAuditLog implements AuditLog {

	private static final Marker SUCCESS_MARKER = MarkerManager.getMarker("AUTH_SUCCESS");
	private static final Marker FAILURE_MARKER = MarkerManager.getMarker("AUTH_FAILURE");
	private static final Marker SIDE_EFFECT_MARKER = MarkerManager.getMarker("SIDE_EFFECT_FAILURE");

	private final Logger logger;

	public Log4jAuditLog() {
		this(LogManager.getLogger("org.javai.railway.Audit"));
	}

	public Log4jAuditLog(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jAuditLog(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void loginSucceeded(User user) {
		logger.atInfo()
			.withMarker(SUCCESS_MARKER)
			.log("Login succeeded for user [{}]", user.id());
	}

	@Override
	public void loginFailed(String username, Failure failure) {
		logger.atWarn()
			.withMarker(FAILURE_MARKER)
			.log("Login failed for username [{}]: {} | code={}, category={}",
				username,
				failure.message(),
				failure.code(),
				failure.category());
	}

	@Override
	public void sideEffectFailed(String step, User user, Failure failure) {
		logger.atWarn()
			.withMarker(SIDE_EFFECT_MARKER)
			.log("Side step [{}] failed for user [{}], login continues: {} | code={}",
				step,
				user.id(),
				failure.message(),
				failure.code());
	}
}
