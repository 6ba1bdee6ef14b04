package org.javai.railway.auth.audit;

import java.time.Clock;
import java.time.format.DateTimeFormatter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.railway.Failure;
import org.javai.railway.auth.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the audit trail as JSON lines via SLF4J, one object per event.
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"login_failed","timestamp":"2024-01-20T10:30:00Z","username":"alice","code":"auth:credential_mismatch","category":"EXPECTED","message":"Authentication Failed"}
 * }</pre>
 */
public class JsonAuditLog implements AuditLog {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.railway.AuditJson";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final Logger logger;
	private final ObjectMapper mapper;
	private final Clock clock;

	public JsonAuditLog() {
		this(LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), new ObjectMapper(), Clock.systemUTC());
	}

	public JsonAuditLog(String loggerName) {
		this(LoggerFactory.getLogger(loggerName), new ObjectMapper(), Clock.systemUTC());
	}

	/**
	 * Package-private for testing.
	 */
	JsonAuditLog(Logger logger, ObjectMapper mapper, Clock clock) {
		this.logger = logger;
		this.mapper = mapper;
		this.clock = clock;
	}

	@Override
	public void loginSucceeded(User user) {
		ObjectNode event = event("login_succeeded");
		event.put("userId", user.id());
		emit(event);
	}

	@Override
	public void loginFailed(String username, Failure failure) {
		ObjectNode event = event("login_failed");
		event.put("username", username);
		putFailure(event, failure);
		emit(event);
	}

	@Override
	public void sideEffectFailed(String step, User user, Failure failure) {
		ObjectNode event = event("side_effect_failed");
		event.put("step", step);
		event.put("userId", user.id());
		putFailure(event, failure);
		emit(event);
	}

	private ObjectNode event(String eventType) {
		ObjectNode event = mapper.createObjectNode();
		event.put("eventType", eventType);
		event.put("timestamp", ISO_FORMATTER.format(clock.instant()));
		return event;
	}

	private static void putFailure(ObjectNode event, Failure failure) {
		event.put("code", failure.code().toString());
		event.put("category", failure.category().name());
		event.put("message", failure.message());
		if (failure.cause() != null) {
			event.put("cause", failure.cause().type());
		}
	}

	private void emit(ObjectNode event) {
		try {
			logger.info(mapper.writeValueAsString(event));
		} catch (JsonProcessingException e) {
			logger.warn("Could not serialize audit event [{}]", event.path("eventType").asText(), e);
		}
	}
}
