package org.javai.railway.auth;

import java.util.Locale;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Settings for an {@link Authenticator}.
 *
 * @param confirmationMessage the message sent to the user after a successful login
 * @param notificationPolicy whether a failed notification fails the login
 * @param historyPolicy whether a failed history write fails the login
 */
public record AuthConfig(
		String confirmationMessage,
		SideEffectPolicy notificationPolicy,
		SideEffectPolicy historyPolicy
) {

	public static final String DEFAULT_CONFIRMATION_MESSAGE = "You have successfully logged in.";

	static final String MESSAGE_PROPERTY = "railway.auth.confirmationMessage";
	static final String MESSAGE_ENV = "RAILWAY_AUTH_CONFIRMATION_MESSAGE";
	static final String NOTIFICATION_POLICY_PROPERTY = "railway.auth.notificationPolicy";
	static final String NOTIFICATION_POLICY_ENV = "RAILWAY_AUTH_NOTIFICATION_POLICY";
	static final String HISTORY_POLICY_PROPERTY = "railway.auth.historyPolicy";
	static final String HISTORY_POLICY_ENV = "RAILWAY_AUTH_HISTORY_POLICY";

	public AuthConfig {
		Objects.requireNonNull(confirmationMessage, "confirmationMessage must not be null");
		Objects.requireNonNull(notificationPolicy, "notificationPolicy must not be null");
		Objects.requireNonNull(historyPolicy, "historyPolicy must not be null");
	}

	/**
	 * Required notification, best-effort history, default confirmation message.
	 */
	public static AuthConfig defaults() {
		return builder().build();
	}

	/**
	 * Resolves each setting from a system property, then an environment variable, then
	 * the default.
	 *
	 * @throws IllegalStateException if a policy value is not a {@link SideEffectPolicy} name
	 */
	public static AuthConfig fromEnvironment() {
		return fromSources(System::getProperty, System::getenv);
	}

	static AuthConfig fromSources(UnaryOperator<String> properties, UnaryOperator<String> environment) {
		Builder builder = builder();
		String message = resolve(properties, environment, MESSAGE_PROPERTY, MESSAGE_ENV);
		if (message != null) {
			builder.confirmationMessage(message);
		}
		String notification = resolve(properties, environment, NOTIFICATION_POLICY_PROPERTY, NOTIFICATION_POLICY_ENV);
		if (notification != null) {
			builder.notificationPolicy(parsePolicy(NOTIFICATION_POLICY_PROPERTY, notification));
		}
		String history = resolve(properties, environment, HISTORY_POLICY_PROPERTY, HISTORY_POLICY_ENV);
		if (history != null) {
			builder.historyPolicy(parsePolicy(HISTORY_POLICY_PROPERTY, history));
		}
		return builder.build();
	}

	private static String resolve(UnaryOperator<String> properties, UnaryOperator<String> environment,
								  String sysProp, String envVar) {
		String value = properties.apply(sysProp);
		if (value == null || value.isBlank()) {
			value = environment.apply(envVar);
		}
		if (value == null || value.isBlank()) {
			return null;
		}
		return value;
	}

	private static SideEffectPolicy parsePolicy(String key, String value) {
		try {
			return SideEffectPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new IllegalStateException(
				"Invalid configuration: '" + key + "' must be REQUIRED or BEST_EFFORT, was '" + value + "'", e);
		}
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {
		private String confirmationMessage = DEFAULT_CONFIRMATION_MESSAGE;
		private SideEffectPolicy notificationPolicy = SideEffectPolicy.REQUIRED;
		private SideEffectPolicy historyPolicy = SideEffectPolicy.BEST_EFFORT;

		private Builder() {
		}

		public Builder confirmationMessage(String confirmationMessage) {
			this.confirmationMessage = confirmationMessage;
			return this;
		}

		public Builder notificationPolicy(SideEffectPolicy notificationPolicy) {
			this.notificationPolicy = notificationPolicy;
			return this;
		}

		public Builder historyPolicy(SideEffectPolicy historyPolicy) {
			this.historyPolicy = historyPolicy;
			return this;
		}

		public AuthConfig build() {
			return new AuthConfig(confirmationMessage, notificationPolicy, historyPolicy);
		}
	}
}
