package org.javai.railway.auth;

import java.util.Objects;
import java.util.function.Function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.railway.Outcome;
import org.javai.railway.Railway;
import org.javai.railway.boundary.Boundary;
import org.javai.railway.auth.audit.AuditLog;
import org.javai.railway.ops.OpReporter;

/**
 * Authenticates a username and password by threading them through a railway of steps:
 *
 * <ol>
 *   <li>validate: both values present and not blank</li>
 *   <li>lookup ({@code bind}): find the user, pair it with the supplied password</li>
 *   <li>password check ({@code tee})</li>
 *   <li>notify ({@code tee}): send the confirmation message</li>
 *   <li>record history ({@code tee}), when a {@link HistoryRecorder} is configured</li>
 *   <li>audit ({@code inspect}): always runs, never changes the result</li>
 *   <li>build response ({@code map}): drop the password, keep the user</li>
 * </ol>
 *
 * <p>The first failing step decides the result; no later collaborator is called. Every
 * collaborator call goes through a {@link Boundary}, so a collaborator that throws yields a
 * failed outcome rather than an exception.</p>
 *
 * <p>An Authenticator holds no per-call state and may be shared between threads, provided
 * its collaborators can be.</p>
 */
public final class Authenticator {

	private static final Logger LOG = LogManager.getLogger(Authenticator.class);

	static final String INVALID_PARAMS = "Invalid params";
	static final String NOTIFY_STEP = "notify";
	static final String HISTORY_STEP = "history";

	private final AuditLog auditLog;
	private final Function<Credentials, Outcome<LoginAttempt>> verify;
	private final Function<Outcome<LoginAttempt>, Outcome<User>> buildResponse = Railway.map(LoginAttempt::user);

	private Authenticator(Builder builder) {
		this.auditLog = builder.auditLog;
		this.verify = compose(builder);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Creates an Authenticator with default configuration, no history recording and no audit log.
	 */
	public static Authenticator of(UserLookup lookup, PasswordChecker passwordChecker, Notifier notifier) {
		return builder()
				.userLookup(lookup)
				.passwordChecker(passwordChecker)
				.notifier(notifier)
				.build();
	}

	public Outcome<User> authenticate(String username, String password) {
		return authenticate(Credentials.of(username, password));
	}

	/**
	 * Runs the pipeline once.
	 *
	 * @param credentials the supplied credentials; null is treated as missing values
	 * @return Ok with the user returned by the lookup, or the failure of the first failing step
	 */
	public Outcome<User> authenticate(Credentials credentials) {
		Credentials input = credentials != null ? credentials : Credentials.of(null, null);
		return verify
				.andThen(Railway.<LoginAttempt>inspect(outcome -> audit(input.username(), outcome)))
				.andThen(buildResponse)
				.apply(input);
	}

	private Function<Credentials, Outcome<LoginAttempt>> compose(Builder builder) {
		Boundary boundary = Boundary.withReporter(builder.opReporter);
		AuthConfig config = builder.config;
		UserLookup lookup = builder.userLookup;
		PasswordChecker checker = builder.passwordChecker;
		Notifier notifier = builder.notifier;

		Function<Credentials, Outcome<LoginAttempt>> findUser =
				boundary.guard("UserLookup.findByUsername",
						credentials -> lookup.findByUsername(credentials.username())
								.flatMap(user -> pair(user, credentials)));
		Function<LoginAttempt, Outcome<Void>> checkPassword =
				boundary.guard("PasswordChecker.check",
						attempt -> checker.check(attempt.user().password(), attempt.providedPassword()));
		Function<LoginAttempt, Outcome<Void>> notify =
				boundary.guard("Notifier.send",
						attempt -> notifier.send(attempt.user().email(), config.confirmationMessage()));

		Function<Credentials, Outcome<Credentials>> validate = Authenticator::validate;
		Function<Credentials, Outcome<LoginAttempt>> chain = validate
				.andThen(Railway.bind(findUser))
				.andThen(Railway.tee(checkPassword))
				.andThen(sideStep(NOTIFY_STEP, config.notificationPolicy(), notify));

		if (builder.historyRecorder != null) {
			HistoryRecorder recorder = builder.historyRecorder;
			Function<LoginAttempt, Outcome<Void>> recordHistory =
					boundary.guard("HistoryRecorder.record", attempt -> recorder.record(attempt.user()));
			chain = chain.andThen(sideStep(HISTORY_STEP, config.historyPolicy(), recordHistory));
		}
		return chain;
	}

	static Outcome<Credentials> validate(Credentials credentials) {
		return credentials.isComplete()
				? Outcome.ok(credentials)
				: AuthFailure.INVALID_INPUT.outcome(INVALID_PARAMS);
	}

	// A lookup that answers Ok(null) is treated as not having found the user.
	private static Outcome<LoginAttempt> pair(User user, Credentials credentials) {
		return user != null
				? Outcome.ok(new LoginAttempt(user, credentials.password()))
				: AuthFailure.NOT_FOUND.outcome(UserLookup.NOT_FOUND_MESSAGE);
	}

	private Function<Outcome<LoginAttempt>, Outcome<LoginAttempt>> sideStep(
			String name, SideEffectPolicy policy, Function<LoginAttempt, Outcome<Void>> effect) {
		if (policy == SideEffectPolicy.REQUIRED) {
			return Railway.tee(effect);
		}
		return Railway.tee((LoginAttempt attempt) -> effect.apply(attempt).recoverWith(failure -> {
			safely(() -> auditLog.sideEffectFailed(name, attempt.user(), failure));
			return Outcome.ok();
		}));
	}

	private void audit(String username, Outcome<LoginAttempt> outcome) {
		if (outcome instanceof Outcome.Ok<LoginAttempt> ok) {
			auditLog.loginSucceeded(ok.value().user());
		} else if (outcome instanceof Outcome.Fail<LoginAttempt> fail) {
			auditLog.loginFailed(username, fail.failure());
		}
	}

	private static void safely(Runnable auditCall) {
		try {
			auditCall.run();
		} catch (RuntimeException e) {
			LOG.error("Audit log failed; authentication result is unaffected", e);
		}
	}

	/**
	 * Collaborators and settings for an {@link Authenticator}. Lookup, password checker and
	 * notifier are required.
	 */
	public static class Builder {
		private UserLookup userLookup;
		private PasswordChecker passwordChecker;
		private Notifier notifier;
		private HistoryRecorder historyRecorder;
		private AuditLog auditLog = AuditLog.noOp();
		private OpReporter opReporter = OpReporter.noOp();
		private AuthConfig config = AuthConfig.defaults();

		private Builder() {
		}

		public Builder userLookup(UserLookup userLookup) {
			this.userLookup = userLookup;
			return this;
		}

		public Builder passwordChecker(PasswordChecker passwordChecker) {
			this.passwordChecker = passwordChecker;
			return this;
		}

		public Builder notifier(Notifier notifier) {
			this.notifier = notifier;
			return this;
		}

		/**
		 * Optional. Without a recorder the history step is left out of the pipeline.
		 */
		public Builder historyRecorder(HistoryRecorder historyRecorder) {
			this.historyRecorder = historyRecorder;
			return this;
		}

		public Builder auditLog(AuditLog auditLog) {
			this.auditLog = auditLog;
			return this;
		}

		/**
		 * Receives faults thrown by collaborators, after they have been converted to failures.
		 */
		public Builder opReporter(OpReporter opReporter) {
			this.opReporter = opReporter;
			return this;
		}

		public Builder config(AuthConfig config) {
			this.config = config;
			return this;
		}

		public Authenticator build() {
			Objects.requireNonNull(userLookup, "userLookup must not be null");
			Objects.requireNonNull(passwordChecker, "passwordChecker must not be null");
			Objects.requireNonNull(notifier, "notifier must not be null");
			Objects.requireNonNull(auditLog, "auditLog must not be null");
			Objects.requireNonNull(opReporter, "opReporter must not be null");
			Objects.requireNonNull(config, "config must not be null");
			return new Authenticator(this);
		}
	}
}
