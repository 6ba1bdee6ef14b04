package org.javai.railway.ops;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.railway.Cause;
import org.javai.railway.Failure;

/**
 * Reports faults using Log4j2.
 *
 * <p>Every fault is logged at WARN with the {@code FAULT} marker. The underlying
 * exception type and fingerprint are included so that repeated faults from the same
 * call site can be grouped by log aggregation.
 */
public class Log4jOpReporter implements OpReporter {

	private static final Marker FAULT_MARKER = MarkerManager.getMarker("FAULT");

	private final Logger logger;

	/**
	 * Creates a Log4jOpReporter using the default logger name.
	 */
	public Log4jOpReporter() {
		this(LogManager.getLogger("org.javai.railway.OpReporter"));
	}

	/**
	 * Creates a Log4jOpReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jOpReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jOpReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(String operation, Failure failure) {
		logger.atWarn()
			.withMarker(FAULT_MARKER)
			.log(formatFaultMessage(operation, failure));
	}

	static String formatFaultMessage(String operation, Failure failure) {
		return "Fault in operation [%s]: %s | code=%s, category=%s%s".formatted(
				operation,
				failure.message(),
				failure.code(),
				failure.category(),
				formatCause(failure.cause()));
	}

	private static String formatCause(Cause cause) {
		if (cause == null) {
			return "";
		}
		return ", cause=" + cause.type() + ", fingerprint=" + cause.fingerprint();
	}
}
