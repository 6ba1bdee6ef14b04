package org.javai.railway.boundary;

import java.util.Objects;
import java.util.function.Function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.railway.Failure;
import org.javai.railway.Outcome;
import org.javai.railway.ops.OpReporter;

/**
 * The fault boundary for operations that report failure by throwing rather than by
 * returning an {@link Outcome}. Catches the exception, classifies it into a
 * {@link Failure}, reports it, and returns a failed Outcome.
 *
 * <p>This is the one sanctioned place where exceptions become failures. Any
 * {@link Exception}, checked or not, is converted; {@link Error}s propagate.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Boundary boundary = Boundary.withReporter(new Log4jOpReporter());
 *
 * Function<Outcome<String>, Outcome<User>> lookup =
 *     boundary.tryWith("UserStore.find", username -> legacyStore.find(username));
 * }</pre>
 */
public final class Boundary {

    private static final Logger LOG = LogManager.getLogger(Boundary.class);
    private static final FailureClassifier DEFAULT_CLASSIFIER = new DefaultFailureClassifier();
    private static final Boundary SILENT = new Boundary(DEFAULT_CLASSIFIER, OpReporter.noOp());

    private final FailureClassifier classifier;
    private final OpReporter reporter;

    /**
     * Returns a Boundary that classifies faults but does not report them.
     *
     * @return a Boundary with default classification and no reporting
     */
    public static Boundary silent() {
        return SILENT;
    }

    /**
     * Creates a Boundary with default classification and the specified reporter.
     *
     * @param reporter the reporter for fault notifications
     * @return a Boundary with default classification and custom reporting
     */
    public static Boundary withReporter(OpReporter reporter) {
        return new Boundary(DEFAULT_CLASSIFIER, reporter);
    }

    /**
     * Creates a Boundary with custom classification and reporting.
     *
     * @param classifier the classifier for translating exceptions to failures
     * @param reporter the reporter for fault notifications
     * @return a fully configured Boundary
     */
    public static Boundary of(FailureClassifier classifier, OpReporter reporter) {
        return new Boundary(classifier, reporter);
    }

    public Boundary(FailureClassifier classifier, OpReporter reporter) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Applies a fallible step to an input, converting any exception it throws into a failure.
     *
     * @param operation the operation name for classification and reporting
     * @param input the value passed to the step
     * @param work the step to run
     * @return the step's own outcome, or Fail with a classified fault
     */
    public <T, R> Outcome<R> call(String operation, T input,
                                  ThrowingFunction<? super T, ? extends Outcome<R>, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        try {
            return Objects.requireNonNull(work.apply(input), "work returned null outcome");
        } catch (Exception e) {
            return handleException(operation, e);
        }
    }

    /**
     * Bind inside this boundary: a curried step that runs {@code work} on a successful
     * value and passes failures through untouched.
     */
    public <T, R> Function<Outcome<T>, Outcome<R>> tryWith(
            String operation, ThrowingFunction<? super T, ? extends Outcome<R>, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");
        return outcome -> outcome.flatMap(value -> call(operation, value, work));
    }

    /**
     * Map inside this boundary: {@code work} cannot report failure other than by throwing.
     */
    public <T, R> Function<Outcome<T>, Outcome<R>> tryMap(
            String operation, ThrowingFunction<? super T, ? extends R, ? extends Exception> work) {
        Objects.requireNonNull(work, "work must not be null");
        return tryWith(operation, value -> Outcome.ok(work.apply(value)));
    }

    /**
     * Wraps a step so it can be used with {@link Outcome#flatMap} or {@link Outcome#tee}
     * without letting exceptions escape.
     */
    public <T, R> Function<T, Outcome<R>> guard(
            String operation, ThrowingFunction<? super T, ? extends Outcome<R>, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");
        return value -> call(operation, value, work);
    }

    private <R> Outcome<R> handleException(String operation, Exception e) {
        Failure failure = classifier.classify(operation, e);
        try {
            reporter.report(operation, failure);
        } catch (RuntimeException reportError) {
            LOG.error("OpReporter failed while reporting fault in [{}]", operation, reportError);
        }
        return Outcome.fail(failure);
    }
}
