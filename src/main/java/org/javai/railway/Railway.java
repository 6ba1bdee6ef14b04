package org.javai.railway;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.railway.boundary.Boundary;
import org.javai.railway.boundary.ThrowingFunction;

/**
 * Combinators for composing fallible steps into a single short-circuiting pipeline.
 *
 * <p>Each combinator comes in two forms. The applied form takes the step and an outcome.
 * The curried form takes only the step and returns a function over outcomes, so a
 * pipeline is written as a chain of {@link Function#andThen} calls:</p>
 * <pre>{@code
 * Function<Request, Outcome<Response>> pipeline = validate
 *     .andThen(Railway.bind(this::load))
 *     .andThen(Railway.tee(this::check))
 *     .andThen(Railway.inspect(audit::record))
 *     .andThen(Railway.map(this::respond));
 * }</pre>
 *
 * <p>Once an outcome has failed, {@code bind}, {@code map}, {@code tee} and {@code tryWith}
 * skip their step and forward the failure unchanged. Only {@code inspect} observes a failed
 * outcome, and it cannot replace it. Steps never need to check whether the pipeline has
 * already failed.</p>
 *
 * <p>All combinators are stateless and safe to share between threads.</p>
 */
public final class Railway {

    private static final Logger LOG = LogManager.getLogger(Railway.class);

    private Railway() {
        // Utility class
    }

    // === bind ===

    /**
     * On success, returns the outcome of {@code step} applied to the value. On failure,
     * returns the failure without calling {@code step}.
     */
    public static <T, U> Outcome<U> bind(Function<? super T, ? extends Outcome<U>> step, Outcome<T> outcome) {
        Objects.requireNonNull(step, "step must not be null");
        return outcome.flatMap(step);
    }

    public static <T, U> Function<Outcome<T>, Outcome<U>> bind(Function<? super T, ? extends Outcome<U>> step) {
        Objects.requireNonNull(step, "step must not be null");
        return outcome -> outcome.flatMap(step);
    }

    // === map ===

    /**
     * On success, wraps the result of the non-failing {@code step}. On failure, passes through.
     */
    public static <T, U> Outcome<U> map(Function<? super T, ? extends U> step, Outcome<T> outcome) {
        Objects.requireNonNull(step, "step must not be null");
        return outcome.map(step);
    }

    public static <T, U> Function<Outcome<T>, Outcome<U>> map(Function<? super T, ? extends U> step) {
        Objects.requireNonNull(step, "step must not be null");
        return outcome -> outcome.map(step);
    }

    // === tee ===

    /**
     * Runs a fallible side step. On success the original outcome is returned and the side
     * step's own payload is discarded; a failing side step fails the pipeline.
     */
    public static <T> Outcome<T> tee(Function<? super T, ? extends Outcome<?>> step, Outcome<T> outcome) {
        Objects.requireNonNull(step, "step must not be null");
        return outcome.tee(step);
    }

    public static <T> Function<Outcome<T>, Outcome<T>> tee(Function<? super T, ? extends Outcome<?>> step) {
        Objects.requireNonNull(step, "step must not be null");
        return outcome -> outcome.tee(step);
    }

    // === tryWith / tryMap ===

    /**
     * Bind semantics inside a fault boundary: an exception thrown by {@code step} becomes a
     * failure carrying the exception's message.
     *
     * @see Boundary#tryWith(String, ThrowingFunction)
     */
    public static <T, U> Outcome<U> tryWith(
            ThrowingFunction<? super T, ? extends Outcome<U>, ? extends Exception> step, Outcome<T> outcome) {
        return Railway.<T, U>tryWith(step).apply(outcome);
    }

    public static <T, U> Function<Outcome<T>, Outcome<U>> tryWith(
            ThrowingFunction<? super T, ? extends Outcome<U>, ? extends Exception> step) {
        return Boundary.silent().tryWith("tryWith", step);
    }

    /**
     * Map semantics inside a fault boundary, for steps that only fail by throwing.
     */
    public static <T, U> Outcome<U> tryMap(
            ThrowingFunction<? super T, ? extends U, ? extends Exception> step, Outcome<T> outcome) {
        return Railway.<T, U>tryMap(step).apply(outcome);
    }

    public static <T, U> Function<Outcome<T>, Outcome<U>> tryMap(
            ThrowingFunction<? super T, ? extends U, ? extends Exception> step) {
        return Boundary.silent().tryMap("tryMap", step);
    }

    // === inspect ===

    /**
     * Observes the outcome on either branch and returns the same instance.
     *
     * <p>Intended for logging and auditing. An exception thrown by the observer is logged
     * and otherwise ignored, so observation can never change what the pipeline returns.</p>
     */
    public static <T> Function<Outcome<T>, Outcome<T>> inspect(Consumer<? super Outcome<T>> observer) {
        Objects.requireNonNull(observer, "observer must not be null");
        return outcome -> outcome.peek(o -> {
            try {
                observer.accept(o);
            } catch (RuntimeException e) {
                LOG.error("Outcome observer failed; outcome is passed on unchanged", e);
            }
        });
    }
}
