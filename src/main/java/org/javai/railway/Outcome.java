package org.javai.railway;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Represents the outcome of an operation that may fail.
 * Either {@link Ok} containing a successful value, or {@link Fail} containing a {@link Failure}.
 *
 * <p>Outcomes are immutable. Every transformation returns a new Outcome (or the same
 * instance when nothing changes); a failed outcome never runs the functions passed to
 * {@link #map}, {@link #flatMap} or {@link #tee}.
 *
 * @param <T> The type of the successful value
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Fail {

    /**
     * A successful outcome containing a value.
     *
     * @param value the successful value
     */
    record Ok<T>(T value) implements Outcome<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public boolean isFail() {
            return false;
        }

        @Override
        public Optional<Failure> error() {
            return Optional.empty();
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            return value;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            Objects.requireNonNull(mapper);
            return Objects.requireNonNull(mapper.apply(value), "mapper returned null outcome");
        }

        @Override
        public Outcome<T> tee(Function<? super T, ? extends Outcome<?>> sideEffect) {
            Objects.requireNonNull(sideEffect);
            Outcome<?> result = Objects.requireNonNull(sideEffect.apply(value), "side effect returned null outcome");
            if (result instanceof Fail<?> fail) {
                return fail.retype();
            }
            return this;
        }

        @Override
        public Outcome<T> peek(Consumer<? super Outcome<T>> observer) {
            Objects.requireNonNull(observer);
            observer.accept(this);
            return this;
        }

        @Override
        public Outcome<T> recover(Function<? super Failure, ? extends T> recovery) {
            return this;
        }

        @Override
        public Outcome<T> recoverWith(Function<? super Failure, ? extends Outcome<T>> recovery) {
            return this;
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onOk, Function<? super Failure, ? extends R> onFail) {
            Objects.requireNonNull(onOk);
            return onOk.apply(value);
        }
    }

    /**
     * A failed outcome containing failure details.
     *
     * @param failure the failure details
     */
    record Fail<T>(Failure failure) implements Outcome<T> {

        public Fail {
            Objects.requireNonNull(failure, "failure must not be null");
        }

        /**
         * Returns this failure as an outcome of another value type. Safe because a
         * Fail holds no value.
         */
        @SuppressWarnings("unchecked")
        public <U> Outcome<U> retype() {
            return (Outcome<U>) (Outcome<?>) this;
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public boolean isFail() {
            return true;
        }

        @Override
        public T getOrThrow() {
            throw new OutcomeFailedException(failure);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.get();
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return retype();
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            return retype();
        }

        @Override
        public Outcome<T> tee(Function<? super T, ? extends Outcome<?>> sideEffect) {
            return this;
        }

        @Override
        public Outcome<T> peek(Consumer<? super Outcome<T>> observer) {
            Objects.requireNonNull(observer);
            observer.accept(this);
            return this;
        }

        @Override
        public Outcome<T> recover(Function<? super Failure, ? extends T> recovery) {
            Objects.requireNonNull(recovery);
            return new Ok<>(recovery.apply(failure));
        }

        @Override
        public Outcome<T> recoverWith(Function<? super Failure, ? extends Outcome<T>> recovery) {
            Objects.requireNonNull(recovery);
            return recovery.apply(failure);
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onOk, Function<? super Failure, ? extends R> onFail) {
            Objects.requireNonNull(onFail);
            return onFail.apply(failure);
        }

        @Override
        public Optional<Failure> error() {
            return Optional.of(failure);
        }
    }

    // Query methods
    boolean isOk();
    boolean isFail();

    /**
     * Returns the failure if this outcome failed.
     */
    Optional<Failure> error();

    // Value extraction
    T getOrThrow();
    T getOrElse(T defaultValue);
    T getOrElseGet(Supplier<? extends T> supplier);

    // Transformations
    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);
    <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper);

    /**
     * Runs a fallible side step against the value without changing it.
     *
     * <p>On success the side step's own payload is discarded and this same outcome is
     * returned. If the side step fails, its failure replaces this outcome.
     *
     * @param sideEffect the step to run; its success type is irrelevant
     * @return this outcome, or the side step's failure
     */
    Outcome<T> tee(Function<? super T, ? extends Outcome<?>> sideEffect);

    /**
     * Passes this outcome to an observer, whichever branch it is on, and returns it unchanged.
     */
    Outcome<T> peek(Consumer<? super Outcome<T>> observer);

    // Recovery
    Outcome<T> recover(Function<? super Failure, ? extends T> recovery);
    Outcome<T> recoverWith(Function<? super Failure, ? extends Outcome<T>> recovery);

    <R> R fold(Function<? super T, ? extends R> onOk, Function<? super Failure, ? extends R> onFail);

    // Static factories
    static Outcome<Void> ok() {
        return new Ok<>(null);
    }

    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> fail(Failure failure) {
        return new Fail<>(failure);
    }

    /**
     * Creates a failed outcome for an expected failure.
     *
     * @param code the failure code
     * @param message human-readable description of what went wrong
     * @param <T> the type parameter for the outcome
     * @return a failed outcome
     */
    static <T> Outcome<T> fail(FailureCode code, String message) {
        return new Fail<>(Failure.of(code, message));
    }
}
