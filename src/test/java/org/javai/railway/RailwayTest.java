package org.javai.railway;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.*;

class RailwayTest {

    private static final FailureCode TEST_CODE = FailureCode.of("test", "error");

    @Test
    void bind_onOk_returnsStepOutcomeDirectly() {
        Outcome<Integer> expected = Outcome.ok(5);

        Outcome<Integer> result = Railway.bind((String s) -> expected, Outcome.ok("hello"));

        assertThat(result).isSameAs(expected);
    }

    @Test
    void bind_onFail_skipsStep() {
        Outcome<String> failed = Outcome.fail(TEST_CODE, "boom");
        List<String> calls = new ArrayList<>();

        Outcome<Integer> result = Railway.bind((String s) -> {
            calls.add(s);
            return Outcome.ok(s.length());
        }, failed);

        assertThat(result.error()).isEqualTo(failed.error());
        assertThat(calls).isEmpty();
    }

    @Test
    void map_wrapsPlainValue() {
        Outcome<Integer> result = Railway.map(String::length, Outcome.ok("hello"));

        assertThat(result.getOrThrow()).isEqualTo(5);
    }

    @Test
    void map_onFail_passesThrough() {
        Outcome<String> failed = Outcome.fail(TEST_CODE, "boom");

        Outcome<Integer> result = Railway.map(String::length, failed);

        assertThat(result.isFail()).isTrue();
        assertThat(result.error()).isEqualTo(failed.error());
    }

    @Test
    void tee_keepsValueRegardlessOfSideStepPayloadType() {
        Outcome<String> start = Outcome.ok("v");

        Outcome<String> result = Railway.tee((String s) -> Outcome.ok(List.of(1, 2, 3)), start);

        assertThat(result).isSameAs(start);
        assertThat(result.getOrThrow()).isEqualTo("v");
    }

    @Test
    void tee_sideStepFailure_failsPipeline() {
        Failure sideFailure = Failure.of(TEST_CODE, "mismatch");

        Outcome<String> result = Railway.tee((String s) -> Outcome.fail(sideFailure), Outcome.ok("v"));

        assertThat(result.error()).contains(sideFailure);
    }

    @Test
    void tee_onFail_skipsSideStep() {
        Outcome<String> failed = Outcome.fail(TEST_CODE, "boom");
        List<String> calls = new ArrayList<>();

        Outcome<String> result = Railway.tee((String s) -> {
            calls.add(s);
            return Outcome.ok();
        }, failed);

        assertThat(result).isSameAs(failed);
        assertThat(calls).isEmpty();
    }

    @Test
    void tryWith_convertsCheckedExceptionToFailureWithItsMessage() {
        Outcome<Integer> result = Railway.tryWith((String s) -> {
            throw new IOException("disk on fire");
        }, Outcome.ok("hello"));

        assertThat(result.isFail()).isTrue();
        Failure failure = result.error().orElseThrow();
        assertThat(failure.message()).isEqualTo("disk on fire");
        assertThat(failure.category()).isEqualTo(FailureCategory.FAULT);
        assertThat(failure.cause()).isNotNull();
        assertThat(failure.cause().type()).isEqualTo(IOException.class.getName());
    }

    @Test
    void tryWith_convertsRuntimeException() {
        Outcome<Integer> result = Railway.tryWith((String s) -> {
            throw new IllegalStateException("legacy blew up");
        }, Outcome.ok("hello"));

        assertThat(result.error().map(Failure::message)).contains("legacy blew up");
    }

    @Test
    void tryWith_exceptionWithoutMessage_usesClassName() {
        Outcome<Integer> result = Railway.tryWith((String s) -> {
            throw new UnsupportedOperationException();
        }, Outcome.ok("hello"));

        assertThat(result.error().map(Failure::message)).contains(UnsupportedOperationException.class.getName());
    }

    @Test
    void tryWith_successBehavesLikeBind() {
        Outcome<Integer> result = Railway.tryWith((String s) -> Outcome.ok(s.length()), Outcome.ok("hello"));

        assertThat(result.getOrThrow()).isEqualTo(5);
    }

    @Test
    void tryWith_onFail_skipsStep() {
        Outcome<String> failed = Outcome.fail(TEST_CODE, "boom");
        List<String> calls = new ArrayList<>();

        Outcome<Integer> result = Railway.tryWith((String s) -> {
            calls.add(s);
            return Outcome.ok(1);
        }, failed);

        assertThat(result.error()).isEqualTo(failed.error());
        assertThat(calls).isEmpty();
    }

    @Test
    void tryMap_wrapsThrowingPlainFunction() {
        Outcome<Integer> ok = Railway.tryMap((String s) -> Integer.parseInt(s), Outcome.ok("42"));
        Outcome<Integer> fail = Railway.tryMap((String s) -> Integer.parseInt(s), Outcome.ok("forty-two"));

        assertThat(ok.getOrThrow()).isEqualTo(42);
        assertThat(fail.isFail()).isTrue();
        assertThat(fail.error().orElseThrow().message()).contains("forty-two");
    }

    @Test
    void inspect_observesBothBranchesWithoutChangingThem() {
        List<Outcome<String>> seen = new ArrayList<>();
        Function<Outcome<String>, Outcome<String>> observe = Railway.inspect(seen::add);
        Outcome<String> ok = Outcome.ok("v");
        Outcome<String> fail = Outcome.fail(TEST_CODE, "boom");

        assertThat(observe.apply(ok)).isSameAs(ok);
        assertThat(observe.apply(fail)).isSameAs(fail);
        assertThat(seen).containsExactly(ok, fail);
    }

    @Test
    void inspect_throwingObserverCannotChangeOutcome() {
        Function<Outcome<String>, Outcome<String>> observe = Railway.inspect(o -> {
            throw new IllegalStateException("log sink down");
        });
        Outcome<String> fail = Outcome.fail(TEST_CODE, "boom");

        assertThat(observe.apply(fail)).isSameAs(fail);
    }

    @Test
    void curriedSteps_composeIntoShortCircuitingPipeline() {
        List<String> trace = new ArrayList<>();
        Function<String, Outcome<String>> start = Outcome::ok;
        Function<String, Outcome<Integer>> pipeline = start
                .andThen(Railway.<String, Integer>bind(s -> {
                    trace.add("parse");
                    return s.isEmpty() ? Outcome.fail(TEST_CODE, "empty") : Outcome.ok(s.length());
                }))
                .andThen(Railway.tee((Integer n) -> {
                    trace.add("check");
                    return Outcome.ok();
                }))
                .andThen(Railway.<Integer>inspect(o -> trace.add("log")))
                .andThen(Railway.map((Integer n) -> n * 2));

        assertThat(pipeline.apply("abc").getOrThrow()).isEqualTo(6);
        assertThat(trace).containsExactly("parse", "check", "log");

        trace.clear();
        Outcome<Integer> failed = pipeline.apply("");
        assertThat(failed.error().map(Failure::message)).contains("empty");
        assertThat(trace).containsExactly("parse", "log");
    }

    @Test
    void nullStep_isRejected() {
        assertThatThrownBy(() -> Railway.bind(null))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> Railway.inspect(null))
                .isInstanceOf(NullPointerException.class);
    }
}
