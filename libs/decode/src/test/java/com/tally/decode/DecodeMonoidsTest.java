package com.tally.decode;

import com.tally.algebra.Monoid;
import com.tally.algebra.Monoids;
import com.tally.validation.Errors;
import com.tally.validation.Validation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the three {@link Monoid} strategies over {@link Decode}.
 */
@DisplayName("DecodeMonoids")
class DecodeMonoidsTest {

    private static final List<String> INPUTS = List.of("a", "bb", "");

    private static <A> void assertSameResults(Decode<String, A> actual, Decode<String, A> expected) {
        for (String input : INPUTS) {
            assertThat(actual.decode(input)).as("input '%s'", input).isEqualTo(expected.decode(input));
        }
    }

    private static List<String> messages(Validation<?> validation) {
        return validation.errorsIfPresent().orElseThrow().messages();
    }

    /** Succeeds with the input length, or fails for empty input. */
    private static final Decode<String, Integer> LENGTH = input -> input.isEmpty()
            ? Decoders.<String, Integer>failure("empty").decode(input)
            : Validation.success(input.length());

    @Nested
    @DisplayName("applicativeMonoid")
    class ApplicativeMonoid {

        @Test
        @DisplayName("concatenates two successful string decoders")
        void concatenatesStrings() {
            Monoid<Decode<Object, String>> m = DecodeMonoids.applicativeMonoid(Monoids.string());

            Decode<Object, String> greeting = m.concat(Decoders.of("Hello"), Decoders.of(" World"));

            assertThat(greeting.decode(new Object())).isEqualTo(Validation.success("Hello World"));
        }

        @Test
        @DisplayName("accumulates the errors of two failing decoders")
        void accumulatesErrors() {
            Monoid<Decode<String, Integer>> m = DecodeMonoids.applicativeMonoid(Monoids.intSum());

            Validation<Integer> result = m.concat(Decoders.failure("err1"), Decoders.failure("err2")).decode("x");

            assertThat(messages(result)).hasSize(2).containsExactly("err1", "err2");
        }

        @Test
        @DisplayName("empty is a two-sided identity")
        void identity() {
            Monoid<Decode<String, Integer>> m = DecodeMonoids.applicativeMonoid(Monoids.intSum());

            assertSameResults(m.concat(LENGTH, m.empty()), LENGTH);
            assertSameResults(m.concat(m.empty(), LENGTH), LENGTH);
        }

        @Test
        @DisplayName("concat is associative")
        void associativity() {
            Monoid<Decode<String, Integer>> m = DecodeMonoids.applicativeMonoid(Monoids.intSum());
            Decode<String, Integer> x = LENGTH;
            Decode<String, Integer> y = Decoders.failure("y");
            Decode<String, Integer> z = LENGTH.map(n -> n * 10);

            assertSameResults(m.concat(m.concat(x, y), z), m.concat(x, m.concat(y, z)));
        }

        @Test
        @DisplayName("rejects a null inner monoid")
        void rejectsNull() {
            assertThatThrownBy(() -> DecodeMonoids.applicativeMonoid(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("alternativeMonoid")
    class AlternativeMonoid {

        private final Monoid<Decode<String, Integer>> m = DecodeMonoids.alternativeMonoid(Monoids.intSum());

        @Test
        @DisplayName("combines values when both sides succeed")
        void bothSucceed() {
            assertThat(m.concat(Decoders.of(2), Decoders.of(3)).decode("x")).isEqualTo(Validation.success(5));
        }

        @Test
        @DisplayName("falls back to the side that succeeds")
        void oneSucceeds() {
            assertThat(m.concat(Decoders.failure("left"), Decoders.of(3)).decode("x")).isEqualTo(Validation.success(3));
            assertThat(m.concat(Decoders.of(2), Decoders.failure("right")).decode("x")).isEqualTo(Validation.success(2));
        }

        @Test
        @DisplayName("lists the errors of every attempt when both sides fail")
        void bothFail() {
            Validation<Integer> result = m.concat(Decoders.failure("e1"), Decoders.failure("e2")).decode("x");

            assertThat(messages(result)).containsExactly("e1", "e2", "e1", "e2");
        }

        @Test
        @DisplayName("empty is a two-sided identity for succeeding decoders")
        void identity() {
            Decode<String, Integer> x = Decoders.fromFunction(String::length);

            assertSameResults(m.concat(x, m.empty()), x);
            assertSameResults(m.concat(m.empty(), x), x);
        }

        @Test
        @DisplayName("concat is associative for succeeding decoders")
        void associativity() {
            Decode<String, Integer> x = Decoders.fromFunction(String::length);
            Decode<String, Integer> y = Decoders.of(100);
            Decode<String, Integer> z = Decoders.of(7);

            assertSameResults(m.concat(m.concat(x, y), z), m.concat(x, m.concat(y, z)));
        }

        @Test
        @DisplayName("a failing decoder combined with empty yields the empty value")
        void failingWithEmpty() {
            assertThat(m.concat(Decoders.failure("bad"), m.empty()).decode("x")).isEqualTo(Validation.success(0));
        }
    }

    @Nested
    @DisplayName("altMonoid")
    class AltMonoid {

        @Test
        @DisplayName("a three-way fallback chain returns the first success")
        void threeWayFallback() {
            Monoid<Decode<String, Integer>> m = DecodeMonoids.altMonoid(() -> Decoders.of(0));

            Decode<String, Integer> chain = m.concat(m.concat(Decoders.failure("one"), Decoders.failure("two")), Decoders.of(42));

            assertThat(chain.decode("x")).isEqualTo(Validation.success(42));
        }

        @Test
        @DisplayName("aggregates errors in attempt order when every decoder fails")
        void allFail() {
            Monoid<Decode<String, Integer>> m = DecodeMonoids.altMonoid(() -> Decoders.left(Errors.empty()));

            Decode<String, Integer> chain = Decoders.fold(m,
                    List.of(Decoders.failure("a"), Decoders.failure("b"), Decoders.failure("c")));

            assertThat(messages(chain.decode("x"))).containsExactly("a", "b", "c");
        }

        @Test
        @DisplayName("never combines values")
        void keepsFirstSuccess() {
            Monoid<Decode<String, Integer>> m = DecodeMonoids.altMonoid(() -> Decoders.of(0));

            assertThat(m.concat(Decoders.of(1), Decoders.of(2)).decode("x")).isEqualTo(Validation.success(1));
        }

        @Test
        @DisplayName("an always-failing empty-error zero is a two-sided identity")
        void identity() {
            Monoid<Decode<String, Integer>> m = DecodeMonoids.altMonoid(() -> Decoders.left(Errors.empty()));

            assertSameResults(m.concat(LENGTH, m.empty()), LENGTH);
            assertSameResults(m.concat(m.empty(), LENGTH), LENGTH);
        }

        @Test
        @DisplayName("concat is associative")
        void associativity() {
            Monoid<Decode<String, Integer>> m = DecodeMonoids.altMonoid(() -> Decoders.of(0));
            Decode<String, Integer> y = Decoders.failure("y");
            Decode<String, Integer> z = Decoders.of(9);

            assertSameResults(m.concat(m.concat(LENGTH, y), z), m.concat(LENGTH, m.concat(y, z)));
        }

        @Test
        @DisplayName("the zero supplier is called for each empty()")
        void zeroIsLazy() {
            var calls = new AtomicInteger();
            Monoid<Decode<String, Integer>> m = DecodeMonoids.altMonoid(() -> {
                calls.incrementAndGet();
                return Decoders.of(0);
            });

            m.concat(Decoders.of(1), Decoders.of(2));
            assertThat(calls).hasValue(0);

            m.empty();
            assertThat(calls).hasValue(1);
        }
    }
}
