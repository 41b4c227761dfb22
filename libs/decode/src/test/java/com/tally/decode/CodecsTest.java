package com.tally.decode;

import com.tally.algebra.Monoid;
import com.tally.validation.Context;
import com.tally.validation.Errors;
import com.tally.validation.Validation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Codecs}: fallback, priority lists and sequencing of codecs.
 */
@DisplayName("Codecs")
class CodecsTest {

    private static final Codec<Integer, String, String> DECIMAL = Codecs.of("Decimal",
            (input, context) -> input.matches("\\d{1,9}")
                    ? Validation.success(Integer.parseInt(input))
                    : Validate.<String, Integer>failure("not a decimal number").validate(input, context),
            String::valueOf);

    private static final Codec<Integer, String, String> HEX = Codecs.of("Hex",
            (input, context) -> input.matches("0x[0-9a-fA-F]{1,7}")
                    ? Validation.success(Integer.parseInt(input.substring(2), 16))
                    : Validate.<String, Integer>failure("not a hex number").validate(input, context),
            n -> "0x" + Integer.toHexString(n));

    private static final Codec<Integer, Integer, Integer> PORT = Codecs.of("Port",
            (input, context) -> input >= 1 && input <= 65535
                    ? Validation.success(input)
                    : Validate.<Integer, Integer>failure("out of range").validate(input, context),
            n -> n);

    private static List<String> messages(Validation<?> validation) {
        return validation.errorsIfPresent().orElseThrow().messages();
    }

    @Nested
    @DisplayName("alt")
    class Alt {

        private final Codec<Integer, String, String> number = DECIMAL.alt(() -> HEX);

        @Test
        @DisplayName("uses the first codec when it succeeds")
        void firstWins() {
            assertThat(number.decode("42")).isEqualTo(Validation.success(42));
        }

        @Test
        @DisplayName("falls back to the second codec")
        void fallsBack() {
            assertThat(number.decode("0xff")).isEqualTo(Validation.success(255));
        }

        @Test
        @DisplayName("returns the errors of both codecs in attempt order")
        void bothFail() {
            assertThat(messages(number.decode("ten"))).containsExactly("not a decimal number", "not a hex number");
        }

        @Test
        @DisplayName("does not build the second codec when the first succeeds")
        void lazy() {
            var calls = new AtomicInteger();
            Supplier<Codec<Integer, String, String>> second = () -> {
                calls.incrementAndGet();
                return HEX;
            };
            Codec<Integer, String, String> lazyNumber = Codecs.alt(DECIMAL, second);

            lazyNumber.decode("7");
            assertThat(calls).hasValue(0);

            lazyNumber.decode("0x7");
            assertThat(calls).hasValue(1);
        }

        @Test
        @DisplayName("is named after the first codec and encodes with it")
        void namingAndEncoding() {
            assertThat(number.name()).isEqualTo("Alt[Decimal]");
            assertThat(number.encode(255)).isEqualTo("255");
        }
    }

    @Nested
    @DisplayName("altMonoid")
    class AltMonoid {

        @Test
        @DisplayName("folds a priority list of codecs")
        void priorityList() {
            Codec<Integer, String, String> never = Codecs.of("Never",
                    (input, context) -> Validation.failure(Errors.empty()), String::valueOf);
            Monoid<Codec<Integer, String, String>> m = Codecs.altMonoid(() -> never);

            Codec<Integer, String, String> number = m.concat(m.concat(m.empty(), DECIMAL), HEX);

            assertThat(number.decode("0x10")).isEqualTo(Validation.success(16));
            assertThat(messages(number.decode("?"))).containsExactly("not a decimal number", "not a hex number");
        }
    }

    @Nested
    @DisplayName("pipe")
    class Pipe {

        private final Codec<Integer, String, String> port = DECIMAL.pipe(PORT);

        @Test
        @DisplayName("feeds the first codec's value into the second")
        void sequences() {
            assertThat(port.decode("8080")).isEqualTo(Validation.success(8080));
            assertThat(messages(port.decode("70000"))).containsExactly("out of range");
        }

        @Test
        @DisplayName("stops at the first codec's failure")
        void shortCircuits() {
            assertThat(messages(port.decode("http"))).containsExactly("not a decimal number");
        }

        @Test
        @DisplayName("validates both stages in the caller's context")
        void sharesContext() {
            Validation<Integer> result = port.validate("0", Context.root().push("server", "Server"));

            assertThat(result.errorsIfPresent().orElseThrow().get(0).path()).isEqualTo("server");
        }

        @Test
        @DisplayName("encodes through both codecs and names both")
        void encodingAndName() {
            assertThat(port.encode(443)).isEqualTo("443");
            assertThat(port.name()).isEqualTo("Pipe(Decimal, Port)");
            assertThat(HEX.pipe(PORT).encode(255).toLowerCase(Locale.ROOT)).isEqualTo("0xff");
        }
    }

    @Test
    @DisplayName("rejects missing parts")
    void rejectsNull() {
        assertThatThrownBy(() -> Codecs.of(null, Validate.of(1), String::valueOf))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("name must not be null");
        assertThatThrownBy(() -> DECIMAL.alt(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
