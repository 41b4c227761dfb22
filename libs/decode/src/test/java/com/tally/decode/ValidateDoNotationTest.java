package com.tally.decode;

import com.tally.validation.Context;
import com.tally.validation.Errors;
import com.tally.validation.Validation;
import com.tally.validation.ValidationError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ValidateDoNotation}: building a struct field by field while keeping error paths.
 */
@DisplayName("ValidateDoNotation")
class ValidateDoNotationTest {

    record Server(String host, int port, String url) {

        static final Server EMPTY = new Server("", 0, "");

        Server withHost(String host) {
            return new Server(host, port, url);
        }

        Server withPort(int port) {
            return new Server(host, port, url);
        }

        Server withUrl(String url) {
            return new Server(host, port, url);
        }
    }

    private static final Lens<Server, String> HOST_LENS = Lens.of(Server::host, (host, s) -> s.withHost(host));
    private static final Lens<Server, Integer> PORT_LENS = Lens.of(Server::port, (port, s) -> s.withPort(port));

    private static final Context CONFIG = Context.root().push("config", "Config");

    private static final Validate<String, String> NOT_BLANK = (input, context) -> input == null || input.isBlank()
            ? Validate.<String, String>failure("must not be blank").validate(input, context)
            : Validation.success(input);

    private static final Validate<String, Integer> NUMBER = (input, context) -> input != null && input.matches("\\d{1,5}")
            ? Validation.success(Integer.parseInt(input))
            : Validate.<String, Integer>failure("must be a number").validate(input, context);

    private static final Validate<Map<String, String>, String> HOST =
            NOT_BLANK.field("host", "string", m -> m.get("host"));

    private static final Validate<Map<String, String>, Integer> PORT =
            NUMBER.field("port", "int", m -> m.get("port"));

    private static Validate<Map<String, String>, Server> start() {
        return ValidateDoNotation.of(Server.EMPTY);
    }

    private static List<String> paths(Validation<?> validation) {
        return validation.errorsIfPresent().orElseThrow().stream().map(ValidationError::path).toList();
    }

    @Nested
    @DisplayName("apS")
    class ApS {

        private final Validate<Map<String, String>, Server> server = start()
                .pipe(ValidateDoNotation.apS((String host, Server s) -> s.withHost(host), HOST))
                .pipe(ValidateDoNotation.apS((Integer port, Server s) -> s.withPort(port), PORT));

        @Test
        @DisplayName("builds the struct when every field validates")
        void builds() {
            Validation<Server> result = server.validate(Map.of("host", "db", "port", "5432"), CONFIG);

            assertThat(result).isEqualTo(Validation.success(new Server("db", 5432, "")));
        }

        @Test
        @DisplayName("reports every failing field under its own path")
        void aggregatesWithPaths() {
            Validation<Server> result = server.validate(Map.of("port", "many"), CONFIG);

            Errors errors = result.errorsIfPresent().orElseThrow();
            assertThat(errors.messages()).containsExactly("must not be blank", "must be a number");
            assertThat(paths(result)).containsExactly("config.host", "config.port");
        }
    }

    @Nested
    @DisplayName("bind")
    class Bind {

        @Test
        @DisplayName("stops at the first failing stage")
        void shortCircuits() {
            var portCalls = new AtomicInteger();
            Validate<Map<String, String>, Server> server = start()
                    .pipe(ValidateDoNotation.bind((String host, Server s) -> s.withHost(host), s -> HOST))
                    .pipe(ValidateDoNotation.bind((Integer port, Server s) -> s.withPort(port), s -> {
                        portCalls.incrementAndGet();
                        return PORT;
                    }));

            Validation<Server> result = server.validate(Map.of("port", "x"), CONFIG);

            assertThat(paths(result)).containsExactly("config.host");
            assertThat(portCalls).hasValue(0);
        }

        @Test
        @DisplayName("later stages see fields set by earlier ones")
        void seesEarlierFields() {
            Validate<Map<String, String>, Server> server = start()
                    .pipe(ValidateDoNotation.bind((String host, Server s) -> s.withHost(host), s -> HOST))
                    .pipe(ValidateDoNotation.bind((String url, Server s) -> s.withUrl(url),
                            s -> Validate.of("tcp://" + s.host())));

            assertThat(server.validate(Map.of("host", "db"), CONFIG).getOrThrow().url()).isEqualTo("tcp://db");
        }
    }

    @Nested
    @DisplayName("let, letTo and bindTo")
    class Pure {

        @Test
        @DisplayName("let computes a field and letTo stores a constant")
        void letAndLetTo() {
            Validate<Map<String, String>, Server> server = start()
                    .pipe(ValidateDoNotation.apS((String host, Server s) -> s.withHost(host), HOST))
                    .pipe(ValidateDoNotation.letTo((Integer port, Server s) -> s.withPort(port), 80))
                    .pipe(ValidateDoNotation.let((String url, Server s) -> s.withUrl(url),
                            s -> "http://" + s.host() + ":" + s.port()));

            assertThat(server.validate(Map.of("host", "web"), CONFIG).getOrThrow().url()).isEqualTo("http://web:80");
        }

        @Test
        @DisplayName("bindTo starts a struct from a single validated value")
        void bindTo() {
            Validate<Map<String, String>, Server> server = HOST
                    .pipe(ValidateDoNotation.bindTo((String host) -> Server.EMPTY.withHost(host)));

            assertThat(server.validate(Map.of("host", "db"), CONFIG))
                    .isEqualTo(Validation.success(new Server("db", 0, "")));
        }
    }

    @Nested
    @DisplayName("lens variants")
    class LensVariants {

        @Test
        @DisplayName("apSL and letL set and rewrite a field")
        void apSLAndLetL() {
            Validate<Map<String, String>, Server> server = start()
                    .pipe(ValidateDoNotation.apSL(HOST_LENS, HOST))
                    .pipe(ValidateDoNotation.letL(HOST_LENS, String::toUpperCase));

            assertThat(server.validate(Map.of("host", "db"), CONFIG).getOrThrow().host()).isEqualTo("DB");
        }

        @Test
        @DisplayName("bindL receives the current field value")
        void bindL() {
            Validate<Map<String, String>, Server> server = start()
                    .pipe(ValidateDoNotation.letToL(PORT_LENS, 8080))
                    .pipe(ValidateDoNotation.bindL(PORT_LENS, port -> Validate.of(port + 1)));

            assertThat(server.validate(Map.of(), CONFIG).getOrThrow().port()).isEqualTo(8081);
        }

        @Test
        @DisplayName("apSL aggregates errors like apS")
        void apSLAggregates() {
            Validate<Map<String, String>, Server> server = start()
                    .pipe(ValidateDoNotation.apSL(HOST_LENS, HOST))
                    .pipe(ValidateDoNotation.apSL(PORT_LENS, PORT));

            assertThat(paths(server.validate(Map.of(), CONFIG))).containsExactly("config.host", "config.port");
        }
    }

    @Test
    @DisplayName("rejects null stages")
    void rejectsNull() {
        assertThatThrownBy(() -> ValidateDoNotation.apS(null, HOST))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("setter must not be null");
        assertThatThrownBy(() -> start().pipe(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("operator must not be null");
    }
}
