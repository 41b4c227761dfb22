package com.tally.decode;

import com.tally.algebra.Monoid;
import com.tally.algebra.Monoids;
import com.tally.validation.Errors;
import com.tally.validation.Validation;
import com.tally.validation.ValidationError;
import com.tally.validation.ValidationErrorLogger;
import com.tally.validation.Validations;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Constructors and combinators for {@link Decode}.
 * <p>
 * The instance methods on {@code Decode} cover the common cases; the static forms here return
 * {@link Operator}s for use with {@link Decode#pipe(Operator)}, plus the applicative
 * {@link #ap(Decode, Decode)} that has no natural receiver.
 */
public final class Decoders {

    private Decoders() {
        // utility class
    }

    // ---------------------------------------------------------------- constructors

    /** A decoder that ignores its input and always succeeds with {@code a}. */
    public static <I, A> Decode<I, A> of(A a) {
        return input -> Validation.success(a);
    }

    /**
     * A decoder that ignores its input and always fails with {@code errors}.
     *
     * @throws IllegalArgumentException if errors is null
     */
    public static <I, A> Decode<I, A> left(Errors errors) {
        if (errors == null) {
            throw new IllegalArgumentException("errors must not be null");
        }
        return input -> Validation.failure(errors);
    }

    /** A decoder that fails with one error whose offending value is the input. */
    public static <I, A> Decode<I, A> failure(String message) {
        if (message == null) {
            throw new IllegalArgumentException("message must not be null");
        }
        return input -> Validation.failure(ValidationError.of(input, message));
    }

    /** Lifts a plain function, so that it never fails. */
    public static <I, A> Decode<I, A> fromFunction(Function<? super I, ? extends A> f) {
        if (f == null) {
            throw new IllegalArgumentException("f must not be null");
        }
        return input -> Validation.success(f.apply(input));
    }

    // ---------------------------------------------------------------- operators

    public static <I, A, B> Operator<I, A, B> map(Function<? super A, ? extends B> f) {
        return fa -> fa.map(f);
    }

    public static <I, A, B> Operator<I, A, B> chain(Kleisli<I, ? super A, B> f) {
        return fa -> fa.chain(f);
    }

    public static <I, A> Operator<I, A, A> chainLeft(Kleisli<I, Errors, A> f) {
        return fa -> fa.chainLeft(f);
    }

    public static <I, A> Operator<I, A, A> orElse(Kleisli<I, Errors, A> f) {
        return chainLeft(f);
    }

    public static <I, A> Operator<I, A, A> alt(Supplier<? extends Decode<I, A>> second) {
        return first -> first.alt(second);
    }

    /** Pipeable form of {@link #ap(Decode, Decode)}: applies a function decoder to {@code fa}. */
    public static <I, A, B> Operator<I, Function<? super A, ? extends B>, B> ap(Decode<I, A> fa) {
        return ff -> ap(ff, fa);
    }

    // ---------------------------------------------------------------- applicative

    /**
     * Applicative apply. Both {@code ff} and {@code fa} run against the input; there is no
     * short-circuit. When both fail, the errors of {@code ff} come first.
     */
    public static <I, A, B> Decode<I, B> ap(Decode<I, ? extends Function<? super A, ? extends B>> ff,
                                            Decode<I, ? extends A> fa) {
        if (ff == null) {
            throw new IllegalArgumentException("ff must not be null");
        }
        if (fa == null) {
            throw new IllegalArgumentException("fa must not be null");
        }
        return input -> {
            Validation<? extends Function<? super A, ? extends B>> functionResult = ff.decode(input);
            Validation<? extends A> valueResult = fa.decode(input);
            return Validation.ap(functionResult, valueResult);
        };
    }

    /**
     * Combines two independent decoders; both always run and their errors accumulate.
     */
    public static <I, A, B, C> Decode<I, C> map2(Decode<I, A> fa, Decode<I, B> fb,
                                                 BiFunction<? super A, ? super B, ? extends C> f) {
        if (f == null) {
            throw new IllegalArgumentException("f must not be null");
        }
        Decode<I, Function<B, C>> curried = fa.map(a -> b -> f.apply(a, b));
        return ap(curried, fb);
    }

    /**
     * Runs every decoder against the same input and collects the results in order.
     * All decoders run; the errors of every failure are concatenated in list order.
     */
    public static <I, A> Decode<I, List<A>> sequence(List<? extends Decode<I, A>> decoders) {
        if (decoders == null) {
            throw new IllegalArgumentException("decoders must not be null");
        }
        List<Decode<I, A>> copy = List.copyOf(decoders);
        return input -> {
            List<Validation<A>> results = new ArrayList<>(copy.size());
            for (Decode<I, A> decoder : copy) {
                results.add(decoder.decode(input));
            }
            return Validations.sequence(results);
        };
    }

    /** Builds a decoder per element with {@code f} and sequences them. */
    public static <I, T, A> Decode<I, List<A>> traverse(List<T> values, Function<? super T, ? extends Decode<I, A>> f) {
        if (values == null) {
            throw new IllegalArgumentException("values must not be null");
        }
        if (f == null) {
            throw new IllegalArgumentException("f must not be null");
        }
        List<Decode<I, A>> decoders = new ArrayList<>(values.size());
        for (T value : values) {
            decoders.add(f.apply(value));
        }
        return sequence(decoders);
    }

    /**
     * Folds decoders left to right with {@code monoid}, starting from its empty element.
     */
    public static <I, A> Decode<I, A> fold(Monoid<Decode<I, A>> monoid, List<Decode<I, A>> decoders) {
        return Monoids.fold(monoid, decoders);
    }

    // ---------------------------------------------------------------- diagnostics

    /**
     * Wraps {@code decoder} so that failures are written to SLF4J at DEBUG under {@code name}.
     * Results are passed through unchanged.
     */
    public static <I, A> Decode<I, A> logFailures(String name, Decode<I, A> decoder) {
        return logFailures(name, decoder, new ValidationErrorLogger());
    }

    /** As {@link #logFailures(String, Decode)} with an explicit logger. */
    public static <I, A> Decode<I, A> logFailures(String name, Decode<I, A> decoder, ValidationErrorLogger logger) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (decoder == null) {
            throw new IllegalArgumentException("decoder must not be null");
        }
        if (logger == null) {
            throw new IllegalArgumentException("logger must not be null");
        }
        return input -> logger.logIfFailed(name, decoder.decode(input));
    }
}
