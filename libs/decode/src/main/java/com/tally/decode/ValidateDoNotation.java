package com.tally.decode;

import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * The {@link DoNotation} builders for {@link Validate}. Stages are applied with
 * {@link Validate#pipe(Function)}; every stage runs with the same input and context, so errors
 * keep the path of the validator they came from.
 */
public final class ValidateDoNotation {

    private ValidateDoNotation() {
        // utility class
    }

    /** Starts a pipeline with an initial struct; always succeeds. */
    public static <I, S> Validate<I, S> of(S empty) {
        return Validate.of(empty);
    }

    /** Sequential field population; stops at the first failure. */
    public static <I, S1, S2, T> Function<Validate<I, S1>, Validate<I, S2>> bind(
            BiFunction<? super T, ? super S1, ? extends S2> setter,
            Function<? super S1, ? extends Validate<I, T>> f) {
        requireNonNull(setter, "setter");
        requireNonNull(f, "f");
        return fa -> fa.chain(s1 -> f.apply(s1).<S2>map(t -> setter.apply(t, s1)));
    }

    /** Pure field population computed from the struct built so far. */
    public static <I, S1, S2, T> Function<Validate<I, S1>, Validate<I, S2>> let(
            BiFunction<? super T, ? super S1, ? extends S2> setter,
            Function<? super S1, ? extends T> f) {
        requireNonNull(setter, "setter");
        requireNonNull(f, "f");
        return fa -> fa.map(s1 -> setter.apply(f.apply(s1), s1));
    }

    /** Pure field population with a constant. */
    public static <I, S1, S2, T> Function<Validate<I, S1>, Validate<I, S2>> letTo(
            BiFunction<? super T, ? super S1, ? extends S2> setter, T b) {
        requireNonNull(setter, "setter");
        return fa -> fa.map(s1 -> setter.apply(b, s1));
    }

    /** Wraps the validated value into a new struct. */
    public static <I, T, S1> Function<Validate<I, T>, Validate<I, S1>> bindTo(Function<? super T, ? extends S1> setter) {
        requireNonNull(setter, "setter");
        return fa -> fa.map(setter);
    }

    /** Parallel field population; {@code fa} always runs and its errors are appended. */
    public static <I, S1, S2, T> Function<Validate<I, S1>, Validate<I, S2>> apS(
            BiFunction<? super T, ? super S1, ? extends S2> setter, Validate<I, T> fa) {
        requireNonNull(setter, "setter");
        requireNonNull(fa, "fa");
        return fs -> Validate.ap(fs.map(s1 -> (Function<T, S2>) t -> setter.apply(t, s1)), fa);
    }

    public static <I, S, T> Function<Validate<I, S>, Validate<I, S>> bindL(
            Lens<S, T> lens, Function<? super T, ? extends Validate<I, T>> f) {
        requireNonNull(lens, "lens");
        requireNonNull(f, "f");
        return ValidateDoNotation.<I, S, S, T>bind(lens::set, s -> f.apply(lens.get(s)));
    }

    public static <I, S, T> Function<Validate<I, S>, Validate<I, S>> letL(Lens<S, T> lens, UnaryOperator<T> f) {
        requireNonNull(lens, "lens");
        requireNonNull(f, "f");
        return ValidateDoNotation.<I, S, S, T>let(lens::set, s -> f.apply(lens.get(s)));
    }

    public static <I, S, T> Function<Validate<I, S>, Validate<I, S>> letToL(Lens<S, T> lens, T b) {
        requireNonNull(lens, "lens");
        return ValidateDoNotation.<I, S, S, T>letTo(lens::set, b);
    }

    public static <I, S, T> Function<Validate<I, S>, Validate<I, S>> apSL(Lens<S, T> lens, Validate<I, T> fa) {
        requireNonNull(lens, "lens");
        return ValidateDoNotation.<I, S, S, T>apS(lens::set, fa);
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
    }
}
