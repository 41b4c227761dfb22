package com.tally.decode;

import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Builders that populate a struct field by field inside a {@link Decode} pipeline.
 * <p>
 * A pipeline starts with {@link #of(Object)} and applies operators with
 * {@link Decode#pipe(Operator)}. Stages come in two kinds:
 * <ul>
 *   <li>{@link #bind} is sequential: it may read fields set by earlier stages and stops the
 *       pipeline at its first failure.</li>
 *   <li>{@link #apS} is parallel: its decoder does not see earlier results, always runs, and its
 *       errors are added to those of earlier failed stages.</li>
 * </ul>
 * {@link #let} and {@link #letTo} never fail. Each setter receives the new field value and the
 * current struct, and returns the updated struct.
 *
 * <pre>{@code
 * Decode<Map<String, String>, Person> person = DoNotation.<Map<String, String>, Person>of(Person.EMPTY)
 *         .pipe(DoNotation.apS(Person::withName, nameDecoder))
 *         .pipe(DoNotation.apS(Person::withAge, ageDecoder))
 *         .pipe(DoNotation.let(Person::withGreeting, p -> "Hello " + p.name()));
 * }</pre>
 */
public final class DoNotation {

    private DoNotation() {
        // utility class
    }

    /** Starts a pipeline with an initial struct; always succeeds. */
    public static <I, S> Decode<I, S> of(S empty) {
        return Decoders.of(empty);
    }

    /**
     * Sequential field population. {@code f} receives the struct built so far and its decoder
     * runs against the same input; the decoded value is stored with {@code setter}.
     */
    public static <I, S1, S2, T> Operator<I, S1, S2> bind(BiFunction<? super T, ? super S1, ? extends S2> setter,
                                                          Kleisli<I, ? super S1, T> f) {
        requireNonNull(setter, "setter");
        requireNonNull(f, "f");
        return fa -> fa.chain(s1 -> f.apply(s1).<S2>map(t -> setter.apply(t, s1)));
    }

    /** Pure field population computed from the struct built so far. */
    public static <I, S1, S2, T> Operator<I, S1, S2> let(BiFunction<? super T, ? super S1, ? extends S2> setter,
                                                         Function<? super S1, ? extends T> f) {
        requireNonNull(setter, "setter");
        requireNonNull(f, "f");
        return fa -> fa.map(s1 -> setter.apply(f.apply(s1), s1));
    }

    /** Pure field population with a constant. */
    public static <I, S1, S2, T> Operator<I, S1, S2> letTo(BiFunction<? super T, ? super S1, ? extends S2> setter, T b) {
        requireNonNull(setter, "setter");
        return fa -> fa.map(s1 -> setter.apply(b, s1));
    }

    /** Wraps the decoded value into a new struct, e.g. to start a pipeline from a single field. */
    public static <I, T, S1> Operator<I, T, S1> bindTo(Function<? super T, ? extends S1> setter) {
        requireNonNull(setter, "setter");
        return fa -> fa.map(setter);
    }

    /**
     * Parallel field population. {@code fa} runs against the input regardless of earlier
     * failures; its errors are appended to theirs.
     */
    public static <I, S1, S2, T> Operator<I, S1, S2> apS(BiFunction<? super T, ? super S1, ? extends S2> setter,
                                                         Decode<I, T> fa) {
        requireNonNull(setter, "setter");
        requireNonNull(fa, "fa");
        return fs -> Decoders.ap(fs.map(s1 -> (Function<T, S2>) t -> setter.apply(t, s1)), fa);
    }

    // ---------------------------------------------------------------- lens variants

    /** {@link #bind} through a lens: {@code f} receives the current field value. */
    public static <I, S, T> Operator<I, S, S> bindL(Lens<S, T> lens, Kleisli<I, ? super T, T> f) {
        requireNonNull(lens, "lens");
        requireNonNull(f, "f");
        return DoNotation.<I, S, S, T>bind(lens::set, s -> f.apply(lens.get(s)));
    }

    /** {@link #let} through a lens: {@code f} rewrites the current field value. */
    public static <I, S, T> Operator<I, S, S> letL(Lens<S, T> lens, UnaryOperator<T> f) {
        requireNonNull(lens, "lens");
        requireNonNull(f, "f");
        return DoNotation.<I, S, S, T>let(lens::set, s -> f.apply(lens.get(s)));
    }

    /** {@link #letTo} through a lens. */
    public static <I, S, T> Operator<I, S, S> letToL(Lens<S, T> lens, T b) {
        requireNonNull(lens, "lens");
        return DoNotation.<I, S, S, T>letTo(lens::set, b);
    }

    /** {@link #apS} through a lens. */
    public static <I, S, T> Operator<I, S, S> apSL(Lens<S, T> lens, Decode<I, T> fa) {
        requireNonNull(lens, "lens");
        return DoNotation.<I, S, S, T>apS(lens::set, fa);
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
    }
}
