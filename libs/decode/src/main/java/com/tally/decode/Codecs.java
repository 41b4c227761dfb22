package com.tally.decode;

import com.tally.algebra.Monoid;
import com.tally.validation.Context;
import com.tally.validation.Validation;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Constructors and combinators for {@link Codec}.
 */
public final class Codecs {

    private Codecs() {
        // utility class
    }

    /**
     * Creates a codec from its parts.
     *
     * @throws IllegalArgumentException if any argument is null
     */
    public static <A, O, I> Codec<A, O, I> of(String name, Validate<I, A> validate,
                                              Function<? super A, ? extends O> encode) {
        if (name == null) {
            throw new IllegalArgumentException("name must not be null");
        }
        if (validate == null) {
            throw new IllegalArgumentException("validate must not be null");
        }
        if (encode == null) {
            throw new IllegalArgumentException("encode must not be null");
        }
        return new SimpleCodec<>(name, validate, encode);
    }

    /**
     * A codec that validates with {@code first} and, when that fails, with the codec produced by
     * {@code second}. The supplier is called only on failure; if both fail their errors are
     * returned in attempt order. Encoding always uses {@code first}. The name is
     * {@code "Alt[<first>]"}.
     *
     * @throws IllegalArgumentException if either argument is null
     */
    public static <A, O, I> Codec<A, O, I> alt(Codec<A, O, I> first, Supplier<? extends Codec<A, O, I>> second) {
        if (first == null) {
            throw new IllegalArgumentException("first must not be null");
        }
        if (second == null) {
            throw new IllegalArgumentException("second must not be null");
        }
        Validate<I, A> validate = first.asValidate().alt(() -> second.get().asValidate());
        return of("Alt[" + first.name() + "]", validate, first::encode);
    }

    /**
     * Priority-list monoid over codecs: {@code concat(c1, c2)} is {@code alt(c1, () -> c2)} and
     * {@code empty()} is the codec produced by {@code zero}.
     *
     * @throws IllegalArgumentException if zero is null
     */
    public static <A, O, I> Monoid<Codec<A, O, I>> altMonoid(Supplier<? extends Codec<A, O, I>> zero) {
        if (zero == null) {
            throw new IllegalArgumentException("zero must not be null");
        }
        return Monoid.ofLazy((c1, c2) -> alt(c1, () -> c2), zero::get);
    }

    /**
     * Sequences two codecs. Validation runs {@code first}, then feeds its value to {@code next}
     * in the same context; encoding runs {@code next.encode} and then {@code first.encode}.
     * The name is {@code "Pipe(<first>, <next>)"}.
     *
     * @throws IllegalArgumentException if either argument is null
     */
    public static <A, B, O, I> Codec<B, O, I> pipe(Codec<A, O, I> first, Codec<B, A, A> next) {
        if (first == null) {
            throw new IllegalArgumentException("first must not be null");
        }
        if (next == null) {
            throw new IllegalArgumentException("next must not be null");
        }
        Validate<I, B> validate = (input, context) -> first.validate(input, context)
                .chain(a -> next.validate(a, context));
        return of("Pipe(" + first.name() + ", " + next.name() + ")", validate,
                b -> first.encode(next.encode(b)));
    }

    private record SimpleCodec<A, O, I>(String name, Validate<I, A> validator,
                                        Function<? super A, ? extends O> encoder) implements Codec<A, O, I> {

        @Override
        public Validation<A> validate(I input, Context context) {
            return validator.validate(input, context);
        }

        @Override
        public O encode(A value) {
            return encoder.apply(value);
        }
    }
}
